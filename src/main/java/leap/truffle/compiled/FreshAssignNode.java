package leap.truffle.compiled;

import leap.truffle.nodes.LeapExpressionNode;
import leap.truffle.nodes.Profiler;
import leap.truffle.runtime.ErrorMessages;
import leap.truffle.runtime.EvaluationException;
import java.util.Arrays;

/**
 * 右侧不读取被赋值变量：保证独占缓冲区后直接写入。
 */
public final class FreshAssignNode extends StatementNode {
  private final SlotRef target;
  private final int size;
  @Child private LeapExpressionNode value;

  public FreshAssignNode(SlotRef target, LeapExpressionNode value, int size) {
    this.target = target;
    this.value = value;
    this.size = size;
  }

  @Override
  public void execute(CompiledFrame frame) {
    Profiler.inc("assign_fresh");
    RefCountedBuffer buffer = BufferProtocol.ensureUnique(frame.heap(), frame.getBuffer(target), size);
    frame.set(target, buffer);
    store(value.executeGeneric(frame), buffer.getData());
  }

  /**
   * 把表达式结果写入数组，标量按元素广播。
   */
  static void store(Object result, double[] into) {
    if (result instanceof double[] arr) {
      if (arr.length != into.length) {
        throw new EvaluationException(ErrorMessages.vectorLengthMismatch(into.length, arr.length));
      }
      System.arraycopy(arr, 0, into, 0, arr.length);
    } else if (result instanceof Double d) {
      Arrays.fill(into, d);
    } else {
      throw new EvaluationException(ErrorMessages.typeExpectedGot("ODE component",
          result == null ? "null" : result.getClass().getSimpleName()));
    }
  }
}
