package leap.truffle.compiled;

import leap.truffle.nodes.LeapExpressionNode;
import leap.truffle.nodes.Profiler;

/**
 * 自引用赋值 {@code a = f(a)}：结果先写入临时数组，再接入 a。
 */
public final class SwapAssignNode extends StatementNode {
  private final SlotRef target;
  private final int size;
  @Child private LeapExpressionNode value;

  public SwapAssignNode(SlotRef target, LeapExpressionNode value, int size) {
    this.target = target;
    this.value = value;
    this.size = size;
  }

  @Override
  public void execute(CompiledFrame frame) {
    Profiler.inc("assign_swap");
    BufferHeap heap = frame.heap();
    double[] temp = heap.allocateData(size);
    FreshAssignNode.store(value.executeGeneric(frame), temp);
    frame.set(target, BufferProtocol.swapIn(heap, frame.getBuffer(target), temp));
  }
}
