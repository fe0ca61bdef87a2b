package leap.truffle.compiled;

import leap.truffle.nodes.LeapExpressionNode;
import leap.truffle.nodes.Profiler;
import leap.truffle.runtime.Values;

/**
 * 标量、布尔与时间 id 的赋值。
 */
public final class ScalarAssignNode extends StatementNode {
  private final SlotRef target;
  @Child private LeapExpressionNode value;

  public ScalarAssignNode(SlotRef target, LeapExpressionNode value) {
    this.target = target;
    this.value = value;
  }

  @Override
  public void execute(CompiledFrame frame) {
    Profiler.inc("assign");
    frame.set(target, Values.normalize(value.executeGeneric(frame)));
  }
}
