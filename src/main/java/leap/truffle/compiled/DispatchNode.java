package leap.truffle.compiled;

import leap.truffle.nodes.Profiler;
import java.util.List;

/**
 * 非结构区间的标签分派循环：从标签 0 开始，直到某个分支把标签设为负数。
 */
public final class DispatchNode extends StatementNode {
  @Children private final StatementNode[] cases;

  public DispatchNode(List<StatementNode> cases) {
    this.cases = cases.toArray(new StatementNode[0]);
  }

  @Override
  public void execute(CompiledFrame frame) {
    Profiler.inc("dispatch");
    frame.label = 0;
    while (frame.label >= 0) {
      int current = frame.label;
      if (current >= cases.length) {
        throw new IllegalStateException("dispatch label out of range: " + current);
      }
      cases[current].execute(frame);
    }
  }
}
