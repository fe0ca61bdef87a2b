package leap.truffle.compiled;

import leap.truffle.nodes.Profiler;
import leap.truffle.runtime.LeapConfig;
import com.oracle.truffle.api.CompilerDirectives.TruffleBoundary;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import java.util.List;
import java.util.logging.Logger;

/**
 * 语句序列节点 - 顺序执行子语句。
 */
public final class SequenceNode extends StatementNode {
  private static final Logger logger = Logger.getLogger(SequenceNode.class.getName());

  @Children private final StatementNode[] statements;

  public SequenceNode(List<StatementNode> statements) {
    this.statements = statements.toArray(new StatementNode[0]);
  }

  @Override
  @ExplodeLoop
  public void execute(CompiledFrame frame) {
    Profiler.inc("sequence");
    for (int i = 0; i < statements.length; i++) {
      if (LeapConfig.DEBUG) {
        traceStatement(i);
      }
      statements[i].execute(frame);
    }
  }

  @TruffleBoundary
  private void traceStatement(int i) {
    logger.info("stmt[" + i + "]=" + statements[i].getClass().getSimpleName());
  }

  public int size() {
    return statements.length;
  }
}
