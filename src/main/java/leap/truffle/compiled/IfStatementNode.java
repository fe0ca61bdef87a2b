package leap.truffle.compiled;

import leap.truffle.nodes.LeapExpressionNode;
import leap.truffle.nodes.Profiler;
import leap.truffle.runtime.LeapConfig;
import leap.truffle.runtime.Values;
import com.oracle.truffle.api.CompilerDirectives.TruffleBoundary;
import java.util.logging.Logger;

/**
 * 条件分支语句。
 */
public final class IfStatementNode extends StatementNode {
  private static final Logger logger = Logger.getLogger(IfStatementNode.class.getName());

  @Child private LeapExpressionNode condition;
  @Child private StatementNode thenNode;
  @Child private StatementNode elseNode;

  public IfStatementNode(LeapExpressionNode condition, StatementNode thenNode, StatementNode elseNode) {
    this.condition = condition;
    this.thenNode = thenNode;
    this.elseNode = elseNode;
  }

  @Override
  public void execute(CompiledFrame frame) {
    Profiler.inc("if");
    boolean taken = Values.toBool(condition.executeGeneric(frame));
    if (LeapConfig.DEBUG) {
      traceCondition(taken);
    }
    StatementNode target = taken ? thenNode : elseNode;
    if (target != null) {
      target.execute(frame);
    }
  }

  @TruffleBoundary
  private static void traceCondition(boolean taken) {
    logger.info("if condition => " + taken);
  }
}
