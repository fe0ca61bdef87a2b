package leap.truffle.nodes;

import leap.truffle.runtime.Values;
import com.oracle.truffle.api.nodes.ExplodeLoop;

/**
 * 短路 and / or，以及 not。
 */
public final class LogicalNode extends LeapExpressionNode {
  public enum Op { AND, OR, NOT }

  private final Op op;
  @Children private final LeapExpressionNode[] operands;

  public LogicalNode(Op op, LeapExpressionNode[] operands) {
    this.op = op;
    this.operands = operands;
  }

  @Override
  @ExplodeLoop
  public Object executeGeneric(EvalScope scope) {
    Profiler.inc("logical");
    if (op == Op.NOT) {
      return !Values.toBool(operands[0].executeGeneric(scope));
    }
    boolean shortCircuit = op == Op.OR;
    for (int i = 0; i < operands.length; i++) {
      if (Values.toBool(operands[i].executeGeneric(scope)) == shortCircuit) {
        return shortCircuit;
      }
    }
    return !shortCircuit;
  }
}
