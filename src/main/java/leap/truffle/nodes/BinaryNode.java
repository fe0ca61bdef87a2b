package leap.truffle.nodes;

import leap.truffle.runtime.Values;

/**
 * 商与幂。
 */
public final class BinaryNode extends LeapExpressionNode {
  public enum Op { QUOTIENT, POWER }

  private final Op op;
  @Child private LeapExpressionNode left;
  @Child private LeapExpressionNode right;

  public BinaryNode(Op op, LeapExpressionNode left, LeapExpressionNode right) {
    this.op = op;
    this.left = left;
    this.right = right;
  }

  @Override
  public Object executeGeneric(EvalScope scope) {
    Profiler.inc(op == Op.QUOTIENT ? "quotient" : "power");
    Object a = left.executeGeneric(scope);
    Object b = right.executeGeneric(scope);
    return op == Op.QUOTIENT ? Values.divide(a, b) : Values.power(a, b);
  }
}
