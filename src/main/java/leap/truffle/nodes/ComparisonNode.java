package leap.truffle.nodes;

import leap.truffle.runtime.Values;

/**
 * 标量比较节点。
 */
public final class ComparisonNode extends LeapExpressionNode {
  private final String operator;
  @Child private LeapExpressionNode left;
  @Child private LeapExpressionNode right;

  public ComparisonNode(String operator, LeapExpressionNode left, LeapExpressionNode right) {
    this.operator = operator;
    this.left = left;
    this.right = right;
  }

  @Override
  public Object executeGeneric(EvalScope scope) {
    Profiler.inc("compare");
    return Values.compare(operator, left.executeGeneric(scope), right.executeGeneric(scope));
  }
}
