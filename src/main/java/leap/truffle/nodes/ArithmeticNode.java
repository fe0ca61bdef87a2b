package leap.truffle.nodes;

import leap.truffle.runtime.Values;
import com.oracle.truffle.api.nodes.ExplodeLoop;

/**
 * n 元加法 / 乘法节点，按元素广播。
 */
public final class ArithmeticNode extends LeapExpressionNode {
  public enum Op { SUM, PRODUCT }

  private final Op op;
  @Children private final LeapExpressionNode[] operands;

  public ArithmeticNode(Op op, LeapExpressionNode[] operands) {
    this.op = op;
    this.operands = operands;
  }

  @Override
  @ExplodeLoop
  public Object executeGeneric(EvalScope scope) {
    Profiler.inc(op == Op.SUM ? "sum" : "product");
    Object acc = op == Op.SUM ? (Object) 0.0 : (Object) 1.0;
    for (int i = 0; i < operands.length; i++) {
      Object v = operands[i].executeGeneric(scope);
      acc = op == Op.SUM ? Values.add(acc, v) : Values.multiply(acc, v);
    }
    return acc;
  }
}
