package leap.truffle.nodes;

import leap.truffle.core.IrModel;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * IR 表达式到节点树的构建器，按表达式对象身份缓存。
 */
public final class ExpressionNodes {
  private final Map<IrModel.Expr, LeapExpressionNode> cache = new IdentityHashMap<>();

  public LeapExpressionNode get(IrModel.Expr expr) {
    LeapExpressionNode node = cache.get(expr);
    if (node == null) {
      node = build(expr);
      cache.put(expr, node);
    }
    return node;
  }

  public Object evaluate(IrModel.Expr expr, EvalScope scope) {
    return get(expr).executeGeneric(scope);
  }

  /**
   * 构建新的节点树（不经缓存）。
   */
  public static LeapExpressionNode build(IrModel.Expr expr) {
    if (expr instanceof IrModel.Constant c) {
      return new ConstantNode(c.value);
    } else if (expr instanceof IrModel.BoolConstant b) {
      return new ConstantNode(b.value);
    } else if (expr instanceof IrModel.Variable v) {
      return new VariableNode(v.name);
    } else if (expr instanceof IrModel.Sum s) {
      return new ArithmeticNode(ArithmeticNode.Op.SUM, buildAll(s.children));
    } else if (expr instanceof IrModel.Product p) {
      return new ArithmeticNode(ArithmeticNode.Op.PRODUCT, buildAll(p.children));
    } else if (expr instanceof IrModel.Quotient q) {
      return new BinaryNode(BinaryNode.Op.QUOTIENT, build(q.numerator), build(q.denominator));
    } else if (expr instanceof IrModel.Power p) {
      return new BinaryNode(BinaryNode.Op.POWER, build(p.base), build(p.exponent));
    } else if (expr instanceof IrModel.Comparison c) {
      return new ComparisonNode(c.operator, build(c.left), build(c.right));
    } else if (expr instanceof IrModel.LogicalAnd a) {
      return new LogicalNode(LogicalNode.Op.AND, buildAll(a.children));
    } else if (expr instanceof IrModel.LogicalOr o) {
      return new LogicalNode(LogicalNode.Op.OR, buildAll(o.children));
    } else if (expr instanceof IrModel.LogicalNot n) {
      return new LogicalNode(LogicalNode.Op.NOT, new LeapExpressionNode[] {build(n.child)});
    } else if (expr instanceof IrModel.Call call) {
      List<String> names = new ArrayList<>(call.kwParameters.keySet());
      List<IrModel.Expr> kwExprs = new ArrayList<>(call.kwParameters.values());
      return new CallNode(call.function, buildAll(call.parameters),
          names.toArray(new String[0]), buildAll(kwExprs));
    }
    throw new IllegalArgumentException("Unsupported expression: " + expr);
  }

  private static LeapExpressionNode[] buildAll(List<IrModel.Expr> exprs) {
    LeapExpressionNode[] nodes = new LeapExpressionNode[exprs.size()];
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = build(exprs.get(i));
    }
    return nodes;
  }
}
