package leap.truffle.nodes;

import com.oracle.truffle.api.nodes.Node;
import com.oracle.truffle.api.nodes.UnexpectedResultException;

/**
 * IR 表达式节点的抽象基类
 *
 * 节点树由 {@link ExpressionNodes} 为每个表达式构建一次并缓存，解释器与编译后端共用。
 */
public abstract class LeapExpressionNode extends Node {

  /**
   * 执行此节点并返回结果（Double、Boolean 或 double[]）
   */
  public abstract Object executeGeneric(EvalScope scope);

  /**
   * 执行此节点并返回 double 结果
   *
   * @throws UnexpectedResultException 如果结果不是标量
   */
  public double executeDouble(EvalScope scope) throws UnexpectedResultException {
    Object result = executeGeneric(scope);
    if (result instanceof Double) {
      return (double) result;
    }
    throw new UnexpectedResultException(result);
  }

  /**
   * 执行此节点并返回 boolean 结果
   *
   * @throws UnexpectedResultException 如果结果不是布尔值
   */
  public boolean executeBoolean(EvalScope scope) throws UnexpectedResultException {
    Object result = executeGeneric(scope);
    if (result instanceof Boolean) {
      return (boolean) result;
    }
    throw new UnexpectedResultException(result);
  }
}
