package leap.truffle.nodes;

import leap.truffle.runtime.FunctionRegistry;

/**
 * 表达式求值所需的环境：变量读取与函数查找。
 *
 * 解释器上下文、编译后端的帧和求解器的临时上下文都实现该接口。
 */
public interface EvalScope {

  /**
   * 读取变量当前值。
   *
   * @throws leap.truffle.runtime.EvaluationException 变量尚未赋值
   */
  Object read(String name);

  FunctionRegistry functions();
}
