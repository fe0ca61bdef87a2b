package leap.truffle.runtime;

/**
 * 表达式求值错误：类型不匹配、向量长度不一致、读取未初始化变量。
 */
public final class EvaluationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public EvaluationException(String message) {
    super(message);
  }
}
