package leap.truffle.core;

/**
 * 程序校验错误：在执行或代码生成开始之前报告，属于致命错误。
 */
public class ProgramValidationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ProgramValidationException(String message) {
    super(message);
  }

  public ProgramValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
