package leap.truffle.runtime;

/**
 * 由 Raise 指令触发的致命条件，原样传播给调用方。
 */
public final class LeapRaisedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String condition;
  private final String leapMessage;

  public LeapRaisedException(String condition, String message) {
    super(condition + (message != null ? ": " + message : ""));
    this.condition = condition;
    this.leapMessage = message;
  }

  public String getCondition() {
    return condition;
  }

  public String getLeapMessage() {
    return leapMessage;
  }
}
