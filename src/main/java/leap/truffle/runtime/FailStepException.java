package leap.truffle.runtime;

import com.oracle.truffle.api.nodes.ControlFlowException;

/**
 * 步拒绝信号：可恢复，由步进循环捕获后丢弃本步的部分结果。
 */
public final class FailStepException extends ControlFlowException {
  private static final long serialVersionUID = 1L;

  private final String instructionId;

  public FailStepException(String instructionId) {
    this.instructionId = instructionId;
  }

  public String getInstructionId() {
    return instructionId;
  }

  @Override
  public String getMessage() {
    return "step rejected by " + instructionId;
  }
}
