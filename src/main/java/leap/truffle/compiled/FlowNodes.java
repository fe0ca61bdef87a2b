package leap.truffle.compiled;

import leap.truffle.core.Variables;
import leap.truffle.runtime.FailStepException;
import leap.truffle.runtime.LeapRaisedException;
import leap.truffle.runtime.StepEvent;
import leap.truffle.runtime.Values;

/**
 * 改变步进流程的语句：状态转移、步拒绝、用户异常与结果通知。
 */
public final class FlowNodes {
  private FlowNodes() {}

  public static final class TransitionNode extends StatementNode {
    private final String nextState;

    public TransitionNode(String nextState) {
      this.nextState = nextState;
    }

    @Override
    public void execute(CompiledFrame frame) {
      frame.program().setNextState(nextState);
    }
  }

  public static final class FailStepNode extends StatementNode {
    private final String instructionId;

    public FailStepNode(String instructionId) {
      this.instructionId = instructionId;
    }

    @Override
    public void execute(CompiledFrame frame) {
      throw new FailStepException(instructionId);
    }
  }

  public static final class RaiseNode extends StatementNode {
    private final String condition;
    private final String message;

    public RaiseNode(String condition, String message) {
      this.condition = condition;
      this.message = message;
    }

    @Override
    public void execute(CompiledFrame frame) {
      throw new LeapRaisedException(condition, message);
    }
  }

  /**
   * 输出通道写好之后产生 StateComputed 事件，状态值为快照。
   */
  public static final class YieldNotifyNode extends StatementNode {
    private final String componentId;

    public YieldNotifyNode(String componentId) {
      this.componentId = componentId;
    }

    @Override
    public void execute(CompiledFrame frame) {
      String timeId = (String) frame.read(Variables.retTimeId(componentId));
      double t = Values.asDouble(frame.read(Variables.retTime(componentId)));
      Object value = Values.copy(frame.read(Variables.retState(componentId)));
      frame.program().emit(new StepEvent.StateComputed(t, timeId, componentId, value));
    }
  }
}
