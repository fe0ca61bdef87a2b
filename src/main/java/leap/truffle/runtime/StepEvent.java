package leap.truffle.runtime;

/**
 * 步进过程中产生的可观察事件。
 */
public sealed interface StepEvent permits StepEvent.StateComputed, StepEvent.StepCompleted, StepEvent.StepFailed {

  double t();

  /** YieldState 产生的结果。stateComponent 为 Double 或 double[]。 */
  record StateComputed(double t, String timeId, String componentId, Object stateComponent) implements StepEvent {}

  record StepCompleted(double t, String currentState, String nextState) implements StepEvent {}

  record StepFailed(double t) implements StepEvent {}
}
