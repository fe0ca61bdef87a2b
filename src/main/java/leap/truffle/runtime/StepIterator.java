package leap.truffle.runtime;

import java.util.*;
import java.util.logging.Logger;

/**
 * 步进循环：把逐步执行包装为惰性的事件序列。
 *
 * 每步成功时依次给出本步的 StateComputed 事件与一个 StepCompleted；
 * 被拒绝时丢弃本步已计算的事件，只给出 StepFailed，且不计入步数。
 * 解释器与编译后端共用本循环。
 */
public final class StepIterator implements Iterator<StepEvent> {
  private static final Logger logger = Logger.getLogger(StepIterator.class.getName());

  /**
   * 可逐步执行的后端。
   */
  public interface Stepper {
    double currentTime();

    /** 下一步将要执行的状态名。 */
    String pendingState();

    /**
     * 执行一步并返回本步产生的事件。
     *
     * @throws FailStepException 步被拒绝；实现需保证 pendingState() 仍指向被拒绝的状态
     */
    List<StepEvent> runSingleStep();
  }

  private final Stepper stepper;
  private final Double tEnd;
  private final Integer maxSteps;
  private final Deque<StepEvent> buffer = new ArrayDeque<>();
  private int steps;
  private boolean finished;

  public StepIterator(Stepper stepper, Double tEnd, Integer maxSteps) {
    this.stepper = Objects.requireNonNull(stepper, "stepper");
    this.tEnd = tEnd;
    this.maxSteps = maxSteps;
  }

  @Override
  public boolean hasNext() {
    while (buffer.isEmpty() && !finished) {
      advance();
    }
    return !buffer.isEmpty();
  }

  @Override
  public StepEvent next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return buffer.poll();
  }

  private void advance() {
    if (tEnd != null && stepper.currentTime() >= tEnd) {
      finished = true;
      return;
    }
    if (maxSteps != null && steps >= maxSteps) {
      finished = true;
      return;
    }
    String current = stepper.pendingState();
    List<StepEvent> events;
    try {
      events = stepper.runSingleStep();
    } catch (FailStepException e) {
      logger.info("step rejected in state '" + current + "' at t=" + stepper.currentTime()
          + " (" + e.getMessage() + ")");
      buffer.add(new StepEvent.StepFailed(stepper.currentTime()));
      return;
    }
    buffer.addAll(events);
    buffer.add(new StepEvent.StepCompleted(stepper.currentTime(), current, stepper.pendingState()));
    steps++;
  }

  /**
   * 取尽剩余事件。
   */
  public List<StepEvent> drain() {
    List<StepEvent> out = new ArrayList<>();
    while (hasNext()) {
      out.add(next());
    }
    return out;
  }
}
