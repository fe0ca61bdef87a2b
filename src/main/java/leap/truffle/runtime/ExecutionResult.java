package leap.truffle.runtime;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 单条指令的执行结果：可选的可观察事件，以及新近被要求的指令 id（仅 If 产生）。
 */
public final class ExecutionResult<E> {
  private static final ExecutionResult<?> NONE = new ExecutionResult<>(null, Set.of());

  private final E event;
  private final Set<String> newDependencies;

  private ExecutionResult(E event, Set<String> newDependencies) {
    this.event = event;
    this.newDependencies = newDependencies;
  }

  @SuppressWarnings("unchecked")
  public static <E> ExecutionResult<E> none() {
    return (ExecutionResult<E>) NONE;
  }

  public static <E> ExecutionResult<E> event(E event) {
    return new ExecutionResult<>(event, Set.of());
  }

  public static <E> ExecutionResult<E> require(Set<String> ids) {
    return new ExecutionResult<>(null, Collections.unmodifiableSet(new LinkedHashSet<>(ids)));
  }

  public E getEvent() {
    return event;
  }

  public Set<String> getNewDependencies() {
    return newDependencies;
  }
}
