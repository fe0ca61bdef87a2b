package leap.truffle.core;

import java.util.Set;
import java.util.TreeSet;
import leap.truffle.runtime.ErrorMessages;

/**
 * 读写了没有声明数值布局的 ODE 分量。
 */
public final class UndeclaredComponentException extends ProgramValidationException {
  private static final long serialVersionUID = 1L;

  private final Set<String> componentIds;

  public UndeclaredComponentException(Set<String> componentIds) {
    super(ErrorMessages.undeclaredComponents(componentIds));
    this.componentIds = Set.copyOf(new TreeSet<>(componentIds));
  }

  public Set<String> getComponentIds() {
    return componentIds;
  }
}
