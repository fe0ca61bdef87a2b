package leap.truffle.core;

import java.util.Objects;

/**
 * 变量的符号种类：标量（实/复）、布尔或 ODE 分量。
 */
public abstract sealed class SymbolKind permits SymbolKind.Scalar, SymbolKind.BooleanKind, SymbolKind.OdeComponent {

  public static final Scalar REAL = new Scalar(true);
  public static final Scalar COMPLEX = new Scalar(false);
  public static final BooleanKind BOOLEAN = new BooleanKind();

  public static OdeComponent odeComponent(String componentId) {
    return new OdeComponent(componentId);
  }

  public static final class Scalar extends SymbolKind {
    private final boolean realValued;

    private Scalar(boolean realValued) {
      this.realValued = realValued;
    }

    public boolean isRealValued() {
      return realValued;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Scalar s && s.realValued == realValued;
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(realValued);
    }

    @Override
    public String toString() {
      return realValued ? "Scalar(real)" : "Scalar(complex)";
    }
  }

  public static final class BooleanKind extends SymbolKind {
    private BooleanKind() {}

    @Override
    public boolean equals(Object o) {
      return o instanceof BooleanKind;
    }

    @Override
    public int hashCode() {
      return 7;
    }

    @Override
    public String toString() {
      return "Boolean";
    }
  }

  public static final class OdeComponent extends SymbolKind {
    private final String componentId;

    private OdeComponent(String componentId) {
      this.componentId = Objects.requireNonNull(componentId, "componentId");
    }

    public String getComponentId() {
      return componentId;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof OdeComponent c && c.componentId.equals(componentId);
    }

    @Override
    public int hashCode() {
      return componentId.hashCode();
    }

    @Override
    public String toString() {
      return "ODEComponent(" + componentId + ")";
    }
  }
}
