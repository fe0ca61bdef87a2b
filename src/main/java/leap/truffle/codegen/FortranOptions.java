package leap.truffle.codegen;

import leap.truffle.runtime.LeapConfig;
import java.util.*;

/**
 * Fortran 后端选项。
 */
public final class FortranOptions {
  private final String moduleName;
  private final Map<String, ComponentLayout> componentLayouts;
  private final List<String> modulePreamble;
  private final String realScalarKind;
  private final String complexScalarKind;
  private final boolean useComplexScalars;
  private final String callBeforeStateUpdate;
  private final String callAfterStateUpdate;
  private final List<String> extraArguments;
  private final List<String> extraArgumentDecl;
  private final boolean trace;
  private final int lineWidth;

  private FortranOptions(Builder b) {
    this.moduleName = b.moduleName;
    this.componentLayouts = Collections.unmodifiableMap(new LinkedHashMap<>(b.componentLayouts));
    this.modulePreamble = List.copyOf(b.modulePreamble);
    this.realScalarKind = b.realScalarKind;
    this.complexScalarKind = b.complexScalarKind;
    this.useComplexScalars = b.useComplexScalars;
    this.callBeforeStateUpdate = b.callBeforeStateUpdate;
    this.callAfterStateUpdate = b.callAfterStateUpdate;
    this.extraArguments = List.copyOf(b.extraArguments);
    this.extraArgumentDecl = List.copyOf(b.extraArgumentDecl);
    this.trace = b.trace;
    this.lineWidth = b.lineWidth;
  }

  public static Builder builder(String moduleName) {
    return new Builder(moduleName);
  }

  public String getModuleName() { return moduleName; }
  public Map<String, ComponentLayout> getComponentLayouts() { return componentLayouts; }
  public List<String> getModulePreamble() { return modulePreamble; }
  public String getRealScalarKind() { return realScalarKind; }
  public String getComplexScalarKind() { return complexScalarKind; }
  public boolean isUseComplexScalars() { return useComplexScalars; }
  /** 状态更新前调用的函数标识符，可为 null。 */
  public String getCallBeforeStateUpdate() { return callBeforeStateUpdate; }
  public String getCallAfterStateUpdate() { return callAfterStateUpdate; }
  public List<String> getExtraArguments() { return extraArguments; }
  public List<String> getExtraArgumentDecl() { return extraArgumentDecl; }
  public boolean isTrace() { return trace; }
  public int getLineWidth() { return lineWidth; }

  public static final class Builder {
    private final String moduleName;
    private final Map<String, ComponentLayout> componentLayouts = new LinkedHashMap<>();
    private final List<String> modulePreamble = new ArrayList<>();
    private String realScalarKind = "8";
    private String complexScalarKind = "8";
    private boolean useComplexScalars = true;
    private String callBeforeStateUpdate;
    private String callAfterStateUpdate;
    private final List<String> extraArguments = new ArrayList<>();
    private final List<String> extraArgumentDecl = new ArrayList<>();
    private boolean trace = LeapConfig.CODEGEN_TRACE;
    private int lineWidth = LeapConfig.FORTRAN_LINE_WIDTH;

    private Builder(String moduleName) {
      this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
    }

    public Builder component(String componentId, ComponentLayout layout) {
      componentLayouts.put(componentId, layout);
      return this;
    }

    public Builder preamble(String... lines) {
      modulePreamble.addAll(Arrays.asList(lines));
      return this;
    }

    public Builder realScalarKind(String kind) {
      this.realScalarKind = kind;
      return this;
    }

    public Builder complexScalarKind(String kind) {
      this.complexScalarKind = kind;
      return this;
    }

    public Builder useComplexScalars(boolean use) {
      this.useComplexScalars = use;
      return this;
    }

    public Builder callBeforeStateUpdate(String functionId) {
      this.callBeforeStateUpdate = functionId;
      return this;
    }

    public Builder callAfterStateUpdate(String functionId) {
      this.callAfterStateUpdate = functionId;
      return this;
    }

    /**
     * 追加到每个生成子程序参数表前部的参数及其声明。
     */
    public Builder extraArgument(String name, String declaration) {
      extraArguments.add(name);
      extraArgumentDecl.add(declaration);
      return this;
    }

    public Builder trace(boolean trace) {
      this.trace = trace;
      return this;
    }

    public Builder lineWidth(int lineWidth) {
      if (lineWidth < 20) {
        throw new IllegalArgumentException("line width too small: " + lineWidth);
      }
      this.lineWidth = lineWidth;
      return this;
    }

    public FortranOptions build() {
      return new FortranOptions(this);
    }
  }
}
