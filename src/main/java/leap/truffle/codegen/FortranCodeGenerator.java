package leap.truffle.codegen;

import leap.truffle.core.IrModel;
import leap.truffle.core.ProgramValidationException;
import leap.truffle.core.SymbolKind;
import leap.truffle.core.UndeclaredComponentException;
import leap.truffle.core.Variables;
import leap.truffle.runtime.ErrorMessages;
import leap.truffle.runtime.FunctionRegistry;
import leap.truffle.runtime.LeapFunction;
import java.util.*;

/**
 * Fortran 代码生成器
 *
 * 输出一个 Fortran 模块：
 * <ul>
 *   <li>时间 id 与状态 id 的整数常量</li>
 *   <li>{@code leap_state_type}：全部全局符号及其引用计数指针</li>
 *   <li>每个程序状态一个子程序 {@code leap_state_func_<state>}</li>
 *   <li>{@code initialize}（每个全局符号一个可选参数）与 {@code shutdown}（报告泄漏）</li>
 * </ul>
 *
 * ODE 分量是带引用计数的指针数组，赋值遵循基类判定的别名/独占/交换协议。
 */
public final class FortranCodeGenerator extends StructuredCodeGenerator<String> {
  public static final String LANGUAGE = "fortran";

  private final FortranOptions options;
  private final FortranNameManager names = new FortranNameManager();
  private final FortranExpressionRenderer renderer = new FortranExpressionRenderer(names);
  private final FortranEmitter moduleEmitter = new FortranEmitter();
  private FortranEmitter declarations;
  private FortranEmitter body;
  private boolean labelDeclared;
  private boolean caseOpen;

  public FortranCodeGenerator(FortranOptions options, FunctionRegistry functions) {
    super(functions);
    this.options = options;
  }

  @Override
  protected Set<String> declaredComponents() {
    return options.getComponentLayouts().keySet();
  }

  private FortranEmitter out() {
    return body != null ? body : moduleEmitter;
  }

  private void emit(String line) {
    out().emit(line);
  }

  private void emitTrace(String line) {
    if (options.isTrace()) {
      emit("write(*,*) '" + line.replace("'", "''") + "'");
    }
  }

  private void emitTraceable(String line) {
    emitTrace(line);
    emit(line);
  }

  private void ifBegin(String condition) {
    emit("if (" + condition + ") then");
    out().indent();
  }

  private void elseBegin() {
    out().dedent();
    emit("else");
    out().indent();
  }

  private void ifEnd() {
    out().dedent();
    emit("end if");
  }

  // ---------------------------------------------------------------------------
  // 模块框架
  // ---------------------------------------------------------------------------

  @Override
  protected void beginEmit() {
    moduleEmitter.emit("module " + options.getModuleName());
    moduleEmitter.indent();
    for (String line : options.getModulePreamble()) {
      moduleEmitter.emit(line);
    }
    if (!options.getModulePreamble().isEmpty()) {
      moduleEmitter.emit("");
    }
    moduleEmitter.emit("implicit none");
    moduleEmitter.emit("");

    for (Map.Entry<String, Integer> e : getTimeIds().entrySet()) {
      moduleEmitter.emit("integer, parameter :: " + timeIdName(e.getKey()) + " = " + e.getValue());
    }
    moduleEmitter.emit("");
    for (Map.Entry<String, Integer> e : getStateIds().entrySet()) {
      moduleEmitter.emit("integer, parameter :: " + stateIdName(e.getKey()) + " = " + e.getValue());
    }
    moduleEmitter.emit("");

    moduleEmitter.emit("type leap_state_type");
    moduleEmitter.indent();
    moduleEmitter.emit("integer leap_next_state");
    moduleEmitter.emit("logical leap_failed");
    moduleEmitter.emit("");
    for (Map.Entry<String, SymbolKind> e : symbolKinds.getGlobalTable().entrySet()) {
      declare(moduleEmitter, names.nameGlobal(e.getKey()), e.getKey(), e.getValue(), false, List.of());
    }
    moduleEmitter.dedent();
    moduleEmitter.emit("end type leap_state_type");
    moduleEmitter.emit("");
    moduleEmitter.dedent();
    moduleEmitter.emit("contains");
    moduleEmitter.emit("");
    moduleEmitter.indent();
  }

  @Override
  protected String finishEmit() {
    emitInitialize();
    emitShutdown();
    moduleEmitter.dedent();
    moduleEmitter.emit("end module " + options.getModuleName());
    return String.join("\n", FortranEmitter.wrap(moduleEmitter.getLines(), options.getLineWidth())) + "\n";
  }

  private String timeIdName(String timeId) {
    return "leap_time_" + FortranNameManager.sanitize(timeId);
  }

  private String stateIdName(String state) {
    return "leap_state_" + FortranNameManager.sanitize(state);
  }

  private String subroutineArgs(String... trailing) {
    List<String> args = new ArrayList<>(options.getExtraArguments());
    args.addAll(Arrays.asList(trailing));
    return String.join(", ", args);
  }

  // ---------------------------------------------------------------------------
  // 声明与内存协议
  // ---------------------------------------------------------------------------

  private void declare(FortranEmitter emitter, String fortranName, String irName, SymbolKind kind,
      boolean isArgument, List<String> otherSpecifiers) {
    List<String> specifiers = new ArrayList<>(otherSpecifiers);
    String typeName;
    if (irName != null && irName.startsWith(Variables.RET_TIME_ID_PREFIX)) {
      typeName = "integer";
    } else if (kind instanceof SymbolKind.BooleanKind) {
      typeName = "logical";
    } else if (kind instanceof SymbolKind.Scalar scalar) {
      if (scalar.isRealValued() || !options.isUseComplexScalars()) {
        typeName = "real (kind=" + options.getRealScalarKind() + ")";
      } else {
        typeName = "complex (kind=" + options.getComplexScalarKind() + ")";
      }
    } else if (kind instanceof SymbolKind.OdeComponent component) {
      ComponentLayout layout = layoutOf(component);
      typeName = layout.getBaseType();
      if (!isArgument) {
        specifiers.add("pointer");
        emitter.emit("integer, pointer :: leap_refcnt_" + fortranName);
      }
      if (!layout.getDimensions().isEmpty()) {
        if (isArgument) {
          specifiers.add("dimension(" + String.join(",", layout.getDimensions()) + ")");
        } else {
          specifiers.add("dimension(" + String.join(",", Collections.nCopies(layout.getDimensions().size(), ":")) + ")");
        }
      }
    } else {
      throw new IllegalArgumentException("unknown variable kind: " + kind);
    }

    if (specifiers.isEmpty()) {
      emitter.emit(typeName + " " + fortranName);
    } else {
      emitter.emit(typeName + ", " + String.join(", ", specifiers) + " :: " + fortranName);
    }
  }

  private ComponentLayout layoutOf(SymbolKind.OdeComponent component) {
    ComponentLayout layout = options.getComponentLayouts().get(component.getComponentId());
    if (layout == null) {
      throw new UndeclaredComponentException(Set.of(component.getComponentId()));
    }
    return layout;
  }

  private void emitVariableInit(String name, SymbolKind kind) {
    if (kind instanceof SymbolKind.OdeComponent) {
      emitTraceable("nullify(" + names.get(name) + ")");
    }
  }

  private void emitVariableDeinit(String name, SymbolKind kind) {
    if (!(kind instanceof SymbolKind.OdeComponent)) {
      return;
    }
    String fortranName = names.get(name);
    String refcnt = names.nameRefcount(name);
    ifBegin("associated(" + fortranName + ")");
    ifBegin(refcnt + ".eq.1");
    emitTraceable("deallocate(" + fortranName + ")");
    emitTraceable("deallocate(" + refcnt + ")");
    emitTraceable("nullify(" + fortranName + ")");
    elseBegin();
    emitTraceable(refcnt + " = " + refcnt + " - 1");
    ifEnd();
    ifEnd();
  }

  private void emitAllocation(String fortranName, SymbolKind.OdeComponent kind) {
    ComponentLayout layout = layoutOf(kind);
    String dimension = layout.getDimensions().isEmpty() ? "" : "(" + String.join(", ", layout.getDimensions()) + ")";
    emitTraceable("allocate(" + fortranName + dimension + ", stat=leap_ierr)");
    ifBegin("leap_ierr.ne.0");
    emit("write(*,*) 'failed to allocate " + fortranName + "'");
    emit("stop");
    ifEnd();
  }

  private void emitAllocateRefcount(String name) {
    String refcnt = names.nameRefcount(name);
    emitTraceable("allocate(" + refcnt + ", stat=leap_ierr)");
    ifBegin("leap_ierr.ne.0");
    emit("write(*,*) 'failed to allocate " + refcnt + "'");
    emit("stop");
    ifEnd();
    emitTraceable(refcnt + " = 1");
  }

  private void emitRefcountedAllocation(String name, SymbolKind.OdeComponent kind) {
    emitAllocation(names.get(name), kind);
    emitAllocateRefcount(name);
  }

  private void emitAllocationCheck(String name, SymbolKind.OdeComponent kind) {
    String refcnt = names.nameRefcount(name);
    ifBegin(".not.associated(" + names.get(name) + ")");
    emitRefcountedAllocation(name, kind);
    elseBegin();
    ifBegin(refcnt + ".ne.1");
    emitTraceable(refcnt + " = " + refcnt + " - 1");
    emit("");
    emitRefcountedAllocation(name, kind);
    ifEnd();
    ifEnd();
  }

  private void emitAssignInner(String target, IrModel.Expr expr) {
    if (expr instanceof IrModel.Call call) {
      emitCall(target, call);
    } else {
      emitTrace(target + " = " + abbreviate(expr));
      emit(target + " = " + renderer.render(expr));
    }
    emit("");
  }

  private static String abbreviate(IrModel.Expr expr) {
    String text = String.valueOf(expr);
    return text.length() > 50 ? text.substring(0, 50) + "..." : text;
  }

  private void emitCall(String result, IrModel.Call call) {
    emitTrace("func call " + result + " = " + abbreviate(call));
    LeapFunction fn = functions.get(call.function);
    List<IrModel.Expr> args = fn.resolveArgs(call.parameters, call.kwParameters);
    Map<String, String> bindings = new LinkedHashMap<>();
    bindings.put("result", result);
    for (int i = 0; i < args.size(); i++) {
      bindings.put(fn.getArgNames().get(i), "(" + renderer.render(args.get(i)) + ")");
    }
    for (String line : fn.getCallCode(LANGUAGE).render(bindings)) {
      emit(line);
    }
  }

  // ---------------------------------------------------------------------------
  // 函数
  // ---------------------------------------------------------------------------

  @Override
  protected void emitDefBegin(String function) {
    declarations = new FortranEmitter();
    body = new FortranEmitter();
    labelDeclared = false;

    declarations.emit("implicit none");
    declarations.emit("");
    for (String decl : options.getExtraArgumentDecl()) {
      declarations.emit(decl);
    }
    declarations.emit("type(leap_state_type), pointer :: leap_state");
    declarations.emit("integer leap_ierr");
    declarations.emit("");

    Map<String, SymbolKind> locals = localSymbols();
    for (Map.Entry<String, SymbolKind> e : locals.entrySet()) {
      declare(declarations, names.get(e.getKey()), e.getKey(), e.getValue(), false, List.of());
    }

    emitTrace("================================================");
    emitTrace("enter " + function);
    for (Map.Entry<String, SymbolKind> e : locals.entrySet()) {
      emitVariableInit(e.getKey(), e.getValue());
    }
    emit("leap_state%leap_failed = .false.");
    String next = code.getState(function).nextState;
    emit("leap_state%leap_next_state = " + stateIdName(next));
    emit("");
  }

  @Override
  protected void emitDefEnd(String function) {
    String name = "leap_state_func_" + FortranNameManager.sanitize(function);
    moduleEmitter.emit("subroutine " + name + "(" + subroutineArgs("leap_state") + ")");
    moduleEmitter.indent();
    moduleEmitter.incorporate(declarations);
    moduleEmitter.emit("");
    moduleEmitter.incorporate(body);
    moduleEmitter.dedent();
    moduleEmitter.emit("end subroutine " + name);
    moduleEmitter.emit("");
    declarations = null;
    body = null;
  }

  private void emitInitialize() {
    List<String> initSymbols = new ArrayList<>();
    for (String sym : symbolKinds.getGlobalTable().keySet()) {
      if (!sym.startsWith(Variables.RET_PREFIX)) {
        initSymbols.add(sym);
      }
    }
    List<String> args = new ArrayList<>();
    args.add("leap_state");
    for (String sym : initSymbols) {
      args.add(names.nameGlobal(sym));
    }

    moduleEmitter.emit("subroutine initialize(" + subroutineArgs(args.toArray(new String[0])) + ")");
    moduleEmitter.indent();
    moduleEmitter.emit("implicit none");
    moduleEmitter.emit("");
    for (String decl : options.getExtraArgumentDecl()) {
      moduleEmitter.emit(decl);
    }
    moduleEmitter.emit("type(leap_state_type), pointer :: leap_state");
    moduleEmitter.emit("integer leap_ierr");
    moduleEmitter.emit("");
    for (String sym : initSymbols) {
      declare(moduleEmitter, names.nameGlobal(sym), sym, symbolKinds.getGlobalTable().get(sym), true,
          List.of("optional"));
    }
    moduleEmitter.emit("");

    for (Map.Entry<String, SymbolKind> e : symbolKinds.getGlobalTable().entrySet()) {
      emitVariableInit(e.getKey(), e.getValue());
    }
    emit("leap_state%leap_failed = .false.");
    emit("leap_state%leap_next_state = " + stateIdName(code.getInitialState()));
    emit("");

    for (String sym : initSymbols) {
      SymbolKind kind = symbolKinds.getGlobalTable().get(sym);
      String argName = names.nameGlobal(sym);
      ifBegin("present(" + argName + ")");
      if (kind instanceof SymbolKind.OdeComponent component) {
        emitRefcountedAllocation(sym, component);
      }
      emitTraceable(names.get(sym) + " = " + argName);
      ifEnd();
    }
    moduleEmitter.dedent();
    moduleEmitter.emit("end subroutine initialize");
    moduleEmitter.emit("");
  }

  private void emitShutdown() {
    moduleEmitter.emit("subroutine shutdown(" + subroutineArgs("leap_state") + ")");
    moduleEmitter.indent();
    moduleEmitter.emit("implicit none");
    moduleEmitter.emit("");
    for (String decl : options.getExtraArgumentDecl()) {
      moduleEmitter.emit(decl);
    }
    moduleEmitter.emit("type(leap_state_type), pointer :: leap_state");
    moduleEmitter.emit("");

    for (Map.Entry<String, SymbolKind> e : symbolKinds.getGlobalTable().entrySet()) {
      emitVariableDeinit(e.getKey(), e.getValue());
    }
    // 全部释放之后仍然关联的缓冲区即为泄漏
    for (Map.Entry<String, SymbolKind> e : symbolKinds.getGlobalTable().entrySet()) {
      if (e.getValue() instanceof SymbolKind.OdeComponent) {
        String fortranName = names.get(e.getKey());
        ifBegin("associated(" + fortranName + ")");
        emit("write(*,*) 'leaked reference in " + fortranName + "'");
        emit("write(*,*) '  remaining refcount ', " + names.nameRefcount(e.getKey()));
        ifEnd();
      }
    }
    moduleEmitter.dedent();
    moduleEmitter.emit("end subroutine shutdown");
    moduleEmitter.emit("");
  }

  // ---------------------------------------------------------------------------
  // 控制流
  // ---------------------------------------------------------------------------

  @Override
  protected void emitIfBegin(IrModel.Expr condition) {
    ifBegin(renderer.render(condition));
  }

  @Override
  protected void emitElseBegin() {
    elseBegin();
  }

  @Override
  protected void emitIfEnd() {
    ifEnd();
  }

  @Override
  protected void emitDispatchBegin() {
    if (!labelDeclared) {
      declarations.emit("integer leap_label");
      labelDeclared = true;
    }
    emit("leap_label = 0");
    emit("do while (leap_label.ge.0)");
    out().indent();
    emit("select case (leap_label)");
    caseOpen = false;
  }

  @Override
  protected void emitDispatchCase(int label) {
    if (caseOpen) {
      out().dedent();
    }
    emit("case (" + label + ")");
    out().indent();
    caseOpen = true;
  }

  @Override
  protected void emitSetLabel(int label) {
    emit("leap_label = " + label);
  }

  @Override
  protected void emitDispatchEnd() {
    if (caseOpen) {
      out().dedent();
      caseOpen = false;
    }
    emit("end select");
    out().dedent();
    emit("end do");
  }

  private void emitLocalTeardown() {
    for (Map.Entry<String, SymbolKind> e : localSymbols().entrySet()) {
      emitVariableDeinit(e.getKey(), e.getValue());
    }
  }

  @Override
  protected void emitReturn() {
    emitLocalTeardown();
    emitTrace("leave " + currentFunction);
    emit("return");
  }

  // ---------------------------------------------------------------------------
  // 指令
  // ---------------------------------------------------------------------------

  @Override
  protected void emitScalarAssign(String assignee, IrModel.Expr expr, SymbolKind kind) {
    emitAssignInner(names.get(assignee), expr);
  }

  @Override
  protected void emitAlias(String assignee, String source, SymbolKind.OdeComponent kind) {
    String refcnt = names.nameRefcount(assignee);
    emitVariableDeinit(assignee, kind);
    emitTraceable(names.get(assignee) + " => " + names.get(source));
    emitTraceable(refcnt + " => " + names.nameRefcount(source));
    emitTraceable(refcnt + " = " + refcnt + " + 1");
    emit("");
  }

  @Override
  protected void emitFreshAssign(String assignee, IrModel.Expr expr, SymbolKind.OdeComponent kind) {
    emitAllocationCheck(assignee, kind);
    emitAssignInner(names.get(assignee), expr);
  }

  @Override
  protected void emitSwapAssign(String assignee, IrModel.Expr expr, SymbolKind.OdeComponent kind) {
    String fortranName = names.get(assignee);
    String refcnt = names.nameRefcount(assignee);
    String temp = names.makeUniqueName("tmp_" + FortranNameManager.sanitize(assignee));
    declare(declarations, temp, null, kind, false, List.of());

    emitAllocation(temp, kind);
    emitAssignInner(temp, expr);

    // 右侧读取了被赋值变量，因此它必然已关联
    ifBegin(refcnt + ".eq.1");
    emitTraceable("deallocate(" + fortranName + ")");
    emit(fortranName + " => " + temp);
    elseBegin();
    emitTraceable(refcnt + " = " + refcnt + " - 1");
    emit(fortranName + " => " + temp);
    emitAllocateRefcount(assignee);
    ifEnd();
  }

  @Override
  protected void emitAssignSolved(IrModel.AssignSolved insn, SymbolKind kind) {
    throw new ProgramValidationException(ErrorMessages.withHint(
        ErrorMessages.bilingual("Fortran 后端不支持隐式求解指令：" + insn.id,
            "AssignSolved is not supported by the Fortran backend: " + insn.id),
        "使用参考解释器或编译后端", "use the reference interpreter or the compiled backend"));
  }

  @Override
  protected void emitAssignTimeId(String assignee, String timeId) {
    emitTraceable(names.get(assignee) + " = " + timeIdName(timeId));
  }

  @Override
  protected void emitBeforeStateUpdate(IrModel.YieldState insn) {
    emitHookCall(options.getCallBeforeStateUpdate());
  }

  @Override
  protected void emitAfterStateUpdate(IrModel.YieldState insn) {
    emitHookCall(options.getCallAfterStateUpdate());
  }

  private void emitHookCall(String functionId) {
    if (functionId == null) {
      return;
    }
    String dummy = names.makeUniqueName("dummy_logical");
    declarations.emit("logical " + dummy);
    emitCall(dummy, new IrModel.Call(functionId, List.of(), Map.of()));
  }

  @Override
  protected void emitYieldNotify(IrModel.YieldState insn) {
    emitTrace("yield " + insn.componentId + " at " + insn.timeId);
  }

  @Override
  protected void emitFailStep(IrModel.FailStep insn) {
    emitLocalTeardown();
    emit("leap_state%leap_failed = .true.");
    emit("leap_state%leap_next_state = " + stateIdName(currentFunction));
    emitTrace("step failed in " + currentFunction);
    emit("return");
  }

  @Override
  protected void emitRaise(IrModel.Raise insn) {
    emit("write(*,*) '" + (insn.errorCondition + ": " + insn.errorMessage).replace("'", "''") + "'");
    emit("stop");
  }

  @Override
  protected void emitStateTransition(IrModel.StateTransition insn) {
    emit("leap_state%leap_next_state = " + stateIdName(insn.nextState));
  }
}
