package leap.truffle.compiled;

import leap.truffle.codegen.ComponentLayout;
import leap.truffle.codegen.StructuredCodeGenerator;
import leap.truffle.core.IrModel;
import leap.truffle.core.SymbolKind;
import leap.truffle.core.UndeclaredComponentException;
import leap.truffle.core.Variables;
import leap.truffle.nodes.ConstantNode;
import leap.truffle.nodes.ExpressionNodes;
import leap.truffle.runtime.Builtins;
import leap.truffle.runtime.FunctionRegistry;
import leap.truffle.runtime.Solver;
import java.util.*;

/**
 * 进程内编译后端：把结构化控制树降级为 Truffle 语句节点。
 *
 * 与 Fortran 后端共用同一套降级流程与赋值协议判定，ODE 分量落在
 * {@link BufferHeap} 分配的引用计数缓冲区上，因此内存协议可以直接执行和检查。
 */
public final class NodeCodeGenerator extends StructuredCodeGenerator<CompiledProgram> {
  private final Map<String, ComponentLayout> layouts;
  private final Map<String, Solver> solvers;
  private final Map<String, StateFunctionNode> stateFunctions = new LinkedHashMap<>();

  private final Deque<List<StatementNode>> blocks = new ArrayDeque<>();
  private final Deque<PendingIf> pendingIfs = new ArrayDeque<>();
  private List<StatementNode> dispatchCases;
  private SlotAllocator slots;

  private static final class PendingIf {
    final IrModel.Expr condition;
    List<StatementNode> thenPart;

    PendingIf(IrModel.Expr condition) {
      this.condition = condition;
    }
  }

  public NodeCodeGenerator(Map<String, ComponentLayout> layouts, FunctionRegistry functions) {
    this(layouts, functions, Map.of());
  }

  public NodeCodeGenerator(Map<String, ComponentLayout> layouts, FunctionRegistry functions,
      Map<String, Solver> solvers) {
    super(withBuiltins(functions));
    this.layouts = Map.copyOf(layouts);
    this.solvers = Map.copyOf(solvers);
  }

  private static FunctionRegistry withBuiltins(FunctionRegistry functions) {
    if (!functions.contains(Builtins.LEN)) {
      Builtins.registerAll(functions);
    }
    return functions;
  }

  @Override
  protected Set<String> declaredComponents() {
    return layouts.keySet();
  }

  private void add(StatementNode node) {
    blocks.peek().add(node);
  }

  private static StatementNode sequence(List<StatementNode> statements) {
    return statements.size() == 1 ? statements.get(0) : new SequenceNode(statements);
  }

  private SlotRef slot(String name) {
    if (Variables.isStateVariable(name)) {
      return SlotRef.global(name);
    }
    return SlotRef.local(name, slots.getSlotIndex(name));
  }

  private int sizeOf(SymbolKind.OdeComponent kind) {
    ComponentLayout layout = layouts.get(kind.getComponentId());
    if (layout == null) {
      throw new UndeclaredComponentException(Set.of(kind.getComponentId()));
    }
    return layout.size();
  }

  // ---------------------------------------------------------------------------
  // 函数
  // ---------------------------------------------------------------------------

  @Override
  protected void beginEmit() {
    stateFunctions.clear();
  }

  @Override
  protected void emitDefBegin(String function) {
    slots = new SlotAllocator();
    for (String local : localSymbols().keySet()) {
      slots.addLocal(local);
    }
    blocks.push(new ArrayList<>());
  }

  @Override
  protected void emitDefEnd(String function) {
    List<SlotRef> odeLocals = new ArrayList<>();
    for (Map.Entry<String, SymbolKind> e : localSymbols().entrySet()) {
      if (e.getValue() instanceof SymbolKind.OdeComponent) {
        odeLocals.add(slot(e.getKey()));
      }
    }
    StatementNode body = new SequenceNode(blocks.pop());
    stateFunctions.put(function, new StateFunctionNode(function, code.getState(function).nextState, body,
        slots.getSlotCount(), slots.getSymbolTable(), odeLocals));
    slots = null;
  }

  @Override
  protected CompiledProgram finishEmit() {
    return new CompiledProgram(code, stateFunctions, functions, solvers, layouts);
  }

  // ---------------------------------------------------------------------------
  // 控制流
  // ---------------------------------------------------------------------------

  @Override
  protected void emitIfBegin(IrModel.Expr condition) {
    pendingIfs.push(new PendingIf(condition));
    blocks.push(new ArrayList<>());
  }

  @Override
  protected void emitElseBegin() {
    pendingIfs.peek().thenPart = blocks.pop();
    blocks.push(new ArrayList<>());
  }

  @Override
  protected void emitIfEnd() {
    PendingIf pending = pendingIfs.pop();
    List<StatementNode> last = blocks.pop();
    StatementNode thenNode;
    StatementNode elseNode;
    if (pending.thenPart == null) {
      thenNode = sequence(last);
      elseNode = null;
    } else {
      thenNode = sequence(pending.thenPart);
      elseNode = sequence(last);
    }
    add(new IfStatementNode(ExpressionNodes.build(pending.condition), thenNode, elseNode));
  }

  @Override
  protected void emitDispatchBegin() {
    dispatchCases = new ArrayList<>();
    blocks.push(new ArrayList<>());
  }

  @Override
  protected void emitDispatchCase(int label) {
    List<StatementNode> previous = blocks.pop();
    if (label > 0) {
      dispatchCases.add(sequence(previous));
    }
    blocks.push(new ArrayList<>());
  }

  @Override
  protected void emitSetLabel(int label) {
    add(new SetLabelNode(label));
  }

  @Override
  protected void emitDispatchEnd() {
    dispatchCases.add(sequence(blocks.pop()));
    add(new DispatchNode(dispatchCases));
    dispatchCases = null;
  }

  @Override
  protected void emitReturn() {
    add(new ReturnNode());
  }

  // ---------------------------------------------------------------------------
  // 指令
  // ---------------------------------------------------------------------------

  @Override
  protected void emitScalarAssign(String assignee, IrModel.Expr expr, SymbolKind kind) {
    add(new ScalarAssignNode(slot(assignee), ExpressionNodes.build(expr)));
  }

  @Override
  protected void emitAlias(String assignee, String source, SymbolKind.OdeComponent kind) {
    add(new AliasAssignNode(slot(assignee), slot(source)));
  }

  @Override
  protected void emitFreshAssign(String assignee, IrModel.Expr expr, SymbolKind.OdeComponent kind) {
    add(new FreshAssignNode(slot(assignee), ExpressionNodes.build(expr), sizeOf(kind)));
  }

  @Override
  protected void emitSwapAssign(String assignee, IrModel.Expr expr, SymbolKind.OdeComponent kind) {
    add(new SwapAssignNode(slot(assignee), ExpressionNodes.build(expr), sizeOf(kind)));
  }

  @Override
  protected void emitAssignSolved(IrModel.AssignSolved insn, SymbolKind kind) {
    int size = kind instanceof SymbolKind.OdeComponent component ? sizeOf(component) : -1;
    add(new SolveNode(slot(insn.assignee), insn, ExpressionNodes.build(insn.guess), size));
  }

  @Override
  protected void emitAssignTimeId(String assignee, String timeId) {
    add(new ScalarAssignNode(slot(assignee), new ConstantNode(timeId)));
  }

  @Override
  protected void emitYieldNotify(IrModel.YieldState insn) {
    add(new FlowNodes.YieldNotifyNode(insn.componentId));
  }

  @Override
  protected void emitFailStep(IrModel.FailStep insn) {
    add(new FlowNodes.FailStepNode(insn.id));
  }

  @Override
  protected void emitRaise(IrModel.Raise insn) {
    add(new FlowNodes.RaiseNode(insn.errorCondition, insn.errorMessage));
  }

  @Override
  protected void emitStateTransition(IrModel.StateTransition insn) {
    add(new FlowNodes.TransitionNode(insn.nextState));
  }
}
