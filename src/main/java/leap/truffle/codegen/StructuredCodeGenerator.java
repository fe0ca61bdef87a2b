package leap.truffle.codegen;

import leap.truffle.core.IrModel;
import leap.truffle.core.Instructions;
import leap.truffle.core.SymbolKind;
import leap.truffle.core.TimeIntegratorCode;
import leap.truffle.core.UndeclaredComponentException;
import leap.truffle.core.Variables;
import leap.truffle.runtime.FunctionRegistry;
import java.util.*;
import java.util.logging.Logger;

/**
 * 结构化代码生成器基类
 *
 * 驱动完整的前端流程：每个程序状态组装控制流图并提取结构化控制树，
 * 对全部函数推断符号种类并检查 ODE 分量布局，然后逐函数降级控制树。
 * 子类只负责把降级动作写成具体目标（Fortran 文本或 Truffle 语句节点）。
 *
 * ODE 分量赋值的内存协议在这里统一判定：
 * <ul>
 *   <li>右侧是裸变量：别名（{@link #emitAlias}）</li>
 *   <li>右侧不读取被赋值变量：保证独占缓冲区后直接写入（{@link #emitFreshAssign}）</li>
 *   <li>右侧读取被赋值变量：先写临时缓冲区再交换（{@link #emitSwapAssign}）</li>
 * </ul>
 *
 * 生成器是一次性的，每个程序使用独立实例。
 *
 * @param <R> 生成结果类型
 */
public abstract class StructuredCodeGenerator<R> {
  private static final Logger logger = Logger.getLogger(StructuredCodeGenerator.class.getName());

  /** 非结构区间内离开分派循环的标签。 */
  public static final int EXIT_LABEL = -1;

  protected final FunctionRegistry functions;
  protected TimeIntegratorCode code;
  protected SymbolKindTable symbolKinds;
  protected String currentFunction;
  private final Map<String, Integer> timeIds = new LinkedHashMap<>();
  private final Map<String, Integer> stateIds = new LinkedHashMap<>();
  private boolean used;

  protected StructuredCodeGenerator(FunctionRegistry functions) {
    this.functions = Objects.requireNonNull(functions, "functions");
  }

  /**
   * 已声明数值布局的 ODE 分量 id。
   */
  protected abstract Set<String> declaredComponents();

  public final R generate(TimeIntegratorCode program) {
    if (used) {
      throw new IllegalStateException("code generator instances are single-use");
    }
    used = true;
    this.code = program;

    Map<String, ControlNode> trees = new LinkedHashMap<>();
    Map<String, List<IrModel.Instruction>> instructionsByFunction = new LinkedHashMap<>();
    StructuralExtractor extractor = new StructuralExtractor();
    for (Map.Entry<String, IrModel.State> e : program.getStates().entrySet()) {
      String name = e.getKey();
      ControlFlowGraph cfg = new ControlFlowAssembler(program).assemble(name, e.getValue().dependsOn);
      List<IrModel.Instruction> insns = new ArrayList<>();
      for (BasicBlock block : cfg.getBlocks()) {
        insns.addAll(block.getCode());
      }
      instructionsByFunction.put(name, insns);
      trees.put(name, extractor.extract(cfg));
      stateIds.put(name, stateIds.size());
    }

    for (IrModel.Instruction insn : program.getInstructions()) {
      if (insn instanceof IrModel.YieldState y && !timeIds.containsKey(y.timeId)) {
        timeIds.put(y.timeId, timeIds.size());
      }
    }

    symbolKinds = new SymbolKindFinder(functions).find(instructionsByFunction);
    checkComponents(instructionsByFunction);

    beginEmit();
    for (Map.Entry<String, ControlNode> e : trees.entrySet()) {
      currentFunction = e.getKey();
      logger.fine(() -> "lowering " + currentFunction + ": " + e.getValue());
      emitDefBegin(currentFunction);
      lower(e.getValue());
      emitDefEnd(currentFunction);
      currentFunction = null;
    }
    return finishEmit();
  }

  private void checkComponents(Map<String, List<IrModel.Instruction>> instructionsByFunction) {
    Set<String> referenced = new TreeSet<>(symbolKinds.getOdeComponentIds());
    for (List<IrModel.Instruction> insns : instructionsByFunction.values()) {
      for (IrModel.Instruction insn : insns) {
        if (insn instanceof IrModel.YieldState y) {
          referenced.add(y.componentId);
        }
      }
    }
    Set<String> missing = new TreeSet<>(referenced);
    missing.removeAll(declaredComponents());
    if (!missing.isEmpty()) {
      throw new UndeclaredComponentException(missing);
    }

    // 输出通道
    for (List<IrModel.Instruction> insns : instructionsByFunction.values()) {
      for (IrModel.Instruction insn : insns) {
        if (insn instanceof IrModel.YieldState y) {
          symbolKinds.set(null, Variables.retTimeId(y.componentId), SymbolKind.REAL);
          symbolKinds.set(null, Variables.retTime(y.componentId), SymbolKind.REAL);
          symbolKinds.set(null, Variables.retState(y.componentId), SymbolKind.odeComponent(y.componentId));
        }
      }
    }
  }

  /** 时间 id 到整数编号，按在程序中首次出现的顺序。 */
  protected Map<String, Integer> getTimeIds() {
    return Collections.unmodifiableMap(timeIds);
  }

  /** 状态名到整数编号。 */
  protected Map<String, Integer> getStateIds() {
    return Collections.unmodifiableMap(stateIds);
  }

  public SymbolKindTable getSymbolKinds() {
    return symbolKinds;
  }

  // ---------------------------------------------------------------------------
  // 控制树降级
  // ---------------------------------------------------------------------------

  protected void lower(ControlNode node) {
    node.accept(new ControlNode.Visitor<Void>() {
      @Override
      public Void visitSingle(ControlNode.Single single) {
        lowerBasicBlock(single.getBlock());
        return null;
      }

      @Override
      public Void visitBlock(ControlNode.Block block) {
        for (ControlNode child : block.getChildren()) {
          lower(child);
        }
        return null;
      }

      @Override
      public Void visitIfThen(ControlNode.IfThen ifThen) {
        lower(ifThen.getCondition());
        IrModel.Expr condition = branchOf(ifThen.getCondition()).condition();
        emitIfBegin(ifThen.isNegated() ? IrModel.not(condition) : condition);
        lower(ifThen.getThen());
        emitIfEnd();
        return null;
      }

      @Override
      public Void visitIfThenElse(ControlNode.IfThenElse ifThenElse) {
        lower(ifThenElse.getCondition());
        emitIfBegin(branchOf(ifThenElse.getCondition()).condition());
        lower(ifThenElse.getThen());
        emitElseBegin();
        lower(ifThenElse.getElse());
        emitIfEnd();
        return null;
      }

      @Override
      public Void visitUnstructuredInterval(ControlNode.UnstructuredInterval interval) {
        lowerInterval(interval);
        return null;
      }
    });
  }

  private static BasicBlock.Branch branchOf(ControlNode condition) {
    BasicBlock exit = condition.getExitBlock();
    if (exit == null || !(exit.getTerminator() instanceof BasicBlock.Branch branch)) {
      throw new IllegalStateException("condition node does not end in a branch: " + condition);
    }
    return branch;
  }

  private void lowerBasicBlock(BasicBlock block) {
    for (IrModel.Instruction insn : block.getCode()) {
      lowerInstruction(insn);
    }
    if (block.getTerminator() instanceof BasicBlock.Return) {
      emitReturn();
    }
  }

  /**
   * 非结构区间：按标签分派，每个节点结束时设置下一个标签。
   */
  private void lowerInterval(ControlNode.UnstructuredInterval interval) {
    Map<BasicBlock, Integer> labels = new HashMap<>();
    List<ControlNode> nodes = interval.getNodes();
    for (int i = 0; i < nodes.size(); i++) {
      labels.put(nodes.get(i).getEntryBlock(), i);
    }

    emitDispatchBegin();
    for (int i = 0; i < nodes.size(); i++) {
      ControlNode node = nodes.get(i);
      emitDispatchCase(i);
      lower(node);

      BasicBlock exit = node.getExitBlock();
      if (exit == null) {
        // 所有臂都离开函数时没有后续标签
        BasicBlock follow = node.getFollow();
        if (follow != null) {
          emitSetLabel(labels.getOrDefault(follow, EXIT_LABEL));
        }
      } else if (exit.getTerminator() instanceof BasicBlock.Jump jump) {
        emitSetLabel(labels.getOrDefault(jump.target(), EXIT_LABEL));
      } else if (exit.getTerminator() instanceof BasicBlock.Branch branch) {
        emitIfBegin(branch.condition());
        emitSetLabel(labels.getOrDefault(branch.onTrue(), EXIT_LABEL));
        emitElseBegin();
        emitSetLabel(labels.getOrDefault(branch.onFalse(), EXIT_LABEL));
        emitIfEnd();
      }
    }
    emitDispatchEnd();
  }

  // ---------------------------------------------------------------------------
  // 指令降级
  // ---------------------------------------------------------------------------

  protected void lowerInstruction(IrModel.Instruction insn) {
    if (insn instanceof IrModel.AssignExpression a) {
      lowerAssign(a.assignee, a.expression);
    } else if (insn instanceof IrModel.AssignSolved s) {
      emitAssignSolved(s, symbolKinds.get(currentFunction, s.assignee));
    } else if (insn instanceof IrModel.YieldState y) {
      lowerYieldState(y);
    } else if (insn instanceof IrModel.FailStep f) {
      emitFailStep(f);
    } else if (insn instanceof IrModel.Raise r) {
      emitRaise(r);
    } else if (insn instanceof IrModel.StateTransition t) {
      emitStateTransition(t);
    } else if (insn instanceof IrModel.If) {
      throw new IllegalStateException("If inside a basic block: " + insn.id);
    }
    // Nop 不产生代码
  }

  /**
   * 按被赋值变量的种类与右侧形式选择赋值方式。
   */
  protected void lowerAssign(String assignee, IrModel.Expr expr) {
    SymbolKind kind = symbolKinds.get(currentFunction, assignee);
    if (!(kind instanceof SymbolKind.OdeComponent component)) {
      emitScalarAssign(assignee, expr, kind);
      return;
    }
    if (expr instanceof IrModel.Variable source) {
      if (!source.name.equals(assignee)) {
        emitAlias(assignee, source.name, component);
      }
      return;
    }
    if (Instructions.readVariables(expr).contains(assignee)) {
      emitSwapAssign(assignee, expr, component);
    } else {
      emitFreshAssign(assignee, expr, component);
    }
  }

  private void lowerYieldState(IrModel.YieldState insn) {
    String component = insn.componentId;
    emitAssignTimeId(Variables.retTimeId(component), insn.timeId);
    lowerAssign(Variables.retTime(component), insn.time);
    emitBeforeStateUpdate(insn);
    lowerAssign(Variables.retState(component), insn.expression);
    emitAfterStateUpdate(insn);
    emitYieldNotify(insn);
  }

  /**
   * 当前函数的局部符号。
   */
  protected Map<String, SymbolKind> localSymbols() {
    return symbolKinds.getFunctionTable(currentFunction);
  }

  // ---------------------------------------------------------------------------
  // 子类实现的输出动作
  // ---------------------------------------------------------------------------

  protected abstract void beginEmit();

  protected abstract void emitDefBegin(String function);

  protected abstract void emitDefEnd(String function);

  protected abstract R finishEmit();

  protected abstract void emitIfBegin(IrModel.Expr condition);

  protected abstract void emitElseBegin();

  protected abstract void emitIfEnd();

  protected abstract void emitDispatchBegin();

  protected abstract void emitDispatchCase(int label);

  protected abstract void emitSetLabel(int label);

  protected abstract void emitDispatchEnd();

  /** 释放局部 ODE 分量并离开函数。 */
  protected abstract void emitReturn();

  protected abstract void emitScalarAssign(String assignee, IrModel.Expr expr, SymbolKind kind);

  protected abstract void emitAlias(String assignee, String source, SymbolKind.OdeComponent kind);

  protected abstract void emitFreshAssign(String assignee, IrModel.Expr expr, SymbolKind.OdeComponent kind);

  protected abstract void emitSwapAssign(String assignee, IrModel.Expr expr, SymbolKind.OdeComponent kind);

  protected abstract void emitAssignSolved(IrModel.AssignSolved insn, SymbolKind kind);

  protected abstract void emitAssignTimeId(String assignee, String timeId);

  protected void emitBeforeStateUpdate(IrModel.YieldState insn) {}

  protected void emitAfterStateUpdate(IrModel.YieldState insn) {}

  /** 输出通道已写好，通知调用方。 */
  protected abstract void emitYieldNotify(IrModel.YieldState insn);

  protected abstract void emitFailStep(IrModel.FailStep insn);

  protected abstract void emitRaise(IrModel.Raise insn);

  protected abstract void emitStateTransition(IrModel.StateTransition insn);
}
