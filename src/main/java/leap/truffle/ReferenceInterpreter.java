package leap.truffle;

import leap.truffle.core.IrModel;
import leap.truffle.core.ProgramValidationException;
import leap.truffle.core.TimeIntegratorCode;
import leap.truffle.core.Variables;
import leap.truffle.nodes.EvalScope;
import leap.truffle.nodes.ExpressionNodes;
import leap.truffle.runtime.*;
import java.util.*;

/**
 * 参考解释器：通过执行控制器直接在内存数值状态上执行 IR。
 *
 * <p>上下文在两步之间只保留 {@code <t>}、{@code <dt>}、{@code <p>} 与 {@code <state>} 变量，
 * 其余临时变量在每步结束时清除（无论成功与否）。</p>
 *
 * <p>实例独占其上下文，不可在线程间共享。</p>
 */
public final class ReferenceInterpreter
    implements InstructionExecutor<StepEvent>, EvalScope, StepIterator.Stepper {

  private final TimeIntegratorCode code;
  private final FunctionRegistry functions;
  private final Map<String, Solver> solvers;
  private final ExecutionController controller;
  private final ExpressionNodes expressions = new ExpressionNodes();
  private final Map<String, Object> context = new HashMap<>();
  private String nextState;

  public ReferenceInterpreter(TimeIntegratorCode code, FunctionRegistry functions) {
    this(code, functions, Map.of());
  }

  /**
   * @param functions 用户函数；缺少内置函数时自动补登记，与内置函数重名则报错
   * @param solvers solver_id 到求解器的映射
   */
  public ReferenceInterpreter(TimeIntegratorCode code, FunctionRegistry functions, Map<String, Solver> solvers) {
    this.code = code;
    this.functions = functions;
    if (!functions.contains(Builtins.LEN)) {
      Builtins.registerAll(functions);
    }
    this.solvers = new HashMap<>(solvers);
    this.controller = new ExecutionController(code);
    this.nextState = code.getInitialState();
  }

  /**
   * 设置初始时间、步长与状态分量。
   *
   * @param state 分量名（不带前缀）到值的映射
   */
  public void setUp(double tStart, double dtStart, Map<String, ?> state) {
    context.put(Variables.TIME, tStart);
    context.put(Variables.DT, dtStart);
    for (Map.Entry<String, ?> e : state.entrySet()) {
      if (e.getKey().startsWith(Variables.RESERVED_PREFIX)) {
        throw new ProgramValidationException(ErrorMessages.reservedStateKey(e.getKey()));
      }
      context.put(Variables.state(e.getKey()), Values.copy(Values.normalize(e.getValue())));
    }
  }

  /**
   * 惰性运行，直到 {@code <t>} 达到 tEnd 或成功步数达到 maxSteps（两者都可为 null）。
   */
  public StepIterator run(Double tEnd, Integer maxSteps) {
    return new StepIterator(this, tEnd, maxSteps);
  }

  @Override
  public List<StepEvent> runSingleStep() {
    String current = nextState;
    List<StepEvent> events = new ArrayList<>();
    try {
      controller.reset();
      IrModel.State state = code.getState(current);
      nextState = state.nextState;
      controller.updatePlan(state.dependsOn);
      controller.run(this, events::add);
    } catch (FailStepException e) {
      // 被拒绝的步重新执行同一状态
      nextState = current;
      throw e;
    } finally {
      context.keySet().removeIf(name -> !Variables.survivesStep(name));
    }
    return events;
  }

  public void registerFunction(LeapFunction function) {
    functions.register(function);
  }

  public void registerSolver(String solverId, Solver solver) {
    solvers.put(solverId, solver);
  }

  @Override
  public double currentTime() {
    return Values.asDouble(read(Variables.TIME));
  }

  @Override
  public String pendingState() {
    return nextState;
  }

  /**
   * 上下文只读视图（测试与分析工具使用）。
   */
  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  // ---------------------------------------------------------------------------
  // EvalScope
  // ---------------------------------------------------------------------------

  @Override
  public Object read(String name) {
    Object value = context.get(name);
    if (value == null) {
      throw new EvaluationException(ErrorMessages.variableNotInitialized(name));
    }
    return value;
  }

  @Override
  public FunctionRegistry functions() {
    return functions;
  }

  private Object eval(IrModel.Expr expr) {
    return expressions.evaluate(expr, this);
  }

  // ---------------------------------------------------------------------------
  // 指令执行
  // ---------------------------------------------------------------------------

  @Override
  public ExecutionResult<StepEvent> execAssignExpression(IrModel.AssignExpression insn) {
    context.put(insn.assignee, eval(insn.expression));
    return ExecutionResult.none();
  }

  @Override
  public ExecutionResult<StepEvent> execAssignSolved(IrModel.AssignSolved insn) {
    Object guess = eval(insn.guess);
    Solver solver = solvers.get(insn.solverId);
    if (solver == null) {
      throw new ProgramValidationException(ErrorMessages.unknownSolver(insn.solverId));
    }
    // 求解器只读上下文
    Object result = solver.solve(insn.expression, insn.solveComponent,
        Collections.unmodifiableMap(context), functions, guess);
    context.put(insn.assignee, Values.normalize(result));
    return ExecutionResult.none();
  }

  @Override
  public ExecutionResult<StepEvent> execIf(IrModel.If insn) {
    boolean taken = Values.toBool(eval(insn.condition));
    return ExecutionResult.require(taken ? insn.thenDependsOn : insn.elseDependsOn);
  }

  @Override
  public ExecutionResult<StepEvent> execYieldState(IrModel.YieldState insn) {
    double t = Values.asDouble(eval(insn.time));
    Object value = Values.copy(eval(insn.expression));
    return ExecutionResult.event(new StepEvent.StateComputed(t, insn.timeId, insn.componentId, value));
  }

  @Override
  public ExecutionResult<StepEvent> execFailStep(IrModel.FailStep insn) {
    throw new FailStepException(insn.id);
  }

  @Override
  public ExecutionResult<StepEvent> execRaise(IrModel.Raise insn) {
    throw new LeapRaisedException(insn.errorCondition, insn.errorMessage);
  }

  @Override
  public ExecutionResult<StepEvent> execStateTransition(IrModel.StateTransition insn) {
    nextState = insn.nextState;
    return ExecutionResult.none();
  }
}
