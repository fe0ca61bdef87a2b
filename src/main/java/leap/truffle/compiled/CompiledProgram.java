package leap.truffle.compiled;

import leap.truffle.codegen.ComponentLayout;
import leap.truffle.core.ProgramValidationException;
import leap.truffle.core.TimeIntegratorCode;
import leap.truffle.core.UndeclaredComponentException;
import leap.truffle.core.Variables;
import leap.truffle.nodes.Profiler;
import leap.truffle.runtime.*;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 编译后端的产物：每个程序状态一个函数节点，全局变量与缓冲区堆由本对象持有。
 *
 * <p>与参考解释器产生相同的事件序列：被拒绝的步重新执行同一状态，本步事件被丢弃。</p>
 *
 * <p>实例独占其全局状态，不可在线程间共享。</p>
 */
public final class CompiledProgram implements StepIterator.Stepper {
  private static final Logger logger = Logger.getLogger(CompiledProgram.class.getName());

  private final TimeIntegratorCode code;
  private final Map<String, StateFunctionNode> stateFunctions;
  private final FunctionRegistry functions;
  private final Map<String, Solver> solvers;
  private final Map<String, ComponentLayout> layouts;
  private final BufferHeap heap = new BufferHeap();
  private final Map<String, Object> globals = new LinkedHashMap<>();
  private String nextState;
  private List<StepEvent> events;

  CompiledProgram(TimeIntegratorCode code, Map<String, StateFunctionNode> stateFunctions,
      FunctionRegistry functions, Map<String, Solver> solvers, Map<String, ComponentLayout> layouts) {
    this.code = code;
    this.stateFunctions = Map.copyOf(stateFunctions);
    this.functions = functions;
    this.solvers = new HashMap<>(solvers);
    this.layouts = Map.copyOf(layouts);
    this.nextState = code.getInitialState();
  }

  /**
   * 设置时间、步长、状态分量与持久变量。已有的全局缓冲区先被释放。
   *
   * @param state 分量名（不带前缀）到值的映射，值可以是数组或标量（按元素填充）
   * @param persistent 持久变量名（不带 {@code <p>} 前缀）到值的映射
   */
  public void initialize(double t, double dt, Map<String, ?> state, Map<String, ?> persistent) {
    releaseGlobals();
    globals.put(Variables.TIME, t);
    globals.put(Variables.DT, dt);
    for (Map.Entry<String, ?> e : state.entrySet()) {
      String component = e.getKey();
      if (component.startsWith(Variables.RESERVED_PREFIX)) {
        throw new ProgramValidationException(ErrorMessages.reservedStateKey(component));
      }
      ComponentLayout layout = layouts.get(component);
      if (layout == null) {
        throw new UndeclaredComponentException(Set.of(component));
      }
      RefCountedBuffer buffer = heap.allocate(layout.size());
      FreshAssignNode.store(Values.normalize(e.getValue()), buffer.getData());
      globals.put(Variables.state(component), buffer);
    }
    for (Map.Entry<String, ?> e : persistent.entrySet()) {
      if (e.getKey().startsWith(Variables.RESERVED_PREFIX)) {
        throw new ProgramValidationException(ErrorMessages.reservedStateKey(e.getKey()));
      }
      Object value = Values.normalize(e.getValue());
      if (value instanceof double[] arr) {
        RefCountedBuffer buffer = heap.allocate(arr.length);
        System.arraycopy(arr, 0, buffer.getData(), 0, arr.length);
        value = buffer;
      }
      globals.put(Variables.PERSISTENT_PREFIX + e.getKey(), value);
    }
    nextState = code.getInitialState();
  }

  /**
   * 执行一个状态函数并返回其产生的事件。
   */
  public List<StepEvent> runState(String name) {
    StateFunctionNode fn = stateFunctions.get(name);
    if (fn == null) {
      throw new ProgramValidationException(ErrorMessages.unknownState(name, "runState"));
    }
    List<StepEvent> collected = new ArrayList<>();
    events = collected;
    try {
      fn.call(this);
    } finally {
      events = null;
    }
    return collected;
  }

  @Override
  public List<StepEvent> runSingleStep() {
    String current = nextState;
    try {
      return runState(current);
    } catch (FailStepException e) {
      nextState = current;
      throw e;
    }
  }

  public StepIterator run(Double tEnd, Integer maxSteps) {
    return new StepIterator(this, tEnd, maxSteps);
  }

  @Override
  public double currentTime() {
    return Values.asDouble(globals.get(Variables.TIME));
  }

  @Override
  public String pendingState() {
    return nextState;
  }

  /**
   * 读取全局变量，ODE 分量返回数组副本；未赋值时返回 null。
   */
  public Object getGlobal(String name) {
    Object value = globals.get(name);
    return value instanceof RefCountedBuffer buffer ? buffer.getData().clone() : value;
  }

  public BufferHeap getHeap() {
    return heap;
  }

  public FunctionRegistry getFunctions() {
    return functions;
  }

  public void registerSolver(String solverId, Solver solver) {
    solvers.put(solverId, solver);
  }

  /**
   * 释放全部全局缓冲区，仍存活的缓冲区作为泄漏报告（非致命）。
   */
  public BufferLeakReport shutdown() {
    releaseGlobals();
    BufferLeakReport report = new BufferLeakReport(heap.getLiveBuffers(), heap.getAllocationCount(), heap.getFreeCount());
    for (BufferLeakReport.Leak leak : report.getLeaks()) {
      logger.log(Level.WARNING, "leaked reference: buffer#{0}, remaining refcount {1}",
          new Object[] {leak.bufferId(), leak.refCount()});
    }
    if (LeapConfig.PROFILE) {
      logger.info(Profiler.dump());
    }
    return report;
  }

  private void releaseGlobals() {
    for (Map.Entry<String, Object> e : globals.entrySet()) {
      if (e.getValue() instanceof RefCountedBuffer buffer) {
        BufferProtocol.deinit(heap, buffer);
      }
    }
    globals.clear();
  }

  Map<String, Object> globals() {
    return globals;
  }

  Solver getSolver(String solverId) {
    return solvers.get(solverId);
  }

  void setNextState(String state) {
    nextState = state;
  }

  void emit(StepEvent event) {
    if (events != null) {
      events.add(event);
    }
  }
}
