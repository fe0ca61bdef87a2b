package leap.truffle.runtime;

import leap.truffle.core.IrModel;
import leap.truffle.core.TimeIntegratorCode;
import java.util.*;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 执行控制器 - 依赖驱动的增量调度
 *
 * 计划按层组织：每次 updatePlan() 压入一层新的 DependencyGraph，新层优先执行，
 * 层内按指令插入序号决胜。If 的分支依赖在执行期间动态追加，因此计划是增量的，
 * 而不是一次性拓扑排序。
 *
 * 解释器与控制流组装器共用本类，二者的指令顺序因此一致。
 */
public final class ExecutionController {
  private static final Logger logger = Logger.getLogger(ExecutionController.class.getName());

  private final TimeIntegratorCode code;
  private final Set<String> executedIds = new LinkedHashSet<>();
  // 栈顶为最新计划层
  private final Deque<DependencyGraph> layers = new ArrayDeque<>();

  public ExecutionController(TimeIntegratorCode code) {
    this.code = Objects.requireNonNull(code, "code");
  }

  private ExecutionController(ExecutionController other) {
    this.code = other.code;
    this.executedIds.addAll(other.executedIds);
    // ArrayDeque 迭代从栈顶开始，逆序复制以保持层次
    Iterator<DependencyGraph> it = other.layers.descendingIterator();
    while (it.hasNext()) {
      this.layers.push(it.next().copy());
    }
  }

  public TimeIntegratorCode getCode() {
    return code;
  }

  /**
   * 清空本次运行的全部调度状态。
   */
  public void reset() {
    executedIds.clear();
    layers.clear();
  }

  /**
   * 追加需要完成的指令，连同其尚未执行的传递依赖，作为新的最高优先层。
   */
  public void updatePlan(Collection<String> requiredIds) {
    Set<String> closure = new HashSet<>();
    Deque<String> work = new ArrayDeque<>(requiredIds);
    while (!work.isEmpty()) {
      String id = work.pop();
      if (executedIds.contains(id) || !closure.add(id)) {
        continue;
      }
      work.addAll(code.getInstruction(id).dependsOn);
    }

    List<String> sorted = new ArrayList<>(closure);
    sorted.sort(Comparator.comparingInt(code::orderOf));

    DependencyGraph layer = new DependencyGraph();
    for (String done : executedIds) {
      layer.markCompleted(done);
    }
    for (String id : sorted) {
      for (DependencyGraph older : layers) {
        older.removeInstruction(id);
      }
      layer.addInstruction(id, code.getInstruction(id).dependsOn, code.orderOf(id));
    }
    layers.push(layer);
  }

  /**
   * 选出下一条可执行指令；计划层数降到 floor 及以下时返回 null。
   *
   * @param floor 调用方拥有的最低层数（完整运行为 0）
   */
  public String nextReady(int floor) {
    while (layers.size() > floor) {
      DependencyGraph top = layers.peek();
      if (top.allCompleted()) {
        layers.pop();
        continue;
      }
      String id = top.peekReady();
      if (id == null) {
        throw new IllegalStateException(ErrorMessages.stalledPlan(top.getPendingInstructions()));
      }
      return id;
    }
    return null;
  }

  /**
   * 记录指令已满足，通知所有计划层。
   */
  public void markExecuted(String id) {
    executedIds.add(id);
    for (DependencyGraph layer : layers) {
      layer.markCompleted(id);
    }
  }

  /**
   * 驱动执行直到计划耗尽。
   *
   * FailStep / Raise 的异常不在此捕获，由调用方决定恢复策略。
   *
   * @param executor 指令执行器
   * @param sink 接收执行器产生的事件
   */
  public <E> void run(InstructionExecutor<E> executor, Consumer<E> sink) {
    String id;
    while ((id = nextReady(0)) != null) {
      IrModel.Instruction insn = code.getInstruction(id);
      checkDependencies(insn);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("execution trace: [" + id + "] " + insn);
      }
      markExecuted(id);
      ExecutionResult<E> result = insn.execute(executor);
      if (result.getEvent() != null) {
        sink.accept(result.getEvent());
      }
      if (!result.getNewDependencies().isEmpty()) {
        updatePlan(result.getNewDependencies());
      }
    }
  }

  /**
   * 指令的依赖必须已全部执行，否则属于调度器内部错误。
   */
  public void checkDependencies(IrModel.Instruction insn) {
    for (String dep : insn.dependsOn) {
      if (!executedIds.contains(dep)) {
        throw new IllegalStateException(ErrorMessages.unsatisfiedDependency(insn.id, dep));
      }
    }
  }

  /**
   * 复制当前调度状态（控制流组装器在 If 处分叉使用）。
   */
  public ExecutionController copy() {
    return new ExecutionController(this);
  }

  public int depth() {
    return layers.size();
  }

  public Set<String> getExecutedIds() {
    return Collections.unmodifiableSet(executedIds);
  }

  /**
   * 剩余计划：每层未完成的指令，从最新层到最旧层。
   */
  public List<List<String>> pendingPlan() {
    List<List<String>> plan = new ArrayList<>();
    for (DependencyGraph layer : layers) {
      List<String> pending = layer.getPendingInstructions();
      if (!pending.isEmpty()) {
        plan.add(pending);
      }
    }
    return plan;
  }
}
