package leap.truffle.runtime;

import java.util.*;

/**
 * 依赖图管理器 - 管理指令之间的依赖关系和就绪顺序
 *
 * - 支持指令依赖声明和注册（允许依赖先完成、后注册）
 * - 循环依赖检测（DFS 算法）
 * - 就绪指令查询，按优先级（即程序中的插入序号）升序
 * - 依赖计数优化（避免重复遍历）
 * - 可复制，供控制流组装器在 If 处分叉
 */
public final class DependencyGraph {
  // 指令节点存储：insn_id -> InsnNode（保持插入顺序）
  private final Map<String, InsnNode> nodes = new LinkedHashMap<>();

  // 就绪队列（依赖已满足），按优先级升序（数字越小越先执行）
  private final PriorityQueue<ReadyEntry> readyQueue =
      new PriorityQueue<>(Comparator.comparingInt((ReadyEntry t) -> t.priority).thenComparing(t -> t.insnId));
  // 已完成指令集：支持先完成后注册的依赖
  private final Set<String> completedNodes = new LinkedHashSet<>();

  private static final class ReadyEntry {
    final String insnId;
    final int priority;

    ReadyEntry(String insnId, int priority) {
      this.insnId = insnId;
      this.priority = priority;
    }
  }

  /**
   * 指令节点 - 封装依赖关系和剩余依赖计数
   */
  static final class InsnNode {
    final String insnId;
    final Set<String> dependencies;  // 依赖的指令 ID 集合
    int remainingDeps;                // 剩余未完成的依赖数量
    final int priority;

    InsnNode(String insnId, Set<String> dependencies, int priority) {
      this.insnId = insnId;
      this.dependencies = new LinkedHashSet<>(dependencies);
      this.remainingDeps = this.dependencies.size();
      this.priority = priority;
    }

    InsnNode(InsnNode other) {
      this.insnId = other.insnId;
      this.dependencies = other.dependencies;
      this.remainingDeps = other.remainingDeps;
      this.priority = other.priority;
    }
  }

  public DependencyGraph() {}

  private DependencyGraph(DependencyGraph other) {
    for (InsnNode node : other.nodes.values()) {
      nodes.put(node.insnId, new InsnNode(node));
    }
    for (ReadyEntry task : other.readyQueue) {
      readyQueue.offer(task);
    }
    completedNodes.addAll(other.completedNodes);
  }

  /**
   * 深拷贝当前图（节点计数、就绪队列与完成集合均独立）。
   */
  public DependencyGraph copy() {
    return new DependencyGraph(this);
  }

  /**
   * 添加指令到依赖图
   *
   * @param insnId 指令唯一标识符
   * @param dependencies 依赖的指令 ID 集合（可为空）
   * @param priority 优先级（数值越小越先执行）
   * @throws IllegalArgumentException 如果检测到循环依赖
   */
  public void addInstruction(String insnId, Set<String> dependencies, int priority) {
    if (insnId == null) {
      throw new IllegalArgumentException("insnId cannot be null");
    }

    if (nodes.containsKey(insnId)) {
      throw new IllegalArgumentException("Instruction already registered: " + insnId);
    }

    Set<String> deps = (dependencies == null) ? Collections.emptySet() : dependencies;

    if (hasCycle(insnId, deps)) {
      throw new IllegalArgumentException(ErrorMessages.circularDependency(insnId));
    }

    InsnNode node = new InsnNode(insnId, deps, priority);
    nodes.put(insnId, node);

    for (String dep : node.dependencies) {
      if (completedNodes.contains(dep) && node.remainingDeps > 0) {
        node.remainingDeps--;
      }
    }

    if (node.remainingDeps == 0 && !completedNodes.contains(insnId)) {
      readyQueue.offer(new ReadyEntry(insnId, node.priority));
    }
  }

  /**
   * 标记指令已完成，更新依赖计数
   *
   * @param insnId 已完成的指令 ID（可以不在本图中）
   */
  public void markCompleted(String insnId) {
    if (insnId == null) {
      return;
    }

    readyQueue.removeIf(t -> t.insnId.equals(insnId));
    if (!completedNodes.add(insnId)) {
      return;
    }

    for (InsnNode node : nodes.values()) {
      if (node.remainingDeps > 0 && node.dependencies.contains(insnId)) {
        node.remainingDeps--;

        if (node.remainingDeps == 0 && !completedNodes.contains(node.insnId)) {
          readyQueue.offer(new ReadyEntry(node.insnId, node.priority));
        }
      }
    }
  }

  /**
   * 获取所有就绪指令（依赖已满足），按优先级排序
   *
   * 注意：此方法是非破坏性的，指令在 markCompleted() 时才会从队列中移除。
   */
  public List<String> getReadyInstructions() {
    List<ReadyEntry> sorted = new ArrayList<>(readyQueue);
    sorted.sort(readyQueue.comparator());
    List<String> ready = new ArrayList<>(sorted.size());
    for (ReadyEntry task : sorted) {
      ready.add(task.insnId);
    }
    return ready;
  }

  /**
   * 优先级最高的就绪指令，没有则返回 null。
   */
  public String peekReady() {
    ReadyEntry head = readyQueue.peek();
    return head != null ? head.insnId : null;
  }

  /**
   * 尚未完成的指令，按优先级升序。
   */
  public List<String> getPendingInstructions() {
    List<InsnNode> pending = new ArrayList<>();
    for (InsnNode node : nodes.values()) {
      if (!completedNodes.contains(node.insnId)) {
        pending.add(node);
      }
    }
    pending.sort(Comparator.comparingInt(n -> n.priority));
    List<String> ids = new ArrayList<>(pending.size());
    for (InsnNode node : pending) {
      ids.add(node.insnId);
    }
    return ids;
  }

  /**
   * 检查图中所有指令是否已完成
   */
  public boolean allCompleted() {
    for (InsnNode node : nodes.values()) {
      if (!completedNodes.contains(node.insnId)) {
        return false;
      }
    }
    return true;
  }

  public boolean contains(String insnId) {
    return nodes.containsKey(insnId);
  }

  public boolean isCompleted(String insnId) {
    return completedNodes.contains(insnId);
  }

  /**
   * 获取依赖指定指令的所有后续指令
   */
  public Set<String> getDependents(String insnId) {
    Set<String> dependents = new LinkedHashSet<>();
    for (InsnNode node : nodes.values()) {
      if (node.dependencies.contains(insnId)) {
        dependents.add(node.insnId);
      }
    }
    return dependents;
  }

  /**
   * 循环依赖检测 - 使用 DFS 算法
   */
  private boolean hasCycle(String newId, Set<String> newDeps) {
    Map<String, Set<String>> tempGraph = new HashMap<>();

    for (InsnNode node : nodes.values()) {
      tempGraph.put(node.insnId, node.dependencies);
    }
    tempGraph.put(newId, newDeps);

    Set<String> visited = new HashSet<>();
    Set<String> recursionStack = new HashSet<>();
    return hasCycleDFS(newId, tempGraph, visited, recursionStack);
  }

  private boolean hasCycleDFS(String insnId, Map<String, Set<String>> graph,
                               Set<String> visited, Set<String> recursionStack) {
    visited.add(insnId);
    recursionStack.add(insnId);

    Set<String> dependencies = graph.get(insnId);
    if (dependencies != null) {
      for (String dep : dependencies) {
        // 依赖节点尚未注册时跳过（可能稍后注册，届时再检测）
        if (!graph.containsKey(dep)) {
          continue;
        }

        if (!visited.contains(dep)) {
          if (hasCycleDFS(dep, graph, visited, recursionStack)) {
            return true;
          }
        } else if (recursionStack.contains(dep)) {
          return true;
        }
      }
    }

    recursionStack.remove(insnId);
    return false;
  }

  /**
   * 从依赖图中移除指令
   *
   * 控制器把旧计划中的指令提升到新的计划层时使用。不会更新其他节点的 remainingDeps，
   * 被移除的指令在新层执行完毕后，其完成事件仍会通过 markCompleted() 通知本图。
   */
  public void removeInstruction(String insnId) {
    if (insnId == null) {
      return;
    }
    nodes.remove(insnId);
    readyQueue.removeIf(t -> t.insnId.equals(insnId));
  }

  public int getInstructionCount() {
    return nodes.size();
  }

  public int getReadyCount() {
    return readyQueue.size();
  }
}
