package leap.truffle.codegen;

import java.util.*;

/**
 * 一个程序状态对应的控制流图，入口唯一、正常返回的出口唯一。
 * 以 FailStep 或 Raise 结束的块用 {@link BasicBlock.Halt} 终结，不连到出口。
 */
public final class ControlFlowGraph {
  private final String name;
  private final List<BasicBlock> blocks = new ArrayList<>();
  private final BasicBlock entry;
  private final BasicBlock exit;

  public ControlFlowGraph(String name) {
    this.name = name;
    this.entry = newBlock();
    this.exit = newBlock();
    exit.terminate(new BasicBlock.Return());
  }

  public String getName() {
    return name;
  }

  public BasicBlock newBlock() {
    BasicBlock block = new BasicBlock(blocks.size());
    blocks.add(block);
    return block;
  }

  public BasicBlock getEntry() {
    return entry;
  }

  public BasicBlock getExit() {
    return exit;
  }

  /**
   * 从入口可达的全部块（按创建顺序）。
   */
  public List<BasicBlock> getBlocks() {
    Set<BasicBlock> reachable = new HashSet<>(postorder());
    List<BasicBlock> result = new ArrayList<>();
    for (BasicBlock b : blocks) {
      if (reachable.contains(b)) result.add(b);
    }
    return result;
  }

  /**
   * 根据终结符重建前驱集合，只统计可达块。
   */
  public void computePredecessors() {
    for (BasicBlock b : blocks) {
      b.clearPredecessors();
    }
    for (BasicBlock b : postorder()) {
      for (BasicBlock s : b.getSuccessors()) {
        s.addPredecessor(b);
      }
    }
  }

  /**
   * 从入口出发的 DFS 后序。
   */
  public List<BasicBlock> postorder() {
    List<BasicBlock> order = new ArrayList<>();
    Set<BasicBlock> visited = new HashSet<>();
    Deque<Iterator<BasicBlock>> stack = new ArrayDeque<>();
    Deque<BasicBlock> path = new ArrayDeque<>();
    visited.add(entry);
    stack.push(entry.getSuccessors().iterator());
    path.push(entry);
    while (!stack.isEmpty()) {
      Iterator<BasicBlock> it = stack.peek();
      if (it.hasNext()) {
        BasicBlock next = it.next();
        if (visited.add(next)) {
          stack.push(next.getSuccessors().iterator());
          path.push(next);
        }
      } else {
        stack.pop();
        order.add(path.pop());
      }
    }
    return order;
  }

  /**
   * 文本形式，调试用。
   */
  public String dump() {
    StringBuilder sb = new StringBuilder("function ").append(name).append('\n');
    for (BasicBlock b : getBlocks()) {
      sb.append("  ").append(b).append(':').append('\n');
      for (var insn : b.getCode()) {
        sb.append("    ").append(insn).append('\n');
      }
      BasicBlock.Terminator t = b.getTerminator();
      if (t instanceof BasicBlock.Jump j) {
        sb.append("    jump ").append(j.target()).append('\n');
      } else if (t instanceof BasicBlock.Branch br) {
        sb.append("    branch ").append(br.condition()).append(" ? ").append(br.onTrue())
            .append(" : ").append(br.onFalse()).append('\n');
      } else if (t instanceof BasicBlock.Halt) {
        sb.append("    halt\n");
      } else {
        sb.append("    return\n");
      }
    }
    return sb.toString();
  }
}
