package leap.truffle.codegen;

import java.util.*;
import java.util.logging.Logger;

/**
 * 结构分析 - 从控制流图恢复嵌套的结构化控制树
 *
 * 参考 Sharir (1980) 的区域归约：按逆后序扫描节点，依次尝试 Block、IfThenElse、IfThen 三种模式，
 * 匹配成功即收缩为复合节点，迭代到不动点。某轮没有任何收缩且剩余多于一个节点时，
 * 剩余节点构成 {@link ControlNode.UnstructuredInterval}。
 *
 * 没有后继的节点（以 Return 或 Halt 结束）可以作为分支臂：它不落到汇合点，
 * 降级后在臂内直接离开函数。
 *
 * 节点存放在 arena 中按下标引用，parent 数组记录“当前代表”（并查集），
 * 后继与前驱每次都经由代表从基本块的边重新计算，不在节点之间维护可变指针。
 */
public final class StructuralExtractor {
  private static final Logger logger = Logger.getLogger(StructuralExtractor.class.getName());

  private final List<ControlNode> arena = new ArrayList<>();
  private final List<Integer> parent = new ArrayList<>();
  private final Map<BasicBlock, Integer> singleOf = new HashMap<>();

  public ControlNode extract(ControlFlowGraph cfg) {
    arena.clear();
    parent.clear();
    singleOf.clear();

    List<BasicBlock> postorder = cfg.postorder();
    for (BasicBlock block : postorder) {
      singleOf.put(block, add(new ControlNode.Single(block)));
    }
    List<Integer> nodes = new ArrayList<>();
    for (int i = postorder.size() - 1; i >= 0; i--) {
      nodes.add(singleOf.get(postorder.get(i)));
    }

    while (nodes.size() > 1) {
      boolean changed = false;
      for (int n : nodes) {
        // 本轮已并入更大的结构
        if (find(n) != n) {
          continue;
        }
        Integer built = checkForBlock(n);
        if (built == null) built = checkForIfThenElse(n);
        if (built == null) built = checkForIfThen(n);
        if (built != null) {
          changed = true;
        }
      }

      if (!changed) {
        List<ControlNode> remaining = new ArrayList<>();
        for (int n : nodes) {
          remaining.add(arena.get(n));
        }
        logger.fine(() -> cfg.getName() + ": irreducible region of " + remaining.size() + " nodes");
        return new ControlNode.UnstructuredInterval(remaining);
      }

      // 保持逆后序：复合节点出现在其入口节点原来的位置
      List<Integer> next = new ArrayList<>();
      for (int n : nodes) {
        int rep = find(n);
        if (arena.get(rep).getEntryBlock() == arena.get(n).getEntryBlock()) {
          next.add(rep);
        }
      }
      nodes = next;
    }
    return arena.get(nodes.get(0));
  }

  private int add(ControlNode node) {
    arena.add(node);
    parent.add(arena.size() - 1);
    return arena.size() - 1;
  }

  private int find(int i) {
    int root = i;
    while (parent.get(root) != root) {
      root = parent.get(root);
    }
    while (parent.get(i) != root) {
      int up = parent.get(i);
      parent.set(i, root);
      i = up;
    }
    return root;
  }

  private int contract(ControlNode composite, List<Integer> members) {
    int k = add(composite);
    for (int m : members) {
      parent.set(m, k);
    }
    return k;
  }

  private Set<Integer> successors(int i) {
    ControlNode node = arena.get(i);
    BasicBlock entry = node.getEntryBlock();
    Set<Integer> out = new LinkedHashSet<>();
    for (BasicBlock b : node.getBlocks()) {
      for (BasicBlock s : b.getSuccessors()) {
        Integer single = singleOf.get(s);
        if (single == null) continue;
        int rep = find(single);
        // 指向自身入口的边是回边，其余内部边忽略
        if (rep != i || s == entry) {
          out.add(rep);
        }
      }
    }
    return out;
  }

  private Set<Integer> predecessors(int i) {
    Set<Integer> out = new LinkedHashSet<>();
    for (BasicBlock p : arena.get(i).getEntryBlock().getPredecessors()) {
      Integer single = singleOf.get(p);
      if (single != null) {
        out.add(find(single));
      }
    }
    return out;
  }

  private static int only(Set<Integer> set) {
    return set.iterator().next();
  }

  private BasicBlock.Branch branchOf(int n) {
    BasicBlock exit = arena.get(n).getExitBlock();
    if (exit != null && exit.getTerminator() instanceof BasicBlock.Branch br) {
      return br;
    }
    return null;
  }

  private Integer checkForBlock(int n) {
    Set<Integer> inChain = new HashSet<>();
    inChain.add(n);

    List<Integer> before = new ArrayList<>();
    int current = n;
    while (true) {
      Set<Integer> preds = predecessors(current);
      if (preds.size() != 1) break;
      int p = only(preds);
      if (inChain.contains(p) || successors(p).size() != 1) break;
      before.add(p);
      inChain.add(p);
      current = p;
    }

    List<Integer> after = new ArrayList<>();
    current = n;
    while (true) {
      Set<Integer> succs = successors(current);
      if (succs.size() != 1) break;
      int s = only(succs);
      if (inChain.contains(s) || predecessors(s).size() != 1) break;
      after.add(s);
      inChain.add(s);
      current = s;
    }

    if (before.isEmpty() && after.isEmpty()) {
      return null;
    }

    List<Integer> members = new ArrayList<>(before);
    Collections.reverse(members);
    members.add(n);
    members.addAll(after);

    List<ControlNode> children = new ArrayList<>();
    for (int m : members) {
      ControlNode child = arena.get(m);
      if (child instanceof ControlNode.Block inner) {
        children.addAll(inner.getChildren());
      } else {
        children.add(child);
      }
    }
    return contract(new ControlNode.Block(children), members);
  }

  private Integer checkForIfThen(int n) {
    Set<Integer> succs = successors(n);
    if (succs.size() != 2) return null;
    BasicBlock.Branch branch = branchOf(n);
    if (branch == null) return null;

    Iterator<Integer> it = succs.iterator();
    int first = it.next();
    int second = it.next();
    Integer built = tryIfThen(n, first, second, branch);
    return built != null ? built : tryIfThen(n, second, first, branch);
  }

  private Integer tryIfThen(int n, int then, int merge, BasicBlock.Branch branch) {
    if (n == then || n == merge || predecessors(then).size() != 1) {
      return null;
    }
    Set<Integer> thenSuccs = successors(then);
    if (!thenSuccs.isEmpty() && !thenSuccs.equals(Set.of(merge))) {
      return null;
    }
    boolean negated = arena.get(then).getEntryBlock() == branch.onFalse();
    return contract(new ControlNode.IfThen(arena.get(n), arena.get(then), negated,
        arena.get(merge).getEntryBlock()), List.of(n, then));
  }

  private Integer checkForIfThenElse(int n) {
    Set<Integer> succs = successors(n);
    if (succs.size() != 2) return null;
    BasicBlock.Branch branch = branchOf(n);
    if (branch == null) return null;

    // 以分支指令的真/假目标确定 then 与 else，而非图的形状
    Integer then = null;
    Integer otherwise = null;
    for (int s : succs) {
      BasicBlock entry = arena.get(s).getEntryBlock();
      if (entry == branch.onTrue()) then = s;
      else if (entry == branch.onFalse()) otherwise = s;
    }
    if (then == null || otherwise == null) return null;
    if (n == then || n == otherwise) return null;
    if (predecessors(then).size() != 1 || predecessors(otherwise).size() != 1) return null;

    // 两臂至多共享一个汇合点；没有后继的臂不参与汇合
    Set<Integer> exits = new LinkedHashSet<>(successors(then));
    exits.addAll(successors(otherwise));
    if (exits.size() > 1) return null;
    BasicBlock follow = null;
    if (!exits.isEmpty()) {
      int merge = only(exits);
      if (n == merge || then == merge || otherwise == merge) return null;
      follow = arena.get(merge).getEntryBlock();
    }
    return contract(new ControlNode.IfThenElse(arena.get(n), arena.get(then), arena.get(otherwise), follow),
        List.of(n, then, otherwise));
  }
}
