package leap.truffle.codegen;

import java.util.*;

/**
 * 结构化控制树节点。
 *
 * 每个程序状态构建一次，由代码生成器消费一次。
 */
public abstract sealed class ControlNode
    permits ControlNode.Single, ControlNode.Block, ControlNode.IfThen, ControlNode.IfThenElse,
        ControlNode.UnstructuredInterval {

  public interface Visitor<R> {
    R visitSingle(Single node);
    R visitBlock(Block node);
    R visitIfThen(IfThen node);
    R visitIfThenElse(IfThenElse node);
    R visitUnstructuredInterval(UnstructuredInterval node);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public abstract BasicBlock getEntryBlock();

  /**
   * 以分支或跳转离开本节点的块；If 结构以汇合边离开，返回 null。
   */
  public abstract BasicBlock getExitBlock();

  /** 包含的全部基本块。 */
  public abstract List<BasicBlock> getBlocks();

  /**
   * 以汇合边离开本节点时到达的块。Block 取最后一个子节点的汇合块；
   * 以终结符离开的节点以及所有路径都不落出的节点返回 null。
   */
  public BasicBlock getFollow() {
    return null;
  }

  /** 单个基本块。 */
  public static final class Single extends ControlNode {
    private final BasicBlock block;

    public Single(BasicBlock block) {
      this.block = block;
    }

    public BasicBlock getBlock() {
      return block;
    }

    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitSingle(this); }
    @Override public BasicBlock getEntryBlock() { return block; }
    @Override public BasicBlock getExitBlock() { return block; }
    @Override public List<BasicBlock> getBlocks() { return List.of(block); }
    @Override public String toString() { return "Single(" + block + ")"; }
  }

  /** 直线链。 */
  public static final class Block extends ControlNode {
    private final List<ControlNode> children;

    public Block(List<ControlNode> children) {
      this.children = List.copyOf(children);
    }

    public List<ControlNode> getChildren() {
      return children;
    }

    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitBlock(this); }
    @Override public BasicBlock getEntryBlock() { return children.get(0).getEntryBlock(); }
    @Override public BasicBlock getExitBlock() { return children.get(children.size() - 1).getExitBlock(); }
    @Override public BasicBlock getFollow() { return children.get(children.size() - 1).getFollow(); }
    @Override public List<BasicBlock> getBlocks() { return collect(children); }
    @Override public String toString() { return "Block" + children; }
  }

  /**
   * if-then。negated 为真时 then 分支位于条件的 false 出口。
   */
  public static final class IfThen extends ControlNode {
    private final ControlNode condition;
    private final ControlNode then;
    private final boolean negated;
    private final BasicBlock follow;

    public IfThen(ControlNode condition, ControlNode then, boolean negated, BasicBlock follow) {
      this.condition = condition;
      this.then = then;
      this.negated = negated;
      this.follow = follow;
    }

    public ControlNode getCondition() { return condition; }
    public ControlNode getThen() { return then; }
    public boolean isNegated() { return negated; }
    /** 汇合块（结构外）。 */
    @Override public BasicBlock getFollow() { return follow; }

    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitIfThen(this); }
    @Override public BasicBlock getEntryBlock() { return condition.getEntryBlock(); }
    @Override public BasicBlock getExitBlock() { return null; }
    @Override public List<BasicBlock> getBlocks() { return collect(List.of(condition, then)); }
    @Override public String toString() { return "IfThen(" + condition + (negated ? ", not " : ", ") + then + ")"; }
  }

  public static final class IfThenElse extends ControlNode {
    private final ControlNode condition;
    private final ControlNode then;
    private final ControlNode otherwise;
    private final BasicBlock follow;

    public IfThenElse(ControlNode condition, ControlNode then, ControlNode otherwise, BasicBlock follow) {
      this.condition = condition;
      this.then = then;
      this.otherwise = otherwise;
      this.follow = follow;
    }

    public ControlNode getCondition() { return condition; }
    public ControlNode getThen() { return then; }
    public ControlNode getElse() { return otherwise; }
    /** 汇合块；两臂都不落出时为 null。 */
    @Override public BasicBlock getFollow() { return follow; }

    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitIfThenElse(this); }
    @Override public BasicBlock getEntryBlock() { return condition.getEntryBlock(); }
    @Override public BasicBlock getExitBlock() { return null; }
    @Override public List<BasicBlock> getBlocks() { return collect(List.of(condition, then, otherwise)); }
    @Override public String toString() { return "IfThenElse(" + condition + ", " + then + ", " + otherwise + ")"; }
  }

  /**
   * 无法归约的区域，按逆后序保存剩余节点，第一个节点为区域入口。
   */
  public static final class UnstructuredInterval extends ControlNode {
    private final List<ControlNode> nodes;

    public UnstructuredInterval(List<ControlNode> nodes) {
      this.nodes = List.copyOf(nodes);
    }

    public List<ControlNode> getNodes() {
      return nodes;
    }

    @Override public <R> R accept(Visitor<R> visitor) { return visitor.visitUnstructuredInterval(this); }
    @Override public BasicBlock getEntryBlock() { return nodes.get(0).getEntryBlock(); }
    @Override public BasicBlock getExitBlock() { return null; }
    @Override public List<BasicBlock> getBlocks() { return collect(nodes); }
    @Override public String toString() { return "UnstructuredInterval" + nodes; }
  }

  private static List<BasicBlock> collect(List<ControlNode> nodes) {
    List<BasicBlock> blocks = new ArrayList<>();
    for (ControlNode n : nodes) {
      blocks.addAll(n.getBlocks());
    }
    return blocks;
  }
}
