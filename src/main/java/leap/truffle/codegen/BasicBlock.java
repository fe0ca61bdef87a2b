package leap.truffle.codegen;

import leap.truffle.core.IrModel;
import java.util.*;

/**
 * 基本块：顺序执行的指令列表加一个终结符。
 */
public final class BasicBlock {

  /** 块终结符。 */
  public sealed interface Terminator permits Jump, Branch, Return, Halt {}

  public record Jump(BasicBlock target) implements Terminator {}

  public record Branch(IrModel.Expr condition, BasicBlock onTrue, BasicBlock onFalse) implements Terminator {}

  public record Return() implements Terminator {}

  /** 块内最后一条指令（FailStep 或 Raise）自行离开函数，块没有后继。 */
  public record Halt() implements Terminator {}

  private final int number;
  private final List<IrModel.Instruction> code = new ArrayList<>();
  private Terminator terminator;
  private final Set<BasicBlock> predecessors = new LinkedHashSet<>();

  BasicBlock(int number) {
    this.number = number;
  }

  public int getNumber() {
    return number;
  }

  public List<IrModel.Instruction> getCode() {
    return Collections.unmodifiableList(code);
  }

  public void add(IrModel.Instruction insn) {
    if (terminator != null) {
      throw new IllegalStateException("block " + number + " is already terminated");
    }
    code.add(insn);
  }

  public Terminator getTerminator() {
    return terminator;
  }

  public boolean isTerminated() {
    return terminator != null;
  }

  public void terminate(Terminator terminator) {
    if (this.terminator != null) {
      throw new IllegalStateException("block " + number + " is already terminated");
    }
    this.terminator = terminator;
  }

  /**
   * 后继块，Branch 的顺序为 (onTrue, onFalse)。
   */
  public List<BasicBlock> getSuccessors() {
    if (terminator instanceof Jump j) return List.of(j.target());
    if (terminator instanceof Branch b) return List.of(b.onTrue(), b.onFalse());
    return List.of();
  }

  public Set<BasicBlock> getPredecessors() {
    return Collections.unmodifiableSet(predecessors);
  }

  void addPredecessor(BasicBlock block) {
    predecessors.add(block);
  }

  void clearPredecessors() {
    predecessors.clear();
  }

  @Override
  public String toString() {
    return "block" + number;
  }
}
