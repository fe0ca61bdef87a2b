package leap.truffle.codegen;

import leap.truffle.core.IrModel;
import leap.truffle.core.TimeIntegratorCode;
import leap.truffle.runtime.ExecutionController;
import java.util.*;
import java.util.logging.Logger;

/**
 * 控制流组装器 - 把一个程序状态的依赖图线性化为基本块控制流图
 *
 * 线性化直接驱动 {@link ExecutionController}，因此与解释执行的指令顺序一致。
 * 每个 If 结束当前块并分叉出 then/else 两份控制器副本；两臂结束后若剩余计划相同、
 * 且只在一臂执行过的指令此后都不会再被需要，则在新的汇合块合并，否则两臂各自继续
 * （尾部复制）。FailStep 与 Raise 终止所在路径，所在块以 Halt 结束而不连到出口；
 * 其余开放路径最后跳转到唯一出口块。
 */
public final class ControlFlowAssembler {
  private static final Logger logger = Logger.getLogger(ControlFlowAssembler.class.getName());

  private final TimeIntegratorCode code;
  private ControlFlowGraph cfg;

  /** 一条尚未终结的路径。 */
  private record Open(BasicBlock block, ExecutionController controller, boolean finished) {}

  public ControlFlowAssembler(TimeIntegratorCode code) {
    this.code = code;
  }

  /**
   * 为一个程序状态构建控制流图。
   *
   * @param name 函数名（通常为状态名）
   * @param required 该状态需要完成的指令集合
   */
  public ControlFlowGraph assemble(String name, Set<String> required) {
    cfg = new ControlFlowGraph(name);
    ExecutionController controller = new ExecutionController(code);
    controller.updatePlan(required);

    for (Open end : sequence(cfg.getEntry(), controller, 0)) {
      if (!end.finished()) {
        end.block().terminate(new BasicBlock.Jump(cfg.getExit()));
      }
    }
    cfg.computePredecessors();
    logger.fine(() -> "assembled " + name + ":\n" + cfg.dump());
    ControlFlowGraph result = cfg;
    cfg = null;
    return result;
  }

  private List<Open> sequence(BasicBlock start, ExecutionController controller, int floor) {
    List<Open> finished = new ArrayList<>();
    BasicBlock block = start;
    ExecutionController ctl = controller;

    String id;
    while ((id = ctl.nextReady(floor)) != null) {
      IrModel.Instruction insn = code.getInstruction(id);
      ctl.checkDependencies(insn);
      ctl.markExecuted(id);

      if (insn instanceof IrModel.If branch) {
        int depth = ctl.depth();
        ExecutionController thenCtl = ctl.copy();
        thenCtl.updatePlan(branch.thenDependsOn);
        ExecutionController elseCtl = ctl.copy();
        elseCtl.updatePlan(branch.elseDependsOn);

        BasicBlock thenBlock = cfg.newBlock();
        BasicBlock elseBlock = cfg.newBlock();
        block.terminate(new BasicBlock.Branch(branch.condition, thenBlock, elseBlock));

        List<Open> ends = new ArrayList<>(sequence(thenBlock, thenCtl, depth));
        ends.addAll(sequence(elseBlock, elseCtl, depth));

        List<Open> live = new ArrayList<>();
        for (Open end : ends) {
          if (end.finished()) {
            finished.add(end);
          } else {
            live.add(end);
          }
        }
        if (live.isEmpty()) {
          return finished;
        }
        if (live.size() == 1) {
          block = live.get(0).block();
          ctl = live.get(0).controller();
        } else if (canMerge(live)) {
          BasicBlock merge = cfg.newBlock();
          for (Open end : live) {
            end.block().terminate(new BasicBlock.Jump(merge));
          }
          block = merge;
          ctl = live.get(0).controller();
        } else {
          for (Open end : live) {
            finished.addAll(sequence(end.block(), end.controller(), floor));
          }
          return finished;
        }
        continue;
      }

      block.add(insn);
      if (insn instanceof IrModel.FailStep || insn instanceof IrModel.Raise) {
        block.terminate(new BasicBlock.Halt());
        finished.add(new Open(block, ctl, true));
        return finished;
      }
    }
    finished.add(new Open(block, ctl, false));
    return finished;
  }

  /**
   * 剩余计划一致，且只在部分路径上执行过的指令不会被剩余计划（含其 If 分支）再次需要。
   */
  private boolean canMerge(List<Open> ends) {
    List<List<String>> plan = ends.get(0).controller().pendingPlan();
    Set<String> union = new HashSet<>();
    Set<String> intersection = new HashSet<>(ends.get(0).controller().getExecutedIds());
    for (Open end : ends) {
      if (!end.controller().pendingPlan().equals(plan)) {
        return false;
      }
      union.addAll(end.controller().getExecutedIds());
      intersection.retainAll(end.controller().getExecutedIds());
    }
    union.removeAll(intersection);
    if (union.isEmpty()) {
      return true;
    }

    Set<String> potentiallyRequired = new HashSet<>();
    Deque<String> work = new ArrayDeque<>();
    for (List<String> layer : plan) {
      work.addAll(layer);
    }
    while (!work.isEmpty()) {
      String id = work.pop();
      // 各路径都已执行的指令（含已决定分支的 If）不再展开
      if (intersection.contains(id) || !potentiallyRequired.add(id)) {
        continue;
      }
      IrModel.Instruction insn = code.getInstruction(id);
      work.addAll(insn.dependsOn);
      if (insn instanceof IrModel.If branch) {
        work.addAll(branch.thenDependsOn);
        work.addAll(branch.elseDependsOn);
      }
    }
    return Collections.disjoint(union, potentiallyRequired);
  }
}
