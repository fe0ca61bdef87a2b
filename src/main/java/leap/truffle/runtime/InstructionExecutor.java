package leap.truffle.runtime;

import leap.truffle.core.IrModel;

/**
 * 指令执行器：每个指令变体对应一个 exec 方法。
 *
 * <p>解释器与代码生成前端实现同一接口，由 {@link ExecutionController} 统一驱动，
 * 因此两条路径的调度顺序完全一致。</p>
 *
 * @param <E> 执行器产生的可观察事件类型
 */
public interface InstructionExecutor<E> {

  ExecutionResult<E> execAssignExpression(IrModel.AssignExpression insn);

  ExecutionResult<E> execAssignSolved(IrModel.AssignSolved insn);

  /**
   * 求值条件，并通过 {@link ExecutionResult#require} 返回被选中分支的依赖集合。
   */
  ExecutionResult<E> execIf(IrModel.If insn);

  ExecutionResult<E> execYieldState(IrModel.YieldState insn);

  /** 抛出 {@link FailStepException}，或在代码生成时记录该指令。 */
  ExecutionResult<E> execFailStep(IrModel.FailStep insn);

  /** 抛出 {@link LeapRaisedException}，或在代码生成时记录该指令。 */
  ExecutionResult<E> execRaise(IrModel.Raise insn);

  ExecutionResult<E> execStateTransition(IrModel.StateTransition insn);

  default ExecutionResult<E> execNop(IrModel.Nop insn) {
    return ExecutionResult.none();
  }
}
