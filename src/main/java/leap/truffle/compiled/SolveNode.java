package leap.truffle.compiled;

import leap.truffle.core.IrModel;
import leap.truffle.core.ProgramValidationException;
import leap.truffle.nodes.LeapExpressionNode;
import leap.truffle.runtime.ErrorMessages;
import leap.truffle.runtime.Solver;
import leap.truffle.runtime.Values;
import com.oracle.truffle.api.CompilerDirectives.TruffleBoundary;

/**
 * 隐式求解赋值，调用程序登记的求解器。
 *
 * size 为负表示被赋值变量是标量。
 */
public final class SolveNode extends StatementNode {
  private final SlotRef target;
  private final IrModel.AssignSolved insn;
  private final int size;
  @Child private LeapExpressionNode guess;

  public SolveNode(SlotRef target, IrModel.AssignSolved insn, LeapExpressionNode guess, int size) {
    this.target = target;
    this.insn = insn;
    this.guess = guess;
    this.size = size;
  }

  @Override
  public void execute(CompiledFrame frame) {
    Object initial = guess.executeGeneric(frame);
    Object result = solve(frame, initial);
    if (size < 0) {
      frame.set(target, result);
    } else {
      RefCountedBuffer buffer = BufferProtocol.ensureUnique(frame.heap(), frame.getBuffer(target), size);
      frame.set(target, buffer);
      FreshAssignNode.store(result, buffer.getData());
    }
  }

  @TruffleBoundary
  private Object solve(CompiledFrame frame, Object initial) {
    Solver solver = frame.program().getSolver(insn.solverId);
    if (solver == null) {
      throw new ProgramValidationException(ErrorMessages.unknownSolver(insn.solverId));
    }
    return Values.normalize(solver.solve(insn.expression, insn.solveComponent, frame.snapshot(),
        frame.functions(), initial));
  }
}
