package leap.truffle.compiled;

import leap.truffle.nodes.Profiler;
import leap.truffle.runtime.ErrorMessages;
import leap.truffle.runtime.EvaluationException;

/**
 * {@code a = b}：a 改为共享 b 的缓冲区。
 */
public final class AliasAssignNode extends StatementNode {
  private final SlotRef target;
  private final SlotRef source;

  public AliasAssignNode(SlotRef target, SlotRef source) {
    this.target = target;
    this.source = source;
  }

  @Override
  public void execute(CompiledFrame frame) {
    Profiler.inc("alias");
    RefCountedBuffer src = frame.getBuffer(source);
    if (src == null) {
      throw new EvaluationException(ErrorMessages.variableNotInitialized(source.getName()));
    }
    frame.set(target, BufferProtocol.alias(frame.heap(), frame.getBuffer(target), src));
  }
}
