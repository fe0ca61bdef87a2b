package leap.truffle.compiled;

public final class SetLabelNode extends StatementNode {
  private final int label;

  public SetLabelNode(int label) {
    this.label = label;
  }

  @Override
  public void execute(CompiledFrame frame) {
    frame.label = label;
  }
}
