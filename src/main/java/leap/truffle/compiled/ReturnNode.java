package leap.truffle.compiled;

import leap.truffle.codegen.StructuredCodeGenerator;

/**
 * 函数出口。局部变量的释放由 {@link StateFunctionNode} 统一完成，这里只结束分派循环。
 */
public final class ReturnNode extends StatementNode {
  @Override
  public void execute(CompiledFrame frame) {
    frame.label = StructuredCodeGenerator.EXIT_LABEL;
  }
}
