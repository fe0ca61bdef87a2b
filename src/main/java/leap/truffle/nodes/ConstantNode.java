package leap.truffle.nodes;

import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;

/**
 * 常量节点（实数或布尔）。
 */
public final class ConstantNode extends LeapExpressionNode {
  @CompilationFinal private final Object value;

  public ConstantNode(Object value) {
    this.value = value;
  }

  @Override
  public Object executeGeneric(EvalScope scope) {
    Profiler.inc("constant");
    return value;
  }
}
