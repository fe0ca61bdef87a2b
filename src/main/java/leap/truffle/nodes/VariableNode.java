package leap.truffle.nodes;

import leap.truffle.runtime.LeapConfig;
import leap.truffle.runtime.Values;
import com.oracle.truffle.api.CompilerDirectives.TruffleBoundary;
import java.util.logging.Logger;

/**
 * 变量读取节点。
 */
public final class VariableNode extends LeapExpressionNode {
  private static final Logger logger = Logger.getLogger(VariableNode.class.getName());

  private final String name;

  public VariableNode(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public Object executeGeneric(EvalScope scope) {
    Profiler.inc("variable");
    Object value = scope.read(name);
    if (LeapConfig.DEBUG) {
      traceRead(value);
    }
    return value;
  }

  @TruffleBoundary
  private void traceRead(Object value) {
    logger.info("read " + name + " => " + Values.typeName(value));
  }
}
