package leap.truffle.nodes;

import leap.truffle.runtime.ErrorMessages;
import leap.truffle.runtime.EvaluationException;
import leap.truffle.runtime.FunctionRegistry;
import java.util.Map;

/**
 * 基于 Map 的求值环境。
 */
public final class MapScope implements EvalScope {
  private final Map<String, Object> values;
  private final FunctionRegistry functions;

  public MapScope(Map<String, Object> values, FunctionRegistry functions) {
    this.values = values;
    this.functions = functions;
  }

  @Override
  public Object read(String name) {
    Object value = values.get(name);
    if (value == null) {
      throw new EvaluationException(ErrorMessages.variableNotInitialized(name));
    }
    return value;
  }

  @Override
  public FunctionRegistry functions() {
    return functions;
  }
}
