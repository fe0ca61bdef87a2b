package leap.truffle.runtime;

import leap.truffle.core.IrModel;
import java.util.Map;

/**
 * 非线性求解器（解释器路径）：求 unknown 使 expression 为零。
 *
 * context 为只读视图，需要试探取值时复制到自己的工作表中。
 */
@FunctionalInterface
public interface Solver {
  Object solve(IrModel.Expr expression, String unknown, Map<String, Object> context,
      FunctionRegistry functions, Object guess);
}
