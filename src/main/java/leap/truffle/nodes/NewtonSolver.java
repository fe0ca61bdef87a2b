package leap.truffle.nodes;

import leap.truffle.core.IrModel;
import leap.truffle.runtime.ErrorMessages;
import leap.truffle.runtime.EvaluationException;
import leap.truffle.runtime.FunctionRegistry;
import leap.truffle.runtime.Solver;
import leap.truffle.runtime.Values;
import java.util.HashMap;
import java.util.Map;

/**
 * 标量 Newton 迭代求解器，导数用中心差分近似。
 */
public final class NewtonSolver implements Solver {
  private final double tolerance;
  private final int maxIterations;

  public NewtonSolver() {
    this(1e-12, 50);
  }

  public NewtonSolver(double tolerance, int maxIterations) {
    this.tolerance = tolerance;
    this.maxIterations = maxIterations;
  }

  @Override
  public Object solve(IrModel.Expr expression, String unknown, Map<String, Object> context,
      FunctionRegistry functions, Object guess) {
    LeapExpressionNode node = ExpressionNodes.build(expression);
    Map<String, Object> scratch = new HashMap<>(context);
    MapScope scope = new MapScope(scratch, functions);

    double x = Values.asDouble(guess);
    for (int i = 0; i < maxIterations; i++) {
      double fx = evalAt(node, scope, scratch, unknown, x);
      if (Math.abs(fx) <= tolerance) {
        return x;
      }
      double h = 1e-7 * Math.max(1.0, Math.abs(x));
      double slope = (evalAt(node, scope, scratch, unknown, x + h)
          - evalAt(node, scope, scratch, unknown, x - h)) / (2 * h);
      if (slope == 0.0) {
        break;
      }
      x -= fx / slope;
    }
    throw new EvaluationException(ErrorMessages.bilingual(
        "Newton 迭代未收敛：" + unknown, "Newton iteration did not converge for " + unknown));
  }

  private static double evalAt(LeapExpressionNode node, MapScope scope, Map<String, Object> scratch,
      String unknown, double x) {
    scratch.put(unknown, x);
    return Values.asDouble(node.executeGeneric(scope));
  }
}
