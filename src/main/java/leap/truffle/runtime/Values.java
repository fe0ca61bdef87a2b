package leap.truffle.runtime;

import com.oracle.truffle.api.CompilerDirectives.TruffleBoundary;
import java.util.function.DoubleBinaryOperator;

/**
 * 运行时值的算术语义。
 *
 * 值只有三种表示：Double（实标量）、Boolean、double[]（ODE 分量）。
 * 标量与向量运算时按元素广播，向量之间要求长度一致。
 * 所有运算都返回新数组，不修改操作数。
 */
public final class Values {
  private Values() {}

  public static Object add(Object a, Object b) {
    return combine(a, b, Double::sum);
  }

  public static Object multiply(Object a, Object b) {
    return combine(a, b, (x, y) -> x * y);
  }

  public static Object divide(Object a, Object b) {
    return combine(a, b, (x, y) -> x / y);
  }

  public static Object power(Object a, Object b) {
    return combine(a, b, Math::pow);
  }

  @TruffleBoundary
  private static Object combine(Object a, Object b, DoubleBinaryOperator op) {
    if (a instanceof Double x && b instanceof Double y) {
      return op.applyAsDouble(x, y);
    }
    if (a instanceof double[] xs && b instanceof Double y) {
      double[] out = new double[xs.length];
      for (int i = 0; i < xs.length; i++) out[i] = op.applyAsDouble(xs[i], y);
      return out;
    }
    if (a instanceof Double x && b instanceof double[] ys) {
      double[] out = new double[ys.length];
      for (int i = 0; i < ys.length; i++) out[i] = op.applyAsDouble(x, ys[i]);
      return out;
    }
    if (a instanceof double[] xs && b instanceof double[] ys) {
      if (xs.length != ys.length) {
        throw new EvaluationException(ErrorMessages.vectorLengthMismatch(xs.length, ys.length));
      }
      double[] out = new double[xs.length];
      for (int i = 0; i < xs.length; i++) out[i] = op.applyAsDouble(xs[i], ys[i]);
      return out;
    }
    throw new EvaluationException(ErrorMessages.typeExpectedGot("number", typeName(a instanceof Boolean || a == null ? a : b)));
  }

  /**
   * 标量比较，operator 取值 {@code < <= > >= == !=}。
   */
  public static boolean compare(String operator, Object a, Object b) {
    double x = asDouble(a);
    double y = asDouble(b);
    switch (operator) {
      case "<": return x < y;
      case "<=": return x <= y;
      case ">": return x > y;
      case ">=": return x >= y;
      case "==": return x == y;
      case "!=": return x != y;
      default:
        throw new EvaluationException(ErrorMessages.typeExpectedGot("comparison operator", operator));
    }
  }

  public static double asDouble(Object o) {
    if (o instanceof Double d) return d;
    if (o instanceof Number n) return n.doubleValue();
    throw new EvaluationException(ErrorMessages.typeExpectedGot("scalar", typeName(o)));
  }

  public static boolean toBool(Object o) {
    if (o instanceof Boolean b) return b;
    if (o instanceof Number n) return n.doubleValue() != 0.0;
    throw new EvaluationException(ErrorMessages.typeExpectedGot("boolean", typeName(o)));
  }

  /**
   * 数值统一为 Double，数组保持原样。
   */
  public static Object normalize(Object o) {
    if (o instanceof Number n && !(o instanceof Double)) return n.doubleValue();
    return o;
  }

  public static Object copy(Object o) {
    return o instanceof double[] arr ? arr.clone() : o;
  }

  public static String typeName(Object o) {
    if (o == null) return "null";
    if (o instanceof double[] arr) return "vector[" + arr.length + "]";
    return o.getClass().getSimpleName();
  }
}
