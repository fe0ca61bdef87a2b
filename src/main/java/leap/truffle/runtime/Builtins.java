package leap.truffle.runtime;

import leap.truffle.core.SymbolKind;
import leap.truffle.core.Variables;
import java.util.List;

/**
 * 内置函数 - 解释器实现与 Fortran 调用代码
 *
 * - {@code <builtin>len}：分量元素个数
 * - {@code <builtin>isnan}：是否含 NaN
 * - {@code <builtin>norm}：2-范数
 * - {@code <builtin>dot_product}：内积
 */
public final class Builtins {
  private Builtins() {}

  public static final String LEN = Variables.BUILTIN_PREFIX + "len";
  public static final String ISNAN = Variables.BUILTIN_PREFIX + "isnan";
  public static final String NORM = Variables.BUILTIN_PREFIX + "norm";
  public static final String DOT_PRODUCT = Variables.BUILTIN_PREFIX + "dot_product";

  /**
   * 向注册表登记全部内置函数；与已有条目重名时报错。
   */
  public static void registerAll(FunctionRegistry registry) {
    // === 结构查询 ===
    registry.register(new LeapFunction(LEN, List.of("x"), kinds -> SymbolKind.REAL, args -> {
      checkArity(LEN, args, 1);
      return args[0] instanceof double[] arr ? (double) arr.length : 1.0;
    }).withCallCode("fortran", "${result} = size(${x})"));

    register(registry, ISNAN, List.of("x"), SymbolKind.BOOLEAN, args -> {
      checkArity(ISNAN, args, 1);
      if (args[0] instanceof double[] arr) {
        for (double v : arr) {
          if (Double.isNaN(v)) return true;
        }
        return false;
      }
      return Double.isNaN(Values.asDouble(args[0]));
    }, "${result} = any(isnan(${x}))");

    // === 归约 ===
    register(registry, NORM, List.of("x"), SymbolKind.REAL, args -> {
      checkArity(NORM, args, 1);
      if (args[0] instanceof double[] arr) {
        double sum = 0;
        for (double v : arr) sum += v * v;
        return Math.sqrt(sum);
      }
      return Math.abs(Values.asDouble(args[0]));
    }, "${result} = sqrt(sum(abs(${x})**2))");

    register(registry, DOT_PRODUCT, List.of("x", "y"), SymbolKind.REAL, args -> {
      checkArity(DOT_PRODUCT, args, 2);
      Object product = Values.multiply(args[0], args[1]);
      if (product instanceof double[] arr) {
        double sum = 0;
        for (double v : arr) sum += v;
        return sum;
      }
      return product;
    }, "${result} = dot_product(${x}, ${y})");
  }

  public static boolean isBuiltin(String identifier) {
    return identifier.startsWith(Variables.BUILTIN_PREFIX);
  }

  private static void register(FunctionRegistry registry, String id, List<String> argNames,
      SymbolKind resultKind, LeapFunction.Implementation impl, String fortranCallCode) {
    registry.register(new LeapFunction(id, argNames, kinds -> resultKind, impl)
        .withCallCode("fortran", fortranCallCode));
  }

  private static void checkArity(String name, Object[] args, int expected) {
    if (args.length != expected) {
      throw new FunctionException(
          ErrorMessages.typeExpectedGot(name + " with " + expected + " args", args.length + " args"));
    }
  }
}
