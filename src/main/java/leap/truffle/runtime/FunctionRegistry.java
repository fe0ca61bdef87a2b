package leap.truffle.runtime;

import leap.truffle.core.SymbolKind;
import leap.truffle.core.Variables;
import java.util.*;

/**
 * 函数注册表：函数标识符到 {@link LeapFunction} 的映射。
 *
 * 解释器按标识符查找可调用实现，代码生成器查找结果种类规则与调用代码。
 */
public final class FunctionRegistry {
  private final Map<String, LeapFunction> functions = new LinkedHashMap<>();

  public FunctionRegistry() {}

  /**
   * 预先登记内置函数的注册表。
   */
  public static FunctionRegistry withBuiltins() {
    FunctionRegistry registry = new FunctionRegistry();
    Builtins.registerAll(registry);
    return registry;
  }

  public FunctionRegistry register(LeapFunction function) {
    if (functions.containsKey(function.getIdentifier())) {
      throw new FunctionException(ErrorMessages.functionAlreadyRegistered(function.getIdentifier()));
    }
    functions.put(function.getIdentifier(), function);
    return this;
  }

  /**
   * 登记 ODE 右端函数 {@code <func>componentId}，参数为 {@code t} 与各输入分量，
   * 结果种类为 ODEComponent(componentId)。
   *
   * @param componentId 输出分量
   * @param inputComponentIds 输入分量名，同时作为关键字参数名
   * @param implementation 解释器实现，可为 null（仅用于代码生成）
   */
  public LeapFunction registerOdeRhs(String componentId, List<String> inputComponentIds,
      LeapFunction.Implementation implementation) {
    List<String> argNames = new ArrayList<>();
    argNames.add("t");
    argNames.addAll(inputComponentIds);
    SymbolKind result = SymbolKind.odeComponent(componentId);
    LeapFunction fn = new LeapFunction(Variables.FUNC_PREFIX + componentId, argNames, kinds -> result, implementation);
    register(fn);
    return fn;
  }

  /**
   * 为已登记的函数提供解释器实现。
   */
  public FunctionRegistry registerImplementation(String identifier, LeapFunction.Implementation implementation) {
    LeapFunction fn = get(identifier);
    if (fn.hasImplementation()) {
      throw new FunctionException(ErrorMessages.functionAlreadyRegistered(identifier));
    }
    fn.setImplementation(implementation);
    return this;
  }

  public LeapFunction get(String identifier) {
    LeapFunction fn = functions.get(identifier);
    if (fn == null) {
      throw new FunctionException(ErrorMessages.unknownFunction(identifier));
    }
    return fn;
  }

  public boolean contains(String identifier) {
    return functions.containsKey(identifier);
  }

  public Set<String> getIdentifiers() {
    return Collections.unmodifiableSet(functions.keySet());
  }
}
