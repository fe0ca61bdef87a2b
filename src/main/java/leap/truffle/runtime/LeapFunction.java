package leap.truffle.runtime;

import leap.truffle.core.SymbolKind;
import java.util.*;

/**
 * 外部函数描述：参数名、结果种类规则、解释器实现和各目标语言的调用代码。
 */
public final class LeapFunction {

  /** 解释器路径上的可调用实现，参数已按 argNames 顺序排列。 */
  @FunctionalInterface
  public interface Implementation {
    Object call(Object[] args);
  }

  /**
   * 由参数种类推断结果种类。参数种类尚未确定时对应位置为 null，规则可返回 null 表示暂时无法确定。
   */
  @FunctionalInterface
  public interface ResultKindRule {
    SymbolKind resultKind(List<SymbolKind> argKinds);
  }

  private final String identifier;
  private final List<String> argNames;
  private final ResultKindRule resultKindRule;
  private Implementation implementation;
  private final Map<String, CallCode> callCodes = new LinkedHashMap<>();

  public LeapFunction(String identifier, List<String> argNames, ResultKindRule resultKindRule,
      Implementation implementation) {
    this.identifier = Objects.requireNonNull(identifier, "identifier");
    this.argNames = List.copyOf(argNames);
    this.resultKindRule = Objects.requireNonNull(resultKindRule, "resultKindRule");
    this.implementation = implementation;
  }

  public String getIdentifier() {
    return identifier;
  }

  public List<String> getArgNames() {
    return argNames;
  }

  public SymbolKind resultKind(List<SymbolKind> argKinds) {
    return resultKindRule.resultKind(argKinds);
  }

  public LeapFunction withCallCode(String language, String template) {
    callCodes.put(language, new CallCode(template));
    return this;
  }

  public CallCode getCallCode(String language) {
    CallCode code = callCodes.get(language);
    if (code == null) {
      throw new FunctionException(ErrorMessages.missingCallCode(identifier, language));
    }
    return code;
  }

  public boolean hasImplementation() {
    return implementation != null;
  }

  void setImplementation(Implementation implementation) {
    this.implementation = implementation;
  }

  public Object call(Object[] args) {
    if (implementation == null) {
      throw new FunctionException(ErrorMessages.functionNotCallable(identifier));
    }
    return Values.normalize(implementation.call(args));
  }

  /**
   * 把位置参数与关键字参数整理为 argNames 顺序。
   */
  public <T> List<T> resolveArgs(List<T> positional, Map<String, T> keyword) {
    if (positional.size() > argNames.size()) {
      throw new FunctionException(ErrorMessages.bilingual(
          "函数 " + identifier + " 参数过多",
          identifier + ": expected at most " + argNames.size() + " arguments, got " + positional.size()));
    }
    List<T> result = new ArrayList<>(Collections.nCopies(argNames.size(), (T) null));
    for (int i = 0; i < positional.size(); i++) {
      result.set(i, positional.get(i));
    }
    for (Map.Entry<String, T> e : keyword.entrySet()) {
      int idx = argNames.indexOf(e.getKey());
      if (idx < 0) {
        throw new FunctionException(ErrorMessages.bilingual(
            "函数 " + identifier + " 没有参数 '" + e.getKey() + "'",
            identifier + ": unknown keyword argument '" + e.getKey() + "'"));
      }
      result.set(idx, e.getValue());
    }
    for (int i = 0; i < result.size(); i++) {
      if (result.get(i) == null) {
        throw new FunctionException(ErrorMessages.missingArgument(identifier, argNames.get(i)));
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return identifier + argNames;
  }
}
