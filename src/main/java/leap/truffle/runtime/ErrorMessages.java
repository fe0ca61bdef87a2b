package leap.truffle.runtime;

import java.util.Collection;
import java.util.TreeSet;

/**
 * 错误消息统一生成工具。
 *
 * <p>所有错误消息均提供中英文双语描述并附带恢复提示，英文部分保留稳定的关键字，便于测试断言。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息，保持英文关键字用于断言。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  public static String duplicateInstruction(String id) {
    String message = bilingual("指令 id 重复：" + id, "duplicate instruction id: " + id);
    return withHint(message, "为每条指令分配唯一 id", "Give every instruction a unique id");
  }

  public static String unknownInstruction(String id, String referencedBy) {
    String english = "unknown instruction id '" + id + "' referenced by " + referencedBy;
    String message = bilingual("引用了不存在的指令 '" + id + "'（来自 " + referencedBy + "）", english);
    return withHint(message, "确认依赖集合中的 id 均已定义", "Check that every dependency id is defined");
  }

  public static String circularDependency(String id) {
    String english = "Circular dependency detected for instruction: " + id;
    String message = bilingual("检测到循环依赖：" + id, english);
    return withHint(message, "依赖图在每个状态内必须无环", "The dependency graph must be acyclic");
  }

  public static String unknownState(String name, String referencedBy) {
    String english = "unknown state '" + name + "' referenced by " + referencedBy;
    String message = bilingual("引用了不存在的状态 '" + name + "'（来自 " + referencedBy + "）", english);
    return withHint(message, "在状态表中声明该状态", "Declare the state in the state table");
  }

  public static String reservedStateKey(String key) {
    String english = "state variables may not start with '<': " + key;
    String message = bilingual("状态变量名不能以 '<' 开头：" + key, english);
    return withHint(message, "传入不带命名空间前缀的分量名", "Pass component names without a namespace prefix");
  }

  public static String undeclaredComponents(Collection<String> componentIds) {
    String ids = new TreeSet<>(componentIds).toString();
    String english = "ODE components with undeclared types: " + ids;
    String message = bilingual("ODE 分量缺少类型声明：" + ids, english);
    return withHint(message, "在分量类型表中为其声明数值布局", "Declare a numeric layout for each component");
  }

  public static String unknownSymbolKind(String name, String function) {
    String english = "could not determine kind of '" + name + "' in " + function;
    String message = bilingual("无法推断变量 '" + name + "' 的种类（函数 " + function + "）", english);
    return withHint(message, "确保变量在读取前被赋值或通过 initialize 提供", "Assign the variable or supply it to initialize");
  }

  public static String conflictingSymbolKind(String name, Object first, Object second) {
    String english = "conflicting kinds for '" + name + "': " + first + " vs " + second;
    String message = bilingual("变量 '" + name + "' 的种类冲突：" + first + " / " + second, english);
    return withHint(message, "同一变量只能保存一种类型的值", "A variable may only hold one kind of value");
  }

  public static String variableNotInitialized(String name) {
    String english = "Variable not initialized: " + name;
    String message = bilingual("变量未初始化：" + name, english);
    return withHint(message, "确保在首次读取前进行赋值", "Assign the variable before first read");
  }

  public static String typeExpectedGot(String expected, String actual) {
    String english = "Expected " + expected + ", got " + actual;
    String message = bilingual("类型不匹配：期望 " + expected + "，实际 " + actual, english);
    return withHint(message, "检查数据来源或转换逻辑，确保类型一致", "Review data source or conversion to ensure types match");
  }

  public static String vectorLengthMismatch(int left, int right) {
    String english = "vector length mismatch: " + left + " vs " + right;
    String message = bilingual("向量长度不一致：" + left + " / " + right, english);
    return withHint(message, "参与运算的 ODE 分量必须具有相同布局", "Operands must share one component layout");
  }

  public static String unknownFunction(String id) {
    String english = "unknown function: " + id;
    String message = bilingual("未注册的函数：" + id, english);
    return withHint(message, "通过函数注册表注册该函数", "Register the function with the function registry");
  }

  public static String functionAlreadyRegistered(String id) {
    String english = "function '" + id + "' already registered";
    String message = bilingual("函数 '" + id + "' 已注册", english);
    return withHint(message, "使用不同的标识符或先移除旧定义", "Use another identifier");
  }

  public static String functionNotCallable(String id) {
    String english = "function '" + id + "' has no implementation";
    String message = bilingual("函数 '" + id + "' 没有可调用实现", english);
    return withHint(message, "在解释执行前为其提供实现", "Supply an implementation before interpreting");
  }

  public static String missingArgument(String function, String argument) {
    String english = function + ": missing argument '" + argument + "'";
    String message = bilingual("函数 " + function + " 缺少参数 '" + argument + "'", english);
    return withHint(message, "按位置或关键字提供所有参数", "Pass every argument by position or keyword");
  }

  public static String missingCallCode(String function, String language) {
    String english = "function '" + function + "' has no " + language + " call code";
    String message = bilingual("函数 '" + function + "' 缺少 " + language + " 调用代码", english);
    return withHint(message, "在注册表中为目标语言提供调用模板", "Register a call-code template for the target language");
  }

  public static String undefinedTemplateName(String name) {
    String english = "undefined name in call code template: " + name;
    return bilingual("调用模板中存在未定义的名称：" + name, english);
  }

  public static String unknownSolver(String id) {
    String english = "unknown solver: " + id;
    String message = bilingual("未注册的求解器：" + id, english);
    return withHint(message, "向解释器提供该 solver_id 对应的求解器", "Supply a solver for this solver id");
  }

  public static String unsatisfiedDependency(String id, String dependency) {
    String english = "instruction '" + id + "' dispatched before dependency '" + dependency + "'";
    return bilingual("指令 '" + id + "' 在依赖 '" + dependency + "' 之前被派发", english);
  }

  public static String stalledPlan(Collection<String> pending) {
    String english = "execution plan stalled with pending instructions " + pending;
    return bilingual("执行计划停滞，仍有未完成指令 " + pending, english);
  }
}
