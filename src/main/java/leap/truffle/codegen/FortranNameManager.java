package leap.truffle.codegen;

import leap.truffle.core.Variables;
import java.util.*;

/**
 * IR 变量名到 Fortran 标识符的映射。
 *
 * 全局名、局部名与临时名共用一个唯一名生成器；Fortran 不区分大小写，唯一性按小写比较。
 */
public final class FortranNameManager {
  private final Set<String> usedNames = new HashSet<>();
  private final Map<String, String> globalMap = new LinkedHashMap<>();
  private final Map<String, String> localMap = new LinkedHashMap<>();

  public FortranNameManager() {
    globalMap.put(Variables.TIME, "leap_t");
    globalMap.put(Variables.DT, "leap_dt");
    usedNames.add("leap_t");
    usedNames.add("leap_dt");
  }

  public String nameGlobal(String var) {
    return globalMap.computeIfAbsent(var, this::makeUniqueName);
  }

  public String nameLocal(String var) {
    return localMap.computeIfAbsent(var, this::makeUniqueName);
  }

  /**
   * 生成一个未占用、且不与任何 IR 名关联的标识符。
   */
  public String makeUniqueName(String prefix) {
    String base = sanitize(prefix);
    String candidate = base;
    int counter = 0;
    while (!usedNames.add(candidate.toLowerCase(Locale.ROOT))) {
      candidate = base + "_" + counter++;
    }
    return candidate;
  }

  /**
   * 表达式中引用变量时使用的名字：全局变量通过 leap_state 访问。
   */
  public String get(String name) {
    if (Variables.isStateVariable(name)) {
      return "leap_state%" + nameGlobal(name);
    }
    return nameLocal(name);
  }

  public String nameRefcount(String name) {
    if (Variables.isStateVariable(name)) {
      return "leap_state%leap_refcnt_" + nameGlobal(name);
    }
    return "leap_refcnt_" + nameLocal(name);
  }

  static String sanitize(String name) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
        sb.append(c);
      } else if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') {
        sb.append('_');
      }
    }
    while (sb.length() > 0 && sb.charAt(sb.length() - 1) == '_') {
      sb.setLength(sb.length() - 1);
    }
    if (sb.length() == 0 || !Character.isLetter(sb.charAt(0))) {
      sb.insert(0, "leap_");
    }
    return sb.toString();
  }
}
