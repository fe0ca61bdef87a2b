package leap.truffle.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 目标语言调用代码模板。
 *
 * 模板使用 {@code ${name}} 占位符，可用名称为 {@code result} 以及函数的参数名。
 * 渲染是严格的：出现未定义的名称即报错。渲染结果去除公共缩进并合并多余空行。
 */
public final class CallCode {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

  private final String template;

  public CallCode(String template) {
    this.template = template;
  }

  public String getTemplate() {
    return template;
  }

  /**
   * 渲染模板。
   *
   * @param bindings 名称到目标语言表达式文本的映射
   * @return 渲染后的代码行
   * @throws FunctionException 模板引用了未绑定的名称
   */
  public List<String> render(Map<String, String> bindings) {
    Matcher m = PLACEHOLDER.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String name = m.group(1);
      String value = bindings.get(name);
      if (value == null) {
        throw new FunctionException(ErrorMessages.undefinedTemplateName(name));
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(value));
    }
    m.appendTail(sb);
    return removeRedundantBlankLines(removeCommonIndentation(List.of(sb.toString().split("\n", -1))));
  }

  public static List<String> removeCommonIndentation(List<String> lines) {
    int common = Integer.MAX_VALUE;
    for (String line : lines) {
      if (line.isBlank()) continue;
      int indent = 0;
      while (indent < line.length() && line.charAt(indent) == ' ') indent++;
      common = Math.min(common, indent);
    }
    List<String> out = new ArrayList<>(lines.size());
    for (String line : lines) {
      out.add(line.isBlank() ? "" : line.substring(common).stripTrailing());
    }
    return out;
  }

  public static List<String> removeRedundantBlankLines(List<String> lines) {
    List<String> out = new ArrayList<>();
    boolean previousBlank = true;
    for (String line : lines) {
      boolean blank = line.isBlank();
      if (blank && previousBlank) continue;
      out.add(line);
      previousBlank = blank;
    }
    while (!out.isEmpty() && out.get(out.size() - 1).isBlank()) {
      out.remove(out.size() - 1);
    }
    return out;
  }
}
