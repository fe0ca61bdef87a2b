package leap.truffle.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * 带缩进层级的 Fortran 行缓冲。
 */
final class FortranEmitter {
  static final String INDENT = "    ";

  private final List<String> lines = new ArrayList<>();
  private int level;

  void emit(String line) {
    if (line.isEmpty()) {
      lines.add("");
    } else {
      lines.add(INDENT.repeat(level) + line);
    }
  }

  void indent() {
    level++;
  }

  void dedent() {
    if (level == 0) {
      throw new IllegalStateException("unbalanced dedent");
    }
    level--;
  }

  /**
   * 把另一个缓冲的内容按当前层级并入。
   */
  void incorporate(FortranEmitter other) {
    for (String line : other.lines) {
      lines.add(line.isEmpty() ? "" : INDENT.repeat(level) + line);
    }
  }

  List<String> getLines() {
    return lines;
  }

  /**
   * 自由格式续行：在字符串常量之外的空格处断开，行尾补齐到 width-1 后加 {@code &}。
   */
  static List<String> wrap(List<String> lines, int width) {
    List<String> out = new ArrayList<>();
    for (String line : lines) {
      String indent = line.substring(0, line.length() - line.stripLeading().length());
      String rest = line.substring(indent.length());
      String prefix = indent;
      while (prefix.length() + rest.length() > width) {
        int cut = breakPoint(rest, width - 2 - prefix.length());
        if (cut <= 0) {
          break;
        }
        StringBuilder head = new StringBuilder(prefix).append(rest, 0, cut);
        while (head.length() < width - 1) {
          head.append(' ');
        }
        out.add(head.append('&').toString());
        rest = rest.substring(cut).stripLeading();
        prefix = indent + INDENT;
      }
      out.add(prefix + rest);
    }
    return out;
  }

  private static int breakPoint(String text, int limit) {
    int best = -1;
    boolean inString = false;
    for (int i = 0; i < text.length() && i <= limit; i++) {
      char c = text.charAt(i);
      if (c == '\'') {
        inString = !inString;
      } else if (c == ' ' && !inString) {
        best = i;
      }
    }
    return best;
  }
}
