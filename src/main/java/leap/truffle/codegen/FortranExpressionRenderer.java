package leap.truffle.codegen;

import leap.truffle.core.IrModel;
import leap.truffle.core.ProgramValidationException;
import leap.truffle.runtime.ErrorMessages;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * IR 表达式到 Fortran 表达式文本。复合表达式总是加括号。
 */
final class FortranExpressionRenderer {
  private static final Map<String, String> COMPARISONS = Map.of(
      "<", ".lt.", "<=", ".le.", ">", ".gt.", ">=", ".ge.", "==", ".eq.", "!=", ".ne.");

  private final FortranNameManager names;

  FortranExpressionRenderer(FortranNameManager names) {
    this.names = names;
  }

  String render(IrModel.Expr expr) {
    if (expr instanceof IrModel.Constant c) {
      return literal(c.value);
    } else if (expr instanceof IrModel.BoolConstant b) {
      return b.value ? ".true." : ".false.";
    } else if (expr instanceof IrModel.Variable v) {
      return names.get(v.name);
    } else if (expr instanceof IrModel.Sum s) {
      return join(s.children, " + ");
    } else if (expr instanceof IrModel.Product p) {
      return join(p.children, "*");
    } else if (expr instanceof IrModel.Quotient q) {
      return "(" + render(q.numerator) + " / " + render(q.denominator) + ")";
    } else if (expr instanceof IrModel.Power p) {
      return "(" + render(p.base) + "**" + render(p.exponent) + ")";
    } else if (expr instanceof IrModel.Comparison c) {
      String op = COMPARISONS.get(c.operator);
      if (op == null) {
        throw new ProgramValidationException(ErrorMessages.bilingual(
            "未知比较运算符：" + c.operator, "unknown comparison operator: " + c.operator));
      }
      return "(" + render(c.left) + " " + op + " " + render(c.right) + ")";
    } else if (expr instanceof IrModel.LogicalAnd a) {
      return join(a.children, " .and. ");
    } else if (expr instanceof IrModel.LogicalOr o) {
      return join(o.children, " .or. ");
    } else if (expr instanceof IrModel.LogicalNot n) {
      return "(.not." + render(n.child) + ")";
    } else if (expr instanceof IrModel.Call call) {
      throw new ProgramValidationException(ErrorMessages.withHint(
          ErrorMessages.bilingual("Fortran 后端只支持作为赋值右侧整体的函数调用：" + call.function,
              "function calls must form the whole right-hand side of an assignment: " + call.function),
          "先把调用结果赋给临时变量", "assign the call result to a temporary first"));
    }
    throw new IllegalArgumentException("Unsupported expression: " + expr);
  }

  private String join(List<IrModel.Expr> children, String separator) {
    StringJoiner sj = new StringJoiner(separator, "(", ")");
    for (IrModel.Expr child : children) {
      sj.add(render(child));
    }
    return sj.toString();
  }

  static String literal(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new ProgramValidationException(ErrorMessages.bilingual(
          "常量无法写成 Fortran 字面量：" + value, "constant has no Fortran literal: " + value));
    }
    String text;
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      text = (long) Math.abs(value) + ".0d0";
    } else {
      String s = Double.toString(Math.abs(value));
      text = s.contains("E") ? s.replace("E", "d") : s + "d0";
    }
    return value < 0 ? "(-" + text + ")" : text;
  }
}
