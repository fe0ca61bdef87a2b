package leap.truffle.core;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 指令与表达式的读写变量分析。
 */
public final class Instructions {
  private Instructions() {}

  /**
   * 表达式读取的全部变量（不含函数标识符）。
   */
  public static Set<String> readVariables(IrModel.Expr expr) {
    Set<String> result = new LinkedHashSet<>();
    collect(expr, result);
    return result;
  }

  private static void collect(IrModel.Expr expr, Set<String> out) {
    if (expr == null) return;
    if (expr instanceof IrModel.Variable v) {
      out.add(v.name);
    } else if (expr instanceof IrModel.Sum s) {
      for (IrModel.Expr c : s.children) collect(c, out);
    } else if (expr instanceof IrModel.Product p) {
      for (IrModel.Expr c : p.children) collect(c, out);
    } else if (expr instanceof IrModel.Quotient q) {
      collect(q.numerator, out);
      collect(q.denominator, out);
    } else if (expr instanceof IrModel.Power p) {
      collect(p.base, out);
      collect(p.exponent, out);
    } else if (expr instanceof IrModel.Comparison c) {
      collect(c.left, out);
      collect(c.right, out);
    } else if (expr instanceof IrModel.LogicalAnd a) {
      for (IrModel.Expr c : a.children) collect(c, out);
    } else if (expr instanceof IrModel.LogicalOr o) {
      for (IrModel.Expr c : o.children) collect(c, out);
    } else if (expr instanceof IrModel.LogicalNot n) {
      collect(n.child, out);
    } else if (expr instanceof IrModel.Call call) {
      for (IrModel.Expr c : call.parameters) collect(c, out);
      for (IrModel.Expr c : call.kwParameters.values()) collect(c, out);
    }
  }

  /**
   * 表达式中调用的函数标识符。
   */
  public static Set<String> calledFunctions(IrModel.Expr expr) {
    Set<String> result = new LinkedHashSet<>();
    collectCalls(expr, result);
    return result;
  }

  private static void collectCalls(IrModel.Expr expr, Set<String> out) {
    if (expr instanceof IrModel.Call call) {
      out.add(call.function);
      for (IrModel.Expr c : call.parameters) collectCalls(c, out);
      for (IrModel.Expr c : call.kwParameters.values()) collectCalls(c, out);
    } else if (expr instanceof IrModel.Sum s) {
      for (IrModel.Expr c : s.children) collectCalls(c, out);
    } else if (expr instanceof IrModel.Product p) {
      for (IrModel.Expr c : p.children) collectCalls(c, out);
    } else if (expr instanceof IrModel.Quotient q) {
      collectCalls(q.numerator, out);
      collectCalls(q.denominator, out);
    } else if (expr instanceof IrModel.Power p) {
      collectCalls(p.base, out);
      collectCalls(p.exponent, out);
    } else if (expr instanceof IrModel.Comparison c) {
      collectCalls(c.left, out);
      collectCalls(c.right, out);
    } else if (expr instanceof IrModel.LogicalAnd a) {
      for (IrModel.Expr c : a.children) collectCalls(c, out);
    } else if (expr instanceof IrModel.LogicalOr o) {
      for (IrModel.Expr c : o.children) collectCalls(c, out);
    } else if (expr instanceof IrModel.LogicalNot n) {
      collectCalls(n.child, out);
    }
  }

  /**
   * 指令读取的变量集合。
   */
  public static Set<String> readVariables(IrModel.Instruction insn) {
    Set<String> result = new LinkedHashSet<>();
    if (insn instanceof IrModel.AssignExpression a) {
      collect(a.expression, result);
    } else if (insn instanceof IrModel.AssignSolved s) {
      collect(s.expression, result);
      collect(s.guess, result);
      // 待求解的未知量由求解器提供，不视为读取
      result.remove(s.solveComponent);
    } else if (insn instanceof IrModel.If i) {
      collect(i.condition, result);
    } else if (insn instanceof IrModel.YieldState y) {
      collect(y.expression, result);
      collect(y.time, result);
    }
    return result;
  }

  /**
   * 指令赋值的变量集合。
   */
  public static Set<String> assignees(IrModel.Instruction insn) {
    if (insn instanceof IrModel.AssignExpression a) return Set.of(a.assignee);
    if (insn instanceof IrModel.AssignSolved s) return Set.of(s.assignee);
    return Set.of();
  }
}
