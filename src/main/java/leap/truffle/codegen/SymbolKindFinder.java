package leap.truffle.codegen;

import leap.truffle.core.IrModel;
import leap.truffle.core.Instructions;
import leap.truffle.core.SymbolKind;
import leap.truffle.core.Variables;
import leap.truffle.runtime.FunctionRegistry;
import leap.truffle.runtime.LeapFunction;
import java.util.*;

/**
 * 符号种类推断：对所有函数的指令做不动点迭代，直到表不再变化。
 *
 * 结束后每个被赋值或读取的变量都必须有确定的种类。
 */
public final class SymbolKindFinder {
  private final FunctionRegistry functions;

  public SymbolKindFinder(FunctionRegistry functions) {
    this.functions = functions;
  }

  /**
   * @param instructionsByFunction 函数名到其控制流图中全部指令的映射
   */
  public SymbolKindTable find(Map<String, List<IrModel.Instruction>> instructionsByFunction) {
    SymbolKindTable table = new SymbolKindTable();
    table.set(null, Variables.TIME, SymbolKind.REAL);
    table.set(null, Variables.DT, SymbolKind.REAL);

    for (List<IrModel.Instruction> insns : instructionsByFunction.values()) {
      for (IrModel.Instruction insn : insns) {
        for (String name : Instructions.readVariables(insn)) {
          String component = Variables.stateComponentId(name);
          if (component != null) {
            table.set(null, name, SymbolKind.odeComponent(component));
          }
        }
        for (String name : Instructions.assignees(insn)) {
          String component = Variables.stateComponentId(name);
          if (component != null) {
            table.set(null, name, SymbolKind.odeComponent(component));
          }
        }
      }
    }

    boolean changed = true;
    while (changed) {
      changed = false;
      for (Map.Entry<String, List<IrModel.Instruction>> e : instructionsByFunction.entrySet()) {
        String function = e.getKey();
        for (IrModel.Instruction insn : e.getValue()) {
          if (insn instanceof IrModel.AssignExpression a) {
            SymbolKind kind = kindOf(table, function, a.expression, a.assignee);
            if (kind != null) changed |= table.set(function, a.assignee, kind);
          } else if (insn instanceof IrModel.AssignSolved s) {
            SymbolKind kind = kindOf(table, function, s.guess, s.assignee);
            if (kind != null) {
              changed |= table.set(function, s.assignee, kind);
              if (table.lookup(function, s.solveComponent) == null) {
                changed |= table.set(function, s.solveComponent, kind);
              }
            }
          }
        }
      }
    }

    // 每个变量都必须有确定种类
    for (Map.Entry<String, List<IrModel.Instruction>> e : instructionsByFunction.entrySet()) {
      for (IrModel.Instruction insn : e.getValue()) {
        for (String name : Instructions.readVariables(insn)) {
          table.get(e.getKey(), name);
        }
        for (String name : Instructions.assignees(insn)) {
          table.get(e.getKey(), name);
        }
      }
    }
    return table;
  }

  /**
   * @param assignee 正在被赋值的变量；其自身尚无种类时在算术中不参与判定（如 {@code n = n + 1}）
   */
  private SymbolKind kindOf(SymbolKindTable table, String function, IrModel.Expr expr, String assignee) {
    if (expr instanceof IrModel.Constant) {
      return SymbolKind.REAL;
    } else if (expr instanceof IrModel.BoolConstant
        || expr instanceof IrModel.Comparison
        || expr instanceof IrModel.LogicalAnd
        || expr instanceof IrModel.LogicalOr
        || expr instanceof IrModel.LogicalNot) {
      return SymbolKind.BOOLEAN;
    } else if (expr instanceof IrModel.Variable v) {
      return table.lookup(function, v.name);
    } else if (expr instanceof IrModel.Sum s) {
      return combine(table, function, s.children, assignee);
    } else if (expr instanceof IrModel.Product p) {
      return combine(table, function, p.children, assignee);
    } else if (expr instanceof IrModel.Quotient q) {
      return combine(table, function, List.of(q.numerator, q.denominator), assignee);
    } else if (expr instanceof IrModel.Power p) {
      return combine(table, function, List.of(p.base, p.exponent), assignee);
    } else if (expr instanceof IrModel.Call call) {
      LeapFunction fn = functions.get(call.function);
      List<IrModel.Expr> args = fn.resolveArgs(call.parameters, call.kwParameters);
      List<SymbolKind> argKinds = new ArrayList<>();
      for (IrModel.Expr arg : args) {
        argKinds.add(kindOf(table, function, arg, assignee));
      }
      return fn.resultKind(argKinds);
    }
    return null;
  }

  /**
   * 算术结果：任一操作数为 ODE 分量则为该分量；否则全部已知时为标量（任一复数即复数）。
   */
  private SymbolKind combine(SymbolKindTable table, String function, List<IrModel.Expr> operands,
      String assignee) {
    SymbolKind component = null;
    boolean complex = false;
    boolean unknown = false;
    boolean known = false;
    for (IrModel.Expr operand : operands) {
      SymbolKind kind = kindOf(table, function, operand, assignee);
      if (kind == null && operand instanceof IrModel.Variable v && v.name.equals(assignee)) {
        continue;
      }
      known |= kind != null;
      if (kind == null) {
        unknown = true;
      } else if (kind instanceof SymbolKind.OdeComponent) {
        component = kind;
      } else if (kind.equals(SymbolKind.COMPLEX)) {
        complex = true;
      }
    }
    if (component != null) return component;
    if (unknown || !known) return null;
    return complex ? SymbolKind.COMPLEX : SymbolKind.REAL;
  }
}
