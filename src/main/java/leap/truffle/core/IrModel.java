package leap.truffle.core;

import com.fasterxml.jackson.annotation.*;
import leap.truffle.runtime.ExecutionResult;
import leap.truffle.runtime.InstructionExecutor;
import java.util.*;

/**
 * 时间积分器的依赖图中间表示（IR）。
 *
 * <p>指令与表达式都是 Jackson 可直接反序列化的 POJO，通过 {@code kind} 字段区分变体。
 * 方法作者（RK、AB 等）既可以从 JSON 加载，也可以用本类的工厂方法直接构造。</p>
 */
public final class IrModel {
  private IrModel() {}

  /** 程序的 JSON 形态：指令列表 + 状态表 + 初始状态。 */
  public static final class Module {
    public List<Instruction> instructions = new ArrayList<>();
    public Map<String, State> states = new LinkedHashMap<>();
    public String initialState;
  }

  /** 程序状态：完成本状态所需的指令集合，以及默认后继状态。 */
  public static final class State {
    public Set<String> dependsOn = new LinkedHashSet<>();
    public String nextState;

    public State() {}

    public State(Set<String> dependsOn, String nextState) {
      this.dependsOn = new LinkedHashSet<>(dependsOn);
      this.nextState = nextState;
    }
  }

  // ---------------------------------------------------------------------------
  // 指令
  // ---------------------------------------------------------------------------

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = AssignExpression.class, name = "AssignExpression"),
    @JsonSubTypes.Type(value = AssignSolved.class, name = "AssignSolved"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = YieldState.class, name = "YieldState"),
    @JsonSubTypes.Type(value = FailStep.class, name = "FailStep"),
    @JsonSubTypes.Type(value = Raise.class, name = "Raise"),
    @JsonSubTypes.Type(value = StateTransition.class, name = "StateTransition"),
    @JsonSubTypes.Type(value = Nop.class, name = "Nop")
  })
  public abstract static sealed class Instruction
      permits AssignExpression, AssignSolved, If, YieldState, FailStep, Raise, StateTransition, Nop {
    public String id;
    // 无序的前置条件集合，只约束正确性，不暗示执行顺序
    public Set<String> dependsOn = new LinkedHashSet<>();

    /**
     * 按变体分派给执行器（对应 exec_&lt;Kind&gt; 约定）。
     */
    public abstract <E> ExecutionResult<E> execute(InstructionExecutor<E> executor);

    Instruction init(String id, Collection<String> deps) {
      this.id = id;
      this.dependsOn = new LinkedHashSet<>(deps);
      return this;
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + "[" + id + "] " + describe() + " <- " + dependsOn;
    }

    abstract String describe();
  }

  @JsonTypeName("AssignExpression")
  public static final class AssignExpression extends Instruction {
    public String assignee;
    public Expr expression;

    public AssignExpression() {}

    public AssignExpression(String id, String assignee, Expr expression, Collection<String> dependsOn) {
      init(id, dependsOn);
      this.assignee = assignee;
      this.expression = expression;
    }

    @Override
    public <E> ExecutionResult<E> execute(InstructionExecutor<E> executor) {
      return executor.execAssignExpression(this);
    }

    @Override String describe() { return assignee + " <- " + expression; }
  }

  @JsonTypeName("AssignSolved")
  public static final class AssignSolved extends Instruction {
    public String assignee;
    public Expr expression;
    public String solveComponent;
    public String solverId;
    public Expr guess;

    public AssignSolved() {}

    public AssignSolved(String id, String assignee, Expr expression, String solveComponent,
        String solverId, Expr guess, Collection<String> dependsOn) {
      init(id, dependsOn);
      this.assignee = assignee;
      this.expression = expression;
      this.solveComponent = solveComponent;
      this.solverId = solverId;
      this.guess = guess;
    }

    @Override
    public <E> ExecutionResult<E> execute(InstructionExecutor<E> executor) {
      return executor.execAssignSolved(this);
    }

    @Override String describe() {
      return assignee + " <- solve(" + expression + " = 0, " + solveComponent + ", guess=" + guess + ") via " + solverId;
    }
  }

  @JsonTypeName("If")
  public static final class If extends Instruction {
    public Expr condition;
    public Set<String> thenDependsOn = new LinkedHashSet<>();
    public Set<String> elseDependsOn = new LinkedHashSet<>();

    public If() {}

    public If(String id, Expr condition, Collection<String> thenDependsOn,
        Collection<String> elseDependsOn, Collection<String> dependsOn) {
      init(id, dependsOn);
      this.condition = condition;
      this.thenDependsOn = new LinkedHashSet<>(thenDependsOn);
      this.elseDependsOn = new LinkedHashSet<>(elseDependsOn);
    }

    @Override
    public <E> ExecutionResult<E> execute(InstructionExecutor<E> executor) {
      return executor.execIf(this);
    }

    @Override String describe() { return "if " + condition + " then " + thenDependsOn + " else " + elseDependsOn; }
  }

  @JsonTypeName("YieldState")
  public static final class YieldState extends Instruction {
    public Expr expression;
    public String componentId;
    public Expr time;
    public String timeId;

    public YieldState() {}

    public YieldState(String id, Expr expression, String componentId, Expr time, String timeId,
        Collection<String> dependsOn) {
      init(id, dependsOn);
      this.expression = expression;
      this.componentId = componentId;
      this.time = time;
      this.timeId = timeId;
    }

    @Override
    public <E> ExecutionResult<E> execute(InstructionExecutor<E> executor) {
      return executor.execYieldState(this);
    }

    @Override String describe() { return "yield " + componentId + "=" + expression + " @" + timeId + "(" + time + ")"; }
  }

  @JsonTypeName("FailStep")
  public static final class FailStep extends Instruction {
    public FailStep() {}

    public FailStep(String id, Collection<String> dependsOn) {
      init(id, dependsOn);
    }

    @Override
    public <E> ExecutionResult<E> execute(InstructionExecutor<E> executor) {
      return executor.execFailStep(this);
    }

    @Override String describe() { return "fail step"; }
  }

  @JsonTypeName("Raise")
  public static final class Raise extends Instruction {
    public String errorCondition;
    public String errorMessage;

    public Raise() {}

    public Raise(String id, String errorCondition, String errorMessage, Collection<String> dependsOn) {
      init(id, dependsOn);
      this.errorCondition = errorCondition;
      this.errorMessage = errorMessage;
    }

    @Override
    public <E> ExecutionResult<E> execute(InstructionExecutor<E> executor) {
      return executor.execRaise(this);
    }

    @Override String describe() { return "raise " + errorCondition + "(" + errorMessage + ")"; }
  }

  @JsonTypeName("StateTransition")
  public static final class StateTransition extends Instruction {
    public String nextState;

    public StateTransition() {}

    public StateTransition(String id, String nextState, Collection<String> dependsOn) {
      init(id, dependsOn);
      this.nextState = nextState;
    }

    @Override
    public <E> ExecutionResult<E> execute(InstructionExecutor<E> executor) {
      return executor.execStateTransition(this);
    }

    @Override String describe() { return "transition -> " + nextState; }
  }

  @JsonTypeName("Nop")
  public static final class Nop extends Instruction {
    public Nop() {}

    public Nop(String id, Collection<String> dependsOn) {
      init(id, dependsOn);
    }

    @Override
    public <E> ExecutionResult<E> execute(InstructionExecutor<E> executor) {
      return executor.execNop(this);
    }

    @Override String describe() { return "nop"; }
  }

  // ---------------------------------------------------------------------------
  // 表达式
  // ---------------------------------------------------------------------------

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Constant.class, name = "Constant"),
    @JsonSubTypes.Type(value = BoolConstant.class, name = "Bool"),
    @JsonSubTypes.Type(value = Variable.class, name = "Variable"),
    @JsonSubTypes.Type(value = Sum.class, name = "Sum"),
    @JsonSubTypes.Type(value = Product.class, name = "Product"),
    @JsonSubTypes.Type(value = Quotient.class, name = "Quotient"),
    @JsonSubTypes.Type(value = Power.class, name = "Power"),
    @JsonSubTypes.Type(value = Comparison.class, name = "Comparison"),
    @JsonSubTypes.Type(value = LogicalAnd.class, name = "And"),
    @JsonSubTypes.Type(value = LogicalOr.class, name = "Or"),
    @JsonSubTypes.Type(value = LogicalNot.class, name = "Not"),
    @JsonSubTypes.Type(value = Call.class, name = "Call")
  })
  public sealed interface Expr
      permits Constant, BoolConstant, Variable, Sum, Product, Quotient, Power, Comparison,
          LogicalAnd, LogicalOr, LogicalNot, Call {}

  @JsonTypeName("Constant")
  public static final class Constant implements Expr {
    public double value;
    public Constant() {}
    public Constant(double value) { this.value = value; }
    @Override public String toString() { return Double.toString(value); }
  }

  @JsonTypeName("Bool")
  public static final class BoolConstant implements Expr {
    public boolean value;
    public BoolConstant() {}
    public BoolConstant(boolean value) { this.value = value; }
    @Override public String toString() { return Boolean.toString(value); }
  }

  @JsonTypeName("Variable")
  public static final class Variable implements Expr {
    public String name;
    public Variable() {}
    public Variable(String name) { this.name = name; }
    @Override public String toString() { return name; }

    @Override
    public boolean equals(Object o) {
      return o instanceof Variable v && Objects.equals(name, v.name);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(name);
    }
  }

  @JsonTypeName("Sum")
  public static final class Sum implements Expr {
    public List<Expr> children = new ArrayList<>();
    public Sum() {}
    public Sum(List<Expr> children) { this.children = new ArrayList<>(children); }
    @Override public String toString() { return join(children, " + "); }
  }

  @JsonTypeName("Product")
  public static final class Product implements Expr {
    public List<Expr> children = new ArrayList<>();
    public Product() {}
    public Product(List<Expr> children) { this.children = new ArrayList<>(children); }
    @Override public String toString() { return join(children, "*"); }
  }

  @JsonTypeName("Quotient")
  public static final class Quotient implements Expr {
    public Expr numerator;
    public Expr denominator;
    public Quotient() {}
    public Quotient(Expr numerator, Expr denominator) { this.numerator = numerator; this.denominator = denominator; }
    @Override public String toString() { return "(" + numerator + " / " + denominator + ")"; }
  }

  @JsonTypeName("Power")
  public static final class Power implements Expr {
    public Expr base;
    public Expr exponent;
    public Power() {}
    public Power(Expr base, Expr exponent) { this.base = base; this.exponent = exponent; }
    @Override public String toString() { return "(" + base + ")**(" + exponent + ")"; }
  }

  @JsonTypeName("Comparison")
  public static final class Comparison implements Expr {
    public Expr left;
    // 取值：< <= > >= == !=
    public String operator;
    public Expr right;
    public Comparison() {}
    public Comparison(Expr left, String operator, Expr right) { this.left = left; this.operator = operator; this.right = right; }
    @Override public String toString() { return "(" + left + " " + operator + " " + right + ")"; }
  }

  @JsonTypeName("And")
  public static final class LogicalAnd implements Expr {
    public List<Expr> children = new ArrayList<>();
    public LogicalAnd() {}
    public LogicalAnd(List<Expr> children) { this.children = new ArrayList<>(children); }
    @Override public String toString() { return join(children, " and "); }
  }

  @JsonTypeName("Or")
  public static final class LogicalOr implements Expr {
    public List<Expr> children = new ArrayList<>();
    public LogicalOr() {}
    public LogicalOr(List<Expr> children) { this.children = new ArrayList<>(children); }
    @Override public String toString() { return join(children, " or "); }
  }

  @JsonTypeName("Not")
  public static final class LogicalNot implements Expr {
    public Expr child;
    public LogicalNot() {}
    public LogicalNot(Expr child) { this.child = child; }
    @Override public String toString() { return "not " + child; }
  }

  @JsonTypeName("Call")
  public static final class Call implements Expr {
    public String function;
    public List<Expr> parameters = new ArrayList<>();
    public Map<String, Expr> kwParameters = new LinkedHashMap<>();
    public Call() {}
    public Call(String function, List<Expr> parameters, Map<String, Expr> kwParameters) {
      this.function = function;
      this.parameters = new ArrayList<>(parameters);
      this.kwParameters = new LinkedHashMap<>(kwParameters);
    }

    @Override
    public String toString() {
      StringJoiner sj = new StringJoiner(", ", function + "(", ")");
      for (Expr p : parameters) sj.add(String.valueOf(p));
      for (var e : kwParameters.entrySet()) sj.add(e.getKey() + "=" + e.getValue());
      return sj.toString();
    }
  }

  private static String join(List<Expr> children, String sep) {
    StringJoiner sj = new StringJoiner(sep, "(", ")");
    for (Expr c : children) sj.add(String.valueOf(c));
    return sj.toString();
  }

  // ---------------------------------------------------------------------------
  // 表达式工厂（供方法作者与测试使用）
  // ---------------------------------------------------------------------------

  public static Variable var(String name) { return new Variable(name); }
  public static Constant constant(double value) { return new Constant(value); }
  public static BoolConstant bool(boolean value) { return new BoolConstant(value); }
  public static Sum sum(Expr... children) { return new Sum(List.of(children)); }
  public static Product product(Expr... children) { return new Product(List.of(children)); }
  public static Quotient quotient(Expr numerator, Expr denominator) { return new Quotient(numerator, denominator); }
  public static Power power(Expr base, Expr exponent) { return new Power(base, exponent); }
  public static Comparison compare(Expr left, String operator, Expr right) { return new Comparison(left, operator, right); }
  public static LogicalAnd and(Expr... children) { return new LogicalAnd(List.of(children)); }
  public static LogicalOr or(Expr... children) { return new LogicalOr(List.of(children)); }
  public static LogicalNot not(Expr child) { return new LogicalNot(child); }
  public static Call call(String function, Expr... parameters) { return new Call(function, List.of(parameters), Map.of()); }

  /** a - b，表示为 a + (-1)*b。 */
  public static Sum difference(Expr a, Expr b) { return sum(a, product(constant(-1), b)); }
}
