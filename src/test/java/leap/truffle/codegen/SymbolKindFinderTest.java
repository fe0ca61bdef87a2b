package leap.truffle.codegen;

import leap.truffle.core.IrModel;
import leap.truffle.core.ProgramValidationException;
import leap.truffle.core.SymbolKind;
import leap.truffle.runtime.Builtins;
import leap.truffle.runtime.FunctionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static leap.truffle.core.IrModel.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 符号种类推断测试。
 */
public class SymbolKindFinderTest {

  private FunctionRegistry registry;
  private SymbolKindFinder finder;

  @BeforeEach
  public void setUp() {
    registry = FunctionRegistry.withBuiltins();
    finder = new SymbolKindFinder(registry);
  }

  private static IrModel.AssignExpression assign(String id, String assignee, IrModel.Expr expr) {
    return new IrModel.AssignExpression(id, assignee, expr, List.of());
  }

  @Test
  public void testArithmeticKinds() {
    SymbolKindTable table = finder.find(Map.of("primary", List.of(
        assign("1", "k", product(var("<dt>"), var("<state>y"))),
        assign("2", "h", quotient(var("<dt>"), constant(2))),
        assign("3", "flag", compare(var("h"), "<", constant(1))),
        assign("4", "<state>y", sum(var("<state>y"), var("k"))))));

    assertEquals(SymbolKind.odeComponent("y"), table.get("primary", "k"), "与 ODE 分量相乘的结果是该分量");
    assertEquals(SymbolKind.REAL, table.get("primary", "h"));
    assertEquals(SymbolKind.BOOLEAN, table.get("primary", "flag"));
    assertEquals(SymbolKind.REAL, table.getGlobalTable().get("<t>"));
    assertEquals(Set.of("y"), table.getOdeComponentIds());
    assertFalse(table.getFunctionTable("primary").containsKey("<state>y"), "状态变量属于全局表");
  }

  @Test
  public void testFixpointAcrossOrderAndFunctions() {
    // b 在 a 之前出现，需要第二轮迭代；<p>c 在另一个函数中定义
    SymbolKindTable table = finder.find(Map.of(
        "first", List.of(assign("1", "b", sum(var("a"), constant(1))), assign("2", "a", var("<p>c"))),
        "second", List.of(assign("3", "<p>c", var("<state>z")))));

    assertEquals(SymbolKind.odeComponent("z"), table.get("first", "b"));
    assertEquals(SymbolKind.odeComponent("z"), table.getGlobalTable().get("<p>c"));
  }

  @Test
  public void testSelfReferentialCounter() {
    SymbolKindTable table = finder.find(Map.of("primary", List.of(
        assign("1", "<p>n", sum(var("<p>n"), constant(1))))));

    assertEquals(SymbolKind.REAL, table.getGlobalTable().get("<p>n"));
  }

  @Test
  public void testCallResultKinds() {
    registry.registerOdeRhs("y", List.of("y"), null);
    SymbolKindTable table = finder.find(Map.of("primary", List.of(
        assign("1", "f", new IrModel.Call("<func>y", List.of(var("<t>"), var("<state>y")), Map.of())),
        assign("2", "n", call(Builtins.NORM, var("f"))))));

    assertEquals(SymbolKind.odeComponent("y"), table.get("primary", "f"));
    assertEquals(SymbolKind.REAL, table.get("primary", "n"));
  }

  @Test
  public void testSolvedComponentTakesGuessKind() {
    IrModel.AssignSolved solve = new IrModel.AssignSolved("1", "x",
        difference(var("z"), var("<state>y")), "z", "newton", var("<state>y"), List.of());

    SymbolKindTable table = finder.find(Map.of("primary", List.of(solve)));

    assertEquals(SymbolKind.odeComponent("y"), table.get("primary", "x"));
    assertEquals(SymbolKind.odeComponent("y"), table.get("primary", "z"));
  }

  @Test
  public void testUninferableVariable() {
    ProgramValidationException ex = assertThrows(ProgramValidationException.class,
        () -> finder.find(Map.of("primary", List.of(assign("1", "a", var("ghost"))))));
    assertTrue(ex.getMessage().contains("ghost"));
  }

  @Test
  public void testConflictingKinds() {
    assertThrows(ProgramValidationException.class, () -> finder.find(Map.of("primary", List.of(
        assign("1", "<p>v", constant(1)),
        assign("2", "<p>v", var("<state>y"))))));
  }

  @Test
  public void testRealUpgradesToComplex() {
    SymbolKindTable table = new SymbolKindTable();

    assertTrue(table.set("f", "a", SymbolKind.REAL));
    assertTrue(table.set("f", "a", SymbolKind.COMPLEX), "实标量可升级为复标量");
    assertFalse(table.set("f", "a", SymbolKind.REAL), "复标量不降级");
    assertEquals(SymbolKind.COMPLEX, table.get("f", "a"));
    assertNull(table.lookup("g", "a"), "局部变量按函数隔离");
  }
}
