package leap.truffle.core;

import org.junit.jupiter.api.Test;

import java.util.*;

import static leap.truffle.core.IrModel.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 程序结构校验测试。
 */
public class TimeIntegratorCodeTest {

  private static Map<String, IrModel.State> loop(String... required) {
    Map<String, IrModel.State> states = new LinkedHashMap<>();
    states.put("main", new IrModel.State(Set.of(required), "main"));
    return states;
  }

  private static IrModel.Nop nop(String id, String... deps) {
    return new IrModel.Nop(id, List.of(deps));
  }

  @Test
  public void testValidProgram() {
    TimeIntegratorCode code = TimeIntegratorCode.create(
        List.of(nop("a"), nop("b", "a")), loop("b"), "main");

    assertEquals(0, code.orderOf("a"));
    assertEquals(1, code.orderOf("b"));
    assertEquals("main", code.getInitialState());
    assertEquals(List.of("a", "b"), code.getInstructions().stream().map(i -> i.id).toList());
  }

  @Test
  public void testDuplicateId() {
    assertThrows(ProgramValidationException.class,
        () -> TimeIntegratorCode.create(List.of(nop("a"), nop("a")), loop("a"), "main"));
  }

  @Test
  public void testUnknownDependency() {
    ProgramValidationException ex = assertThrows(ProgramValidationException.class,
        () -> TimeIntegratorCode.create(List.of(nop("a", "ghost")), loop("a"), "main"));
    assertTrue(ex.getMessage().contains("ghost"));
  }

  @Test
  public void testUnknownBranchDependency() {
    IrModel.If branch = new IrModel.If("if", bool(true), List.of("ghost"), List.of(), List.of());

    assertThrows(ProgramValidationException.class,
        () -> TimeIntegratorCode.create(List.of(branch), loop("if"), "main"));
  }

  @Test
  public void testUnknownStates() {
    IrModel.StateTransition jump = new IrModel.StateTransition("jump", "nowhere", List.of());
    assertThrows(ProgramValidationException.class,
        () -> TimeIntegratorCode.create(List.of(jump), loop("jump"), "main"), "转移目标必须存在");

    assertThrows(ProgramValidationException.class,
        () -> TimeIntegratorCode.create(List.of(nop("a")), loop("a"), "start"), "初始状态必须存在");

    Map<String, IrModel.State> states = new LinkedHashMap<>();
    states.put("main", new IrModel.State(Set.of("a"), "elsewhere"));
    assertThrows(ProgramValidationException.class,
        () -> TimeIntegratorCode.create(List.of(nop("a")), states, "main"), "默认后继状态必须存在");
  }

  @Test
  public void testCycleRejected() {
    ProgramValidationException ex = assertThrows(ProgramValidationException.class,
        () -> TimeIntegratorCode.create(List.of(nop("a", "b"), nop("b", "a")), loop("a"), "main"));
    assertTrue(ex.getMessage().contains("Circular"));
  }

  @Test
  public void testReadVariablesAndAssignees() {
    IrModel.AssignSolved solve = new IrModel.AssignSolved("s", "x",
        difference(var("z"), product(var("<dt>"), var("<state>y"))), "z", "newton", var("<state>y"), List.of());

    assertEquals(Set.of("<dt>", "<state>y"), Instructions.readVariables(solve), "未知量 z 不属于被读取的变量");
    assertEquals(Set.of("x"), Instructions.assignees(solve));
  }
}
