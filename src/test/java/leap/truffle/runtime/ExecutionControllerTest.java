package leap.truffle.runtime;

import leap.truffle.core.IrModel;
import leap.truffle.core.TimeIntegratorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static leap.truffle.core.IrModel.bool;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutionController 调度测试：每条指令至多执行一次、只执行被选中的分支、
 * 新计划层优先、层内按插入序号决胜。
 */
public class ExecutionControllerTest {

  private List<String> trace;

  /** 只记录执行顺序的执行器，If 的条件必须是布尔常量。 */
  private class RecordingExecutor implements InstructionExecutor<String> {
    private ExecutionResult<String> record(IrModel.Instruction insn) {
      trace.add(insn.id);
      return ExecutionResult.none();
    }

    @Override public ExecutionResult<String> execAssignExpression(IrModel.AssignExpression insn) { return record(insn); }
    @Override public ExecutionResult<String> execAssignSolved(IrModel.AssignSolved insn) { return record(insn); }
    @Override public ExecutionResult<String> execYieldState(IrModel.YieldState insn) { return record(insn); }
    @Override public ExecutionResult<String> execFailStep(IrModel.FailStep insn) { return record(insn); }
    @Override public ExecutionResult<String> execRaise(IrModel.Raise insn) { return record(insn); }
    @Override public ExecutionResult<String> execStateTransition(IrModel.StateTransition insn) { return record(insn); }
    @Override public ExecutionResult<String> execNop(IrModel.Nop insn) { return record(insn); }

    @Override
    public ExecutionResult<String> execIf(IrModel.If insn) {
      trace.add(insn.id);
      boolean taken = ((IrModel.BoolConstant) insn.condition).value;
      return ExecutionResult.require(taken ? insn.thenDependsOn : insn.elseDependsOn);
    }
  }

  @BeforeEach
  public void setUp() {
    trace = new ArrayList<>();
  }

  private static IrModel.Nop nop(String id, String... deps) {
    return new IrModel.Nop(id, List.of(deps));
  }

  private static TimeIntegratorCode program(Set<String> required, IrModel.Instruction... insns) {
    Map<String, IrModel.State> states = new LinkedHashMap<>();
    states.put("main", new IrModel.State(required, "main"));
    return TimeIntegratorCode.create(List.of(insns), states, "main");
  }

  private List<String> runMain(TimeIntegratorCode code) {
    ExecutionController controller = new ExecutionController(code);
    controller.updatePlan(code.getState("main").dependsOn);
    controller.run(new RecordingExecutor(), e -> {});
    return trace;
  }

  @Test
  public void testSharedDependencyRunsOnce() {
    TimeIntegratorCode code = program(Set.of("d", "e"),
        nop("c"), nop("d", "c"), nop("e", "c"));

    List<String> order = runMain(code);

    assertEquals(List.of("c", "d", "e"), order, "共享依赖 c 只执行一次，且先于 d/e");
  }

  @Test
  public void testOnlyTakenBranchRuns() {
    TimeIntegratorCode code = program(Set.of("if"),
        nop("a"), nop("b"),
        new IrModel.If("if", bool(true), List.of("a"), List.of("b"), List.of()));

    List<String> order = runMain(code);

    assertEquals(List.of("if", "a"), order, "条件为真时只执行 then 分支");
  }

  @Test
  public void testElseBranchRuns() {
    TimeIntegratorCode code = program(Set.of("if"),
        nop("a"), nop("b"),
        new IrModel.If("if", bool(false), List.of("a"), List.of("b"), List.of()));

    assertEquals(List.of("if", "b"), runMain(code), "条件为假时只执行 else 分支");
  }

  @Test
  public void testNewestLayerFirst() {
    // z 的插入序号小于 c，但 c 属于 If 追加的新计划层
    TimeIntegratorCode code = program(Set.of("if", "z"),
        new IrModel.If("if", bool(true), List.of("c"), List.of(), List.of()),
        nop("z"), nop("c"));

    assertEquals(List.of("if", "c", "z"), runMain(code), "新计划层优先于旧层");
  }

  @Test
  public void testInsertionOrderTieBreak() {
    TimeIntegratorCode code = program(Set.of("c", "a", "b"),
        nop("a"), nop("b"), nop("c"));

    assertEquals(List.of("a", "b", "c"), runMain(code), "同层就绪指令按插入序号执行");
  }

  @Test
  public void testBranchReusesExecutedInstruction() {
    TimeIntegratorCode code = program(Set.of("if"),
        nop("a"),
        new IrModel.If("if", bool(true), List.of("a"), List.of(), List.of("a")));

    assertEquals(List.of("a", "if"), runMain(code), "分支需要的已执行指令不应重复执行");
  }

  @Test
  public void testCopyForksSchedulingState() {
    TimeIntegratorCode code = program(Set.of("b"), nop("a"), nop("b", "a"));
    ExecutionController controller = new ExecutionController(code);
    controller.updatePlan(Set.of("b"));

    ExecutionController fork = controller.copy();
    String first = fork.nextReady(0);
    fork.markExecuted(first);

    assertEquals("a", first);
    assertEquals(Set.of("a"), fork.getExecutedIds(), "副本记录执行");
    assertTrue(controller.getExecutedIds().isEmpty(), "原控制器不受影响");
    assertEquals(List.of(List.of("a", "b")), controller.pendingPlan());
    assertEquals(List.of(List.of("b")), fork.pendingPlan());
  }

  @Test
  public void testExceptionsPropagate() {
    TimeIntegratorCode code = program(Set.of("fail"), new IrModel.FailStep("fail", List.of()));
    ExecutionController controller = new ExecutionController(code);
    controller.updatePlan(Set.of("fail"));

    InstructionExecutor<String> failing = new RecordingExecutor() {
      @Override
      public ExecutionResult<String> execFailStep(IrModel.FailStep insn) {
        throw new FailStepException(insn.id);
      }
    };

    assertThrows(FailStepException.class, () -> controller.run(failing, e -> {}));
  }
}
