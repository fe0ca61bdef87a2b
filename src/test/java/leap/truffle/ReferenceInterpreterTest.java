package leap.truffle;

import leap.truffle.core.IrModel;
import leap.truffle.core.ProgramValidationException;
import leap.truffle.core.SymbolKind;
import leap.truffle.core.TimeIntegratorCode;
import leap.truffle.nodes.NewtonSolver;
import leap.truffle.runtime.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static leap.truffle.core.IrModel.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 参考解释器端到端测试。
 */
public class ReferenceInterpreterTest {

  private static List<Object> stateValues(List<StepEvent> events) {
    List<Object> values = new ArrayList<>();
    for (StepEvent e : events) {
      if (e instanceof StepEvent.StateComputed sc) {
        values.add(sc.stateComponent());
      }
    }
    return values;
  }

  private static TimeIntegratorCode singleState(Set<String> required, IrModel.Instruction... insns) {
    Map<String, IrModel.State> states = new LinkedHashMap<>();
    states.put(Programs.PRIMARY, new IrModel.State(required, Programs.PRIMARY));
    return TimeIntegratorCode.create(List.of(insns), states, Programs.PRIMARY);
  }

  @Test
  public void testCounterYieldsSuccessiveValues() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.counter(), new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of("x", 0.0));

    List<StepEvent> events = interp.run(null, 3).drain();

    assertEquals(List.of(1.0, 2.0, 3.0), stateValues(events), "x 应依次为 1, 2, 3");
    assertEquals(6, events.size(), "每步一个 StateComputed 加一个 StepCompleted");
    StepEvent.StateComputed first = (StepEvent.StateComputed) events.get(0);
    assertEquals(1.0, first.t(), 1e-15);
    assertEquals("final", first.timeId());
    assertEquals("x", first.componentId());
    assertEquals(new StepEvent.StepCompleted(1.0, Programs.PRIMARY, Programs.PRIMARY), events.get(1));
  }

  @Test
  public void testRunStopsAtEndTime() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.counter(), new FunctionRegistry());
    interp.setUp(0.0, 0.5, Map.of("x", 0.0));

    List<StepEvent> events = interp.run(2.0, null).drain();

    assertEquals(4, stateValues(events).size(), "t 从 0 以 0.5 推进到 2 需要四步");
    assertEquals(2.0, interp.currentTime(), 1e-15);
  }

  @Test
  public void testOnlyTakenBranchExecutes() {
    TimeIntegratorCode code = singleState(Set.of("branch"),
        new IrModel.AssignExpression("set_a", "<p>a", constant(1), List.of()),
        new IrModel.AssignExpression("set_b", "<p>b", constant(2), List.of()),
        new IrModel.If("branch", compare(var("<t>"), "<", constant(10)),
            List.of("set_a"), List.of("set_b"), List.of()));
    ReferenceInterpreter interp = new ReferenceInterpreter(code, new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of());

    interp.runSingleStep();

    assertEquals(1.0, interp.getContext().get("<p>a"), "then 分支应执行");
    assertFalse(interp.getContext().containsKey("<p>b"), "else 分支不应执行");
  }

  @Test
  public void testFailedStepIsRetried() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.retryOnce(), new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of("x", 0.0));

    List<StepEvent> events = interp.run(null, 3).drain();

    List<StepEvent> expected = List.of(
        new StepEvent.StepCompleted(0.0, Programs.INIT, Programs.PRIMARY),
        new StepEvent.StepFailed(0.0),
        new StepEvent.StateComputed(1.0, "final", "x", 1.0),
        new StepEvent.StepCompleted(1.0, Programs.PRIMARY, Programs.PRIMARY),
        new StepEvent.StateComputed(2.0, "final", "x", 2.0),
        new StepEvent.StepCompleted(2.0, Programs.PRIMARY, Programs.PRIMARY));
    assertEquals(expected, events, "被拒绝的步不计数且重新执行同一状态");
    assertEquals(3.0, interp.getContext().get("<p>attempts"), "持久变量跨越被拒绝的步保留");
  }

  @Test
  public void testRejectedAttemptDropsEarlierEvents() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.estimateThenReject(), new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of("x", 0.0));

    List<StepEvent> events = interp.run(null, 3).drain();

    // 第一次主状态尝试先输出了 estimate 再被拒绝，该输出不应出现
    List<StepEvent> expected = List.of(
        new StepEvent.StepCompleted(0.0, Programs.INIT, Programs.PRIMARY),
        new StepEvent.StepFailed(0.0),
        new StepEvent.StateComputed(0.0, "estimate", "x", 10.0),
        new StepEvent.StateComputed(1.0, "final", "x", 1.0),
        new StepEvent.StepCompleted(1.0, Programs.PRIMARY, Programs.PRIMARY),
        new StepEvent.StateComputed(1.0, "estimate", "x", 11.0),
        new StepEvent.StateComputed(2.0, "final", "x", 2.0),
        new StepEvent.StepCompleted(2.0, Programs.PRIMARY, Programs.PRIMARY));
    assertEquals(expected, events);
  }

  @Test
  public void testSolverSeesReadOnlyContext() {
    TimeIntegratorCode code = singleState(Set.of("solve"),
        new IrModel.AssignSolved("solve", "<p>root", difference(var("z"), constant(5)), "z", "meddling",
            constant(0), List.of()));
    ReferenceInterpreter interp = new ReferenceInterpreter(code, new FunctionRegistry());
    interp.registerSolver("meddling", (expression, unknown, context, functions, guess) -> {
      assertThrows(UnsupportedOperationException.class, () -> context.put("<state>x", 99.0),
          "求解器不能改写解释器状态");
      return 5.0;
    });
    interp.setUp(0.0, 1.0, Map.of("x", 1.0));

    interp.runSingleStep();

    assertEquals(1.0, interp.getContext().get("<state>x"));
    assertEquals(5.0, interp.getContext().get("<p>root"));
  }

  @Test
  public void testTransientsClearedAfterStep() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.forwardEuler(0.5), new FunctionRegistry());
    interp.setUp(0.0, 0.1, Map.of("y", 1.0));

    interp.runSingleStep();

    Map<String, Object> context = interp.getContext();
    assertFalse(context.containsKey("k"), "临时变量应在步末清除");
    assertEquals(Set.of("<t>", "<dt>", "<state>y"), context.keySet());
    assertEquals(0.95, (Double) context.get("<state>y"), 1e-12);
  }

  @Test
  public void testVectorState() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.forwardEuler(1.0), new FunctionRegistry());
    interp.setUp(0.0, 0.5, Map.of("y", new double[] {2.0, 4.0}));

    List<Object> values = stateValues(interp.run(null, 2).drain());

    assertArrayEquals(new double[] {1.0, 2.0}, (double[]) values.get(0), 1e-12);
    assertArrayEquals(new double[] {0.5, 1.0}, (double[]) values.get(1), 1e-12);
  }

  @Test
  public void testReservedStateKeyRejected() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.counter(), new FunctionRegistry());

    assertThrows(ProgramValidationException.class,
        () -> interp.setUp(0.0, 1.0, Map.of("<p>x", 1.0)), "以 '<' 开头的分量名应被拒绝");
  }

  @Test
  public void testRaisePropagates() {
    TimeIntegratorCode code = singleState(Set.of("raise"),
        new IrModel.AssignExpression("scratch", "tmp", constant(1), List.of()),
        new IrModel.Raise("raise", "NonConvergence", "solver diverged", List.of("scratch")));
    ReferenceInterpreter interp = new ReferenceInterpreter(code, new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of());

    LeapRaisedException ex = assertThrows(LeapRaisedException.class, interp::runSingleStep);

    assertEquals("NonConvergence", ex.getCondition());
    assertFalse(interp.getContext().containsKey("tmp"), "异常退出时临时变量同样被清除");
  }

  @Test
  public void testAssignSolvedWithNewton() {
    TimeIntegratorCode code = singleState(Set.of("solve"),
        new IrModel.AssignSolved("solve", "<p>root",
            difference(product(var("z"), var("z")), constant(2)), "z", "newton", constant(1), List.of()));
    ReferenceInterpreter interp = new ReferenceInterpreter(code, new FunctionRegistry(),
        Map.of("newton", new NewtonSolver()));
    interp.setUp(0.0, 1.0, Map.of());

    interp.runSingleStep();

    assertEquals(Math.sqrt(2), (Double) interp.getContext().get("<p>root"), 1e-9);
  }

  @Test
  public void testUnknownSolverRejected() {
    TimeIntegratorCode code = singleState(Set.of("solve"),
        new IrModel.AssignSolved("solve", "<p>root", var("z"), "z", "missing", constant(1), List.of()));
    ReferenceInterpreter interp = new ReferenceInterpreter(code, new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of());

    assertThrows(ProgramValidationException.class, interp::runSingleStep);
  }

  @Test
  public void testUserFunctionCall() {
    FunctionRegistry registry = new FunctionRegistry();
    registry.registerOdeRhs("y", List.of("y"), args -> Values.multiply(-2.0, args[1]));
    TimeIntegratorCode code = singleState(Set.of("advance"),
        new IrModel.AssignExpression("update", "<state>y",
            sum(var("<state>y"), product(var("<dt>"),
                new IrModel.Call("<func>y", List.of(), Map.of("t", var("<t>"), "y", var("<state>y"))))),
            List.of()),
        Programs.advanceTime("advance", "update"));
    ReferenceInterpreter interp = new ReferenceInterpreter(code, registry);
    interp.setUp(0.0, 0.25, Map.of("y", 1.0));

    interp.runSingleStep();

    assertEquals(0.5, (Double) interp.getContext().get("<state>y"), 1e-12);
  }

  @Test
  public void testLateRegistration() {
    TimeIntegratorCode code = singleState(Set.of("solve"),
        new IrModel.AssignExpression("scale", "<p>scale", new IrModel.Call("<func>half", List.of(constant(8)), Map.of()),
            List.of()),
        new IrModel.AssignSolved("solve", "<p>root",
            difference(var("z"), var("<p>scale")), "z", "newton", constant(0), List.of("scale")));
    ReferenceInterpreter interp = new ReferenceInterpreter(code, new FunctionRegistry());
    interp.registerFunction(new LeapFunction("<func>half", List.of("x"), kinds -> SymbolKind.REAL,
        args -> Values.asDouble(args[0]) / 2));
    interp.registerSolver("newton", new NewtonSolver());
    interp.setUp(0.0, 1.0, Map.of());

    interp.runSingleStep();

    assertEquals(4.0, (Double) interp.getContext().get("<p>root"), 1e-9);
    assertThrows(FunctionException.class, () -> interp.registerFunction(
        new LeapFunction(Builtins.NORM, List.of("x"), kinds -> SymbolKind.REAL, null)), "不可覆盖内置函数");
  }
}
