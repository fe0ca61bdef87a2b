package leap.truffle.compiled;

import leap.truffle.Programs;
import leap.truffle.ReferenceInterpreter;
import leap.truffle.codegen.ComponentLayout;
import leap.truffle.core.IrModel;
import leap.truffle.core.ProgramValidationException;
import leap.truffle.core.TimeIntegratorCode;
import leap.truffle.core.UndeclaredComponentException;
import leap.truffle.nodes.ConstantNode;
import leap.truffle.nodes.NewtonSolver;
import leap.truffle.runtime.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static leap.truffle.core.IrModel.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 编译后端测试：与参考解释器的事件序列一致，缓冲区协议无泄漏。
 */
public class NodeCodeGeneratorTest {

  private static Map<String, ComponentLayout> layout(String component, int size) {
    return Map.of(component, ComponentLayout.of("real (kind=8)", String.valueOf(size)));
  }

  private static CompiledProgram compile(TimeIntegratorCode code, String component, int size) {
    return new NodeCodeGenerator(layout(component, size), new FunctionRegistry()).generate(code);
  }

  private static double[] asArray(Object value) {
    return value instanceof double[] arr ? arr : new double[] {(Double) value};
  }

  /** 把两种后端的事件逐个比较，状态值统一按数组比较。 */
  private static void assertSameEvents(List<StepEvent> expected, List<StepEvent> actual) {
    assertEquals(expected.size(), actual.size(), "事件数量应一致");
    for (int i = 0; i < expected.size(); i++) {
      StepEvent e = expected.get(i);
      StepEvent a = actual.get(i);
      if (e instanceof StepEvent.StateComputed es && a instanceof StepEvent.StateComputed as) {
        assertEquals(es.t(), as.t(), 1e-12);
        assertEquals(es.timeId(), as.timeId());
        assertEquals(es.componentId(), as.componentId());
        assertArrayEquals(asArray(es.stateComponent()), asArray(as.stateComponent()), 1e-12, "第 " + i + " 个事件");
      } else {
        assertEquals(e, a, "第 " + i + " 个事件");
      }
    }
  }

  @Test
  public void testCounterMatchesInterpreter() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.counter(), new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of("x", 0.0));
    CompiledProgram program = compile(Programs.counter(), "x", 1);
    program.initialize(0.0, 1.0, Map.of("x", 0.0), Map.of());

    assertSameEvents(interp.run(null, 4).drain(), program.run(null, 4).drain());
    assertArrayEquals(new double[] {4.0}, (double[]) program.getGlobal("<state>x"));
  }

  @Test
  public void testSelfReferentialUpdateMatchesInterpreter() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.forwardEuler(0.7), new FunctionRegistry());
    interp.setUp(0.0, 0.1, Map.of("y", new double[] {1.0, -2.0, 3.0}));
    CompiledProgram program = compile(Programs.forwardEuler(0.7), "y", 3);
    program.initialize(0.0, 0.1, Map.of("y", new double[] {1.0, -2.0, 3.0}), Map.of());

    assertSameEvents(interp.run(null, 10).drain(), program.run(null, 10).drain());
    assertEquals(interp.currentTime(), program.currentTime(), 1e-12);
  }

  @Test
  public void testFailedStepMatchesInterpreter() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.retryOnce(), new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of("x", 0.0));
    CompiledProgram program = compile(Programs.retryOnce(), "x", 1);
    program.initialize(0.0, 1.0, Map.of("x", 0.0), Map.of());

    List<StepEvent> events = program.run(null, 3).drain();

    assertSameEvents(interp.run(null, 3).drain(), events);
    assertEquals(new StepEvent.StepFailed(0.0), events.get(1), "第一次主状态尝试被拒绝");
    assertEquals(3.0, program.getGlobal("<p>attempts"));
    assertEquals(Programs.PRIMARY, program.pendingState());
  }

  @Test
  public void testNonlinearSelfReferenceMatchesInterpreter() {
    // y' = -y^2 的 Euler 步，随后 y = y / (1 + y^2)；两次更新都读取被赋值的 y
    FunctionRegistry registry = new FunctionRegistry();
    registry.registerOdeRhs("y", List.of("y"), args -> Values.multiply(-1.0, Values.multiply(args[1], args[1])));
    Map<String, IrModel.State> states = new LinkedHashMap<>();
    states.put(Programs.PRIMARY, new IrModel.State(Set.of("advance"), Programs.PRIMARY));
    TimeIntegratorCode code = TimeIntegratorCode.create(List.of(
        new IrModel.AssignExpression("decay", "<state>y",
            sum(var("<state>y"), product(var("<dt>"),
                new IrModel.Call("<func>y", List.of(), Map.of("t", var("<t>"), "y", var("<state>y"))))),
            List.of()),
        new IrModel.AssignExpression("squash", "<state>y",
            quotient(var("<state>y"), sum(constant(1), power(var("<state>y"), constant(2)))), List.of("decay")),
        new IrModel.YieldState("yield", var("<state>y"), "y", sum(var("<t>"), var("<dt>")), "final",
            List.of("squash")),
        new IrModel.AssignExpression("advance", "<t>", sum(var("<t>"), var("<dt>")), List.of("yield"))),
        states, Programs.PRIMARY);
    double[] initial = {0.5, -1.5, 2.0, 4.0};

    ReferenceInterpreter interp = new ReferenceInterpreter(code, registry);
    interp.setUp(0.0, 0.2, Map.of("y", initial.clone()));
    CompiledProgram program = new NodeCodeGenerator(layout("y", 4), registry).generate(code);
    program.initialize(0.0, 0.2, Map.of("y", initial.clone()), Map.of());

    assertSameEvents(interp.run(null, 6).drain(), program.run(null, 6).drain());
    assertArrayEquals((double[]) interp.getContext().get("<state>y"), (double[]) program.getGlobal("<state>y"), 1e-12);
    assertTrue(program.shutdown().isClean(), "交换缓冲区全部释放");
  }

  @Test
  public void testRejectedAttemptDropsEarlierEvents() {
    ReferenceInterpreter interp = new ReferenceInterpreter(Programs.estimateThenReject(), new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of("x", 0.0));
    CompiledProgram program = compile(Programs.estimateThenReject(), "x", 1);
    program.initialize(0.0, 1.0, Map.of("x", 0.0), Map.of());

    List<StepEvent> events = program.run(null, 3).drain();

    assertSameEvents(interp.run(null, 3).drain(), events);
    assertEquals(new StepEvent.StepFailed(0.0), events.get(1), "被拒绝的尝试只留下 StepFailed");
    assertEquals("estimate", ((StepEvent.StateComputed) events.get(2)).timeId());
  }

  @Test
  public void testSingleStepAfterRejectionStartsClean() {
    CompiledProgram program = compile(Programs.estimateThenReject(), "x", 1);
    program.initialize(0.0, 1.0, Map.of("x", 0.0), Map.of());
    program.runSingleStep();

    assertThrows(FailStepException.class, program::runSingleStep);
    List<StepEvent> events = program.runSingleStep();

    assertEquals(2, events.size(), "只包含重试这一次的输出：" + events);
    StepEvent.StateComputed estimate = (StepEvent.StateComputed) events.get(0);
    assertEquals("estimate", estimate.timeId());
    assertArrayEquals(new double[] {10.0}, asArray(estimate.stateComponent()), 1e-12);
    StepEvent.StateComputed last = (StepEvent.StateComputed) events.get(1);
    assertEquals("final", last.timeId());
    assertArrayEquals(new double[] {1.0}, asArray(last.stateComponent()), 1e-12);
    assertEquals(2.0, program.getGlobal("<p>attempts"));
  }

  @Test
  public void testShutdownIsClean() {
    CompiledProgram program = compile(Programs.forwardEuler(0.5), "y", 4);
    program.initialize(0.0, 0.1, Map.of("y", 1.0), Map.of());
    program.run(null, 5).drain();

    BufferLeakReport report = program.shutdown();

    assertTrue(report.isClean(), "正常运行后不应有泄漏：" + report);
    assertEquals(report.getAllocationCount(), report.getFreeCount(), "每次分配都有对应的释放");
    assertEquals(0, program.getHeap().getLiveArrayCount());
  }

  @Test
  public void testLeakReported() {
    CompiledProgram program = compile(Programs.counter(), "x", 2);
    program.initialize(0.0, 1.0, Map.of("x", 0.0), Map.of());
    RefCountedBuffer stray = program.getHeap().allocate(5);

    BufferLeakReport report = program.shutdown();

    assertFalse(report.isClean());
    assertEquals(List.of(new BufferLeakReport.Leak(stray.getId(), 1, 5)), report.getLeaks());
  }

  @Test
  public void testLocalsReleasedOnRaise() {
    Map<String, IrModel.State> states = new LinkedHashMap<>();
    states.put("main", new IrModel.State(Set.of("raise"), "main"));
    TimeIntegratorCode code = TimeIntegratorCode.create(List.of(
        new IrModel.AssignExpression("scale", "k", product(constant(2), var("<state>y")), List.of()),
        new IrModel.Raise("raise", "Diverged", "k too large", List.of("scale"))), states, "main");
    CompiledProgram program = compile(code, "y", 2);
    program.initialize(0.0, 1.0, Map.of("y", 1.0), Map.of());

    LeapRaisedException ex = assertThrows(LeapRaisedException.class, program::runSingleStep);

    assertEquals("Diverged", ex.getCondition());
    assertEquals(1, program.getHeap().getLiveBuffers().size(), "局部分量 k 在异常退出时已释放");
    assertTrue(program.shutdown().isClean());
  }

  @Test
  public void testAssignSolved() {
    Map<String, IrModel.State> states = new LinkedHashMap<>();
    states.put("main", new IrModel.State(Set.of("solve"), "main"));
    TimeIntegratorCode code = TimeIntegratorCode.create(List.of(
        new IrModel.AssignSolved("solve", "<p>root",
            difference(product(var("z"), var("z")), constant(9)), "z", "newton", constant(1), List.of())),
        states, "main");
    CompiledProgram program = new NodeCodeGenerator(Map.of(), new FunctionRegistry(),
        Map.of("newton", new NewtonSolver())).generate(code);
    program.initialize(0.0, 1.0, Map.of(), Map.of());

    program.runSingleStep();

    assertEquals(3.0, (Double) program.getGlobal("<p>root"), 1e-9);
  }

  @Test
  public void testInitializeValidation() {
    CompiledProgram program = compile(Programs.counter(), "x", 1);

    assertThrows(ProgramValidationException.class,
        () -> program.initialize(0.0, 1.0, Map.of("<state>x", 0.0), Map.of()), "分量名不可带保留前缀");
    UndeclaredComponentException ex = assertThrows(UndeclaredComponentException.class,
        () -> program.initialize(0.0, 1.0, Map.of("w", 0.0), Map.of()));
    assertEquals(Set.of("w"), ex.getComponentIds());
  }

  @Test
  public void testUndeclaredComponentAtCompileTime() {
    assertThrows(UndeclaredComponentException.class,
        () -> new NodeCodeGenerator(Map.of(), new FunctionRegistry()).generate(Programs.counter()));
  }

  @Test
  public void testReinitializeReleasesGlobals() {
    CompiledProgram program = compile(Programs.counter(), "x", 3);
    program.initialize(0.0, 1.0, Map.of("x", 0.0), Map.of());
    program.run(null, 2).drain();

    program.initialize(0.0, 1.0, Map.of("x", 5.0), Map.of());

    assertArrayEquals(new double[] {5.0, 5.0, 5.0}, (double[]) program.getGlobal("<state>x"));
    assertNull(program.getGlobal("<ret_state>x"), "输出通道随重新初始化清空");
    assertEquals(1, program.getHeap().getLiveBuffers().size());
  }

  @Test
  public void testDispatchLoop() {
    CompiledProgram program = compile(Programs.counter(), "x", 1);
    program.initialize(0.0, 1.0, Map.of(), Map.of());
    // 0 -> 2 -> 1 -> 出口
    StatementNode dispatch = new DispatchNode(List.of(
        new SetLabelNode(2),
        new SequenceNode(List.of(
            new ScalarAssignNode(SlotRef.global("<p>visited"), new ConstantNode(1.0)),
            new ReturnNode())),
        new SetLabelNode(1)));
    StateFunctionNode fn = new StateFunctionNode("manual", Programs.PRIMARY, dispatch, 0, Map.of(), List.of());

    fn.call(program);

    assertEquals(1.0, program.getGlobal("<p>visited"));
  }

  @Test
  public void testDispatchLabelOutOfRange() {
    CompiledProgram program = compile(Programs.counter(), "x", 1);
    program.initialize(0.0, 1.0, Map.of(), Map.of());
    StateFunctionNode fn = new StateFunctionNode("manual", Programs.PRIMARY,
        new DispatchNode(List.of(new SetLabelNode(4))), 0, Map.of(), List.of());

    assertThrows(IllegalStateException.class, () -> fn.call(program));
  }
}
