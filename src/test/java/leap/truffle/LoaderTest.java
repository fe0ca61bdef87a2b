package leap.truffle;

import leap.truffle.core.IrModel;
import leap.truffle.core.ProgramValidationException;
import leap.truffle.core.TimeIntegratorCode;
import leap.truffle.runtime.FunctionRegistry;
import leap.truffle.runtime.StepEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON 程序加载测试。
 */
public class LoaderTest {

  private Loader loader;

  @BeforeEach
  public void setUp() {
    loader = new Loader();
  }

  private TimeIntegratorCode loadResource(String name) throws IOException {
    try (InputStream in = getClass().getResourceAsStream("/programs/" + name)) {
      assertNotNull(in, "测试资源缺失：" + name);
      return loader.load(in);
    }
  }

  @Test
  public void testLoadAndRun() throws IOException {
    TimeIntegratorCode code = loadResource("counter.json");

    assertEquals("primary", code.getInitialState());
    assertEquals(3, code.getInstructions().size());
    assertTrue(code.getInstruction("yield") instanceof IrModel.YieldState);

    ReferenceInterpreter interp = new ReferenceInterpreter(code, new FunctionRegistry());
    interp.setUp(0.0, 1.0, Map.of("x", 0.0));
    List<Object> values = new ArrayList<>();
    for (StepEvent e : interp.run(null, 3).drain()) {
      if (e instanceof StepEvent.StateComputed sc) {
        values.add(sc.stateComponent());
      }
    }
    assertEquals(List.of(1.0, 2.0, 3.0), values, "加载的程序应与手工构建的程序行为一致");
  }

  @Test
  public void testAllInstructionKinds() throws IOException {
    TimeIntegratorCode code = loadResource("adaptive.json");

    IrModel.If check = (IrModel.If) code.getInstruction("check");
    assertEquals(Set.of("reject"), check.thenDependsOn);
    assertEquals(Set.of("accept"), check.elseDependsOn);
    IrModel.Comparison condition = (IrModel.Comparison) check.condition;
    assertEquals(">", condition.operator);
    assertEquals("<builtin>norm", ((IrModel.Call) condition.left).function);
    assertEquals("StepSizeUnderflow", ((IrModel.Raise) code.getInstruction("give_up")).errorCondition);
    assertTrue(code.getInstruction("reject") instanceof IrModel.FailStep);
    assertTrue(code.getInstruction("accept") instanceof IrModel.Nop);
    assertEquals("primary", ((IrModel.StateTransition) code.getInstruction("stop")).nextState);
  }

  @Test
  public void testSerializedProgramLoadsBack() throws IOException {
    IrModel.Module module = new IrModel.Module();
    module.instructions.addAll(Programs.forwardEuler(0.5).getInstructions());
    module.states.put(Programs.PRIMARY, new IrModel.State(Set.of("advance"), Programs.PRIMARY));
    module.initialState = Programs.PRIMARY;

    String json = loader.toJson(module);
    TimeIntegratorCode reloaded = loader.load(json);

    assertTrue(json.contains("\"kind\" : \"AssignExpression\""), "指令变体应以 kind 字段区分");
    IrModel.AssignExpression update = (IrModel.AssignExpression) reloaded.getInstruction("update");
    assertEquals("<state>y", update.assignee);
    assertEquals(Set.of("yield"), update.dependsOn);
  }

  @Test
  public void testInvalidProgramRejected() {
    String json = "{\"initialState\": \"primary\","
        + "\"states\": {\"primary\": {\"dependsOn\": [\"missing\"], \"nextState\": \"primary\"}},"
        + "\"instructions\": []}";

    ProgramValidationException ex = assertThrows(ProgramValidationException.class, () -> loader.load(json));
    assertTrue(ex.getMessage().contains("missing"), "错误信息应指出缺失的指令 id");
  }
}
