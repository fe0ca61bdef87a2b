package leap.truffle.codegen;

import leap.truffle.Programs;
import leap.truffle.core.IrModel;
import leap.truffle.core.SymbolKind;
import leap.truffle.core.TimeIntegratorCode;
import leap.truffle.core.UndeclaredComponentException;
import leap.truffle.runtime.FunctionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static leap.truffle.core.IrModel.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 降级流程测试：用记录降级动作的生成器检查赋值协议选择与非结构区间的标签分派。
 */
public class StructuredCodeGeneratorTest {

  /** 把每个降级动作记录为一行文本。 */
  static final class RecordingGenerator extends StructuredCodeGenerator<List<String>> {
    private final Set<String> components;
    final List<String> events = new ArrayList<>();

    RecordingGenerator(Set<String> components) {
      super(FunctionRegistry.withBuiltins());
      this.components = components;
    }

    void lowerTree(ControlNode tree) {
      lower(tree);
    }

    @Override protected Set<String> declaredComponents() { return components; }
    @Override protected void beginEmit() { events.add("begin"); }
    @Override protected void emitDefBegin(String function) { events.add("def " + function); }
    @Override protected void emitDefEnd(String function) { events.add("end " + function); }
    @Override protected List<String> finishEmit() { events.add("finish"); return events; }
    @Override protected void emitIfBegin(IrModel.Expr condition) { events.add("if " + condition); }
    @Override protected void emitElseBegin() { events.add("else"); }
    @Override protected void emitIfEnd() { events.add("endif"); }
    @Override protected void emitDispatchBegin() { events.add("dispatch"); }
    @Override protected void emitDispatchCase(int label) { events.add("case " + label); }
    @Override protected void emitSetLabel(int label) { events.add("label " + label); }
    @Override protected void emitDispatchEnd() { events.add("enddispatch"); }
    @Override protected void emitReturn() { events.add("return"); }
    @Override protected void emitScalarAssign(String a, IrModel.Expr e, SymbolKind k) { events.add("scalar " + a); }
    @Override protected void emitAlias(String a, String s, SymbolKind.OdeComponent k) { events.add("alias " + a + " " + s); }
    @Override protected void emitFreshAssign(String a, IrModel.Expr e, SymbolKind.OdeComponent k) { events.add("fresh " + a); }
    @Override protected void emitSwapAssign(String a, IrModel.Expr e, SymbolKind.OdeComponent k) { events.add("swap " + a); }
    @Override protected void emitAssignSolved(IrModel.AssignSolved insn, SymbolKind k) { events.add("solve " + insn.assignee); }
    @Override protected void emitAssignTimeId(String a, String timeId) { events.add("timeid " + a + " " + timeId); }
    @Override protected void emitYieldNotify(IrModel.YieldState insn) { events.add("notify " + insn.componentId); }
    @Override protected void emitFailStep(IrModel.FailStep insn) { events.add("fail"); }
    @Override protected void emitRaise(IrModel.Raise insn) { events.add("raise"); }
    @Override protected void emitStateTransition(IrModel.StateTransition insn) { events.add("transition " + insn.nextState); }
  }

  private RecordingGenerator generator;

  @BeforeEach
  public void setUp() {
    generator = new RecordingGenerator(Set.of("x", "y"));
  }

  @Test
  public void testAssignmentProtocolSelection() {
    List<String> events = generator.generate(Programs.forwardEuler(0.5));

    assertEquals(List.of(
        "begin",
        "def primary",
        "fresh k",
        "timeid <ret_time_id>y final",
        "scalar <ret_time>y",
        "fresh <ret_state>y",
        "notify y",
        "swap <state>y",
        "scalar <t>",
        "return",
        "end primary",
        "finish"), events, "不读取自身的右侧写入独占缓冲区，读取自身的右侧先写临时缓冲区再交换");
  }

  @Test
  public void testVariableRightHandSideAliases() {
    List<String> events = generator.generate(Programs.counter());

    assertTrue(events.contains("alias <ret_state>x <state>x"), "裸变量右侧应为别名");
    assertTrue(events.contains("swap <state>x"));
  }

  @Test
  public void testSelfAssignmentIsNoOp() {
    Map<String, IrModel.State> states = new LinkedHashMap<>();
    states.put("main", new IrModel.State(Set.of("same"), "main"));
    TimeIntegratorCode code = TimeIntegratorCode.create(List.of(
        new IrModel.AssignExpression("same", "<state>x", var("<state>x"), List.of())), states, "main");

    List<String> events = generator.generate(code);

    assertEquals(List.of("begin", "def main", "return", "end main", "finish"), events, "a = a 不产生任何动作");
  }

  @Test
  public void testRetChannelKinds() {
    generator.generate(Programs.forwardEuler(0.5));

    Map<String, SymbolKind> global = generator.getSymbolKinds().getGlobalTable();
    assertEquals(SymbolKind.REAL, global.get("<ret_time>y"));
    assertEquals(SymbolKind.REAL, global.get("<ret_time_id>y"));
    assertEquals(SymbolKind.odeComponent("y"), global.get("<ret_state>y"));
  }

  @Test
  public void testUndeclaredComponent() {
    RecordingGenerator bare = new RecordingGenerator(Set.of());

    UndeclaredComponentException ex = assertThrows(UndeclaredComponentException.class,
        () -> bare.generate(Programs.forwardEuler(0.5)));
    assertEquals(Set.of("y"), ex.getComponentIds());
  }

  @Test
  public void testSingleUse() {
    generator.generate(Programs.counter());

    assertThrows(IllegalStateException.class, () -> generator.generate(Programs.counter()));
  }

  @Test
  public void testBranchLowering() {
    List<String> events = generator.generate(Programs.retryOnce());

    int def = events.indexOf("def primary");
    List<String> primary = events.subList(def, events.indexOf("end primary"));
    assertEquals("scalar <p>attempts", primary.get(1));
    assertEquals("if (<p>attempts < 2.0)", primary.get(2));
    assertEquals("fail", primary.get(3));
    assertEquals("else", primary.get(4), "FailStep 路径单独成为 then 分支");
    assertEquals("swap <state>x", primary.get(5));
    assertEquals(List.of("endif", "return"), primary.subList(primary.size() - 2, primary.size()),
        "FailStep 臂自行离开，只有 else 路径到达出口");
    assertEquals(1, Collections.frequency(primary, "return"));
  }

  @Test
  public void testIrreducibleIntervalDispatch() {
    ControlFlowGraph cfg = new ControlFlowGraph("irreducible");
    BasicBlock a = cfg.newBlock();
    BasicBlock b = cfg.newBlock();
    cfg.getEntry().terminate(new BasicBlock.Branch(var("p"), a, b));
    a.terminate(new BasicBlock.Jump(b));
    b.terminate(new BasicBlock.Branch(var("q"), a, cfg.getExit()));
    cfg.computePredecessors();

    generator.lowerTree(new StructuralExtractor().extract(cfg));

    assertEquals(List.of(
        "dispatch",
        "case 0", "if p", "label 1", "else", "label 2", "endif",
        "case 1", "label 2",
        "case 2", "if not q", "return", "endif", "label 1",
        "enddispatch"), generator.events);
  }

  @Test
  public void testIntervalMemberEndingInBranchStructure() {
    // entry -> P, B；P 内嵌 if-then-else 后接 A 上的 if-then，汇合到 M；M 与 B 构成两个入口的环
    ControlFlowGraph cfg = new ControlFlowGraph("irreducible");
    BasicBlock p = cfg.newBlock();
    BasicBlock q = cfg.newBlock();
    BasicBlock q1 = cfg.newBlock();
    BasicBlock q2 = cfg.newBlock();
    BasicBlock q3 = cfg.newBlock();
    BasicBlock r = cfg.newBlock();
    BasicBlock a = cfg.newBlock();
    BasicBlock t = cfg.newBlock();
    BasicBlock m = cfg.newBlock();
    BasicBlock b = cfg.newBlock();
    cfg.getEntry().terminate(new BasicBlock.Branch(var("p"), p, b));
    p.terminate(new BasicBlock.Branch(var("c1"), q, r));
    q.terminate(new BasicBlock.Branch(var("c2"), q1, q2));
    q1.terminate(new BasicBlock.Jump(q3));
    q2.terminate(new BasicBlock.Jump(q3));
    q3.terminate(new BasicBlock.Jump(a));
    r.terminate(new BasicBlock.Jump(a));
    a.terminate(new BasicBlock.Branch(var("c3"), t, m));
    t.terminate(new BasicBlock.Jump(m));
    m.terminate(new BasicBlock.Jump(b));
    b.terminate(new BasicBlock.Branch(var("q"), m, cfg.getExit()));
    cfg.computePredecessors();

    ControlNode tree = new StructuralExtractor().extract(cfg);
    ControlNode.UnstructuredInterval interval = assertInstanceOf(ControlNode.UnstructuredInterval.class, tree);
    ControlNode.Block member = assertInstanceOf(ControlNode.Block.class, interval.getNodes().get(1));
    assertNull(member.getExitBlock());
    assertSame(m, member.getFollow(), "Block 的汇合块取自最后一个子节点");

    generator.lowerTree(tree);

    assertEquals(List.of(
        "dispatch",
        "case 0", "if p", "label 1", "else", "label 3", "endif",
        "case 1", "if c1", "if c2", "else", "endif", "else", "endif", "if c3", "endif", "label 2",
        "case 2", "label 3",
        "case 3", "if not q", "return", "endif", "label 2",
        "enddispatch"), generator.events);
  }

  @Test
  public void testRejectInNestedBranchStaysStructured() {
    List<String> events = generator.generate(Programs.estimateThenReject());

    assertFalse(events.contains("dispatch"), "可归约的程序不应退化为标签分派：" + events);
    int def = events.indexOf("def primary");
    List<String> primary = events.subList(def, events.indexOf("end primary"));
    int fail = primary.indexOf("fail");
    assertEquals("if (<p>attempts < 2.0)", primary.get(fail - 1));
    assertEquals("else", primary.get(fail + 1), "拒绝臂之后直接进入内层 else");
    assertEquals(List.of("endif", "else", "endif"), primary.subList(fail + 2, fail + 5), "外层 else 臂为空");
    assertEquals("return", primary.get(primary.size() - 1));
    assertEquals(1, Collections.frequency(primary, "return"), "汇合后只有一个出口");
  }
}
