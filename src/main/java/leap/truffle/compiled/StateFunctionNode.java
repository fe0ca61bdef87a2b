package leap.truffle.compiled;

import leap.truffle.nodes.Profiler;
import java.util.List;
import java.util.Map;

/**
 * 一个程序状态的函数体。
 *
 * 进入时把下一状态设为状态声明的后继；无论正常返回、步拒绝还是异常，
 * 离开时都释放全部局部 ODE 分量。
 */
public final class StateFunctionNode extends StatementNode {
  private final String name;
  private final String defaultNextState;
  private final int slotCount;
  private final Map<String, Integer> slots;
  private final List<SlotRef> odeLocals;
  @Child private StatementNode body;

  public StateFunctionNode(String name, String defaultNextState, StatementNode body, int slotCount,
      Map<String, Integer> slots, List<SlotRef> odeLocals) {
    this.name = name;
    this.defaultNextState = defaultNextState;
    this.body = body;
    this.slotCount = slotCount;
    this.slots = slots;
    this.odeLocals = List.copyOf(odeLocals);
  }

  public String getName() {
    return name;
  }

  public void call(CompiledProgram program) {
    execute(new CompiledFrame(program, slotCount, slots));
  }

  @Override
  public void execute(CompiledFrame frame) {
    Profiler.inc("state_function");
    frame.program().setNextState(defaultNextState);
    try {
      body.execute(frame);
    } finally {
      for (SlotRef local : odeLocals) {
        frame.set(local, BufferProtocol.deinit(frame.heap(), frame.getBuffer(local)));
      }
    }
  }

  @Override
  public String toString() {
    return "StateFunctionNode[" + name + "]";
  }
}
