package leap.truffle.core;

import leap.truffle.runtime.DependencyGraph;
import leap.truffle.runtime.ErrorMessages;
import java.util.*;

/**
 * 已校验的时间积分器程序：按插入顺序保存的指令表、状态表与初始状态。
 *
 * <p>构造时完成全部结构校验（id 唯一、引用存在、状态存在、依赖无环），
 * 之后执行控制器与代码生成器都可以直接信任该对象。</p>
 */
public final class TimeIntegratorCode {
  private final Map<String, IrModel.Instruction> instructions;
  private final Map<String, Integer> order;
  private final Map<String, IrModel.State> states;
  private final String initialState;

  private TimeIntegratorCode(Map<String, IrModel.Instruction> instructions,
      Map<String, IrModel.State> states, String initialState) {
    this.instructions = Collections.unmodifiableMap(instructions);
    Map<String, Integer> idx = new HashMap<>();
    int i = 0;
    for (String id : instructions.keySet()) {
      idx.put(id, i++);
    }
    this.order = idx;
    this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    this.initialState = initialState;
  }

  /**
   * 校验并构造程序。
   *
   * @throws ProgramValidationException 结构不合法时
   */
  public static TimeIntegratorCode create(List<IrModel.Instruction> instructions,
      Map<String, IrModel.State> states, String initialState) {
    Map<String, IrModel.Instruction> byId = new LinkedHashMap<>();
    for (IrModel.Instruction insn : instructions) {
      if (insn.id == null || byId.containsKey(insn.id)) {
        throw new ProgramValidationException(ErrorMessages.duplicateInstruction(insn.id));
      }
      byId.put(insn.id, insn);
    }
    validate(byId, states, initialState);
    return new TimeIntegratorCode(byId, states, initialState);
  }

  public static TimeIntegratorCode fromModule(IrModel.Module module) {
    return create(module.instructions, module.states, module.initialState);
  }

  private static void validate(Map<String, IrModel.Instruction> byId,
      Map<String, IrModel.State> states, String initialState) {
    for (IrModel.Instruction insn : byId.values()) {
      requireIds(byId, insn.dependsOn, "instruction '" + insn.id + "'");
      if (insn instanceof IrModel.If branch) {
        requireIds(byId, branch.thenDependsOn, "then-branch of '" + insn.id + "'");
        requireIds(byId, branch.elseDependsOn, "else-branch of '" + insn.id + "'");
      } else if (insn instanceof IrModel.StateTransition transition) {
        requireState(states, transition.nextState, "instruction '" + insn.id + "'");
      }
    }
    requireState(states, initialState, "initial state");
    for (Map.Entry<String, IrModel.State> e : states.entrySet()) {
      requireIds(byId, e.getValue().dependsOn, "state '" + e.getKey() + "'");
      requireState(states, e.getValue().nextState, "state '" + e.getKey() + "'");
    }

    DependencyGraph graph = new DependencyGraph();
    int priority = 0;
    for (IrModel.Instruction insn : byId.values()) {
      try {
        graph.addInstruction(insn.id, insn.dependsOn, priority++);
      } catch (IllegalArgumentException ex) {
        throw new ProgramValidationException(ex.getMessage(), ex);
      }
    }
  }

  private static void requireIds(Map<String, IrModel.Instruction> byId, Collection<String> ids, String referencedBy) {
    for (String id : ids) {
      if (!byId.containsKey(id)) {
        throw new ProgramValidationException(ErrorMessages.unknownInstruction(id, referencedBy));
      }
    }
  }

  private static void requireState(Map<String, IrModel.State> states, String name, String referencedBy) {
    if (name == null || !states.containsKey(name)) {
      throw new ProgramValidationException(ErrorMessages.unknownState(name, referencedBy));
    }
  }

  public IrModel.Instruction getInstruction(String id) {
    IrModel.Instruction insn = instructions.get(id);
    if (insn == null) {
      throw new ProgramValidationException(ErrorMessages.unknownInstruction(id, "lookup"));
    }
    return insn;
  }

  /** 指令在程序中的插入序号，用作就绪指令的决胜规则。 */
  public int orderOf(String id) {
    Integer idx = order.get(id);
    if (idx == null) {
      throw new ProgramValidationException(ErrorMessages.unknownInstruction(id, "lookup"));
    }
    return idx;
  }

  public Collection<IrModel.Instruction> getInstructions() {
    return instructions.values();
  }

  public Map<String, IrModel.State> getStates() {
    return states;
  }

  public IrModel.State getState(String name) {
    IrModel.State state = states.get(name);
    if (state == null) {
      throw new ProgramValidationException(ErrorMessages.unknownState(name, "lookup"));
    }
    return state;
  }

  public String getInitialState() {
    return initialState;
  }
}
