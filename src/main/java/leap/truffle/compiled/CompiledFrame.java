package leap.truffle.compiled;

import leap.truffle.nodes.EvalScope;
import leap.truffle.runtime.ErrorMessages;
import leap.truffle.runtime.EvaluationException;
import leap.truffle.runtime.FunctionRegistry;
import java.util.HashMap;
import java.util.Map;

/**
 * 一次状态函数调用的帧：局部槽位加对程序全局变量的访问。
 *
 * 表达式读取 ODE 分量时得到缓冲区的底层数组，运算结果总是新数组，不会修改它。
 */
public final class CompiledFrame implements EvalScope {
  private final CompiledProgram program;
  private final Object[] locals;
  private final Map<String, Integer> slots;
  // 非结构区间的分派标签
  int label;

  CompiledFrame(CompiledProgram program, int slotCount, Map<String, Integer> slots) {
    this.program = program;
    this.locals = new Object[slotCount];
    this.slots = slots;
  }

  CompiledProgram program() {
    return program;
  }

  BufferHeap heap() {
    return program.getHeap();
  }

  Object get(SlotRef ref) {
    return ref.isGlobal() ? program.globals().get(ref.getName()) : locals[ref.getIndex()];
  }

  void set(SlotRef ref, Object value) {
    if (ref.isGlobal()) {
      if (value == null) {
        program.globals().remove(ref.getName());
      } else {
        program.globals().put(ref.getName(), value);
      }
    } else {
      locals[ref.getIndex()] = value;
    }
  }

  RefCountedBuffer getBuffer(SlotRef ref) {
    Object value = get(ref);
    if (value != null && !(value instanceof RefCountedBuffer)) {
      throw new EvaluationException(ErrorMessages.typeExpectedGot("ODE component", value.getClass().getSimpleName()));
    }
    return (RefCountedBuffer) value;
  }

  @Override
  public Object read(String name) {
    Integer index = slots.get(name);
    Object value = index != null ? locals[index] : program.globals().get(name);
    if (value == null) {
      throw new EvaluationException(ErrorMessages.variableNotInitialized(name));
    }
    return value instanceof RefCountedBuffer buffer ? buffer.getData() : value;
  }

  @Override
  public FunctionRegistry functions() {
    return program.getFunctions();
  }

  /**
   * 当前可见变量的快照（求解器使用），ODE 分量为数组副本。
   */
  Map<String, Object> snapshot() {
    Map<String, Object> result = new HashMap<>();
    for (Map.Entry<String, Object> e : program.globals().entrySet()) {
      result.put(e.getKey(), unwrap(e.getValue()));
    }
    for (Map.Entry<String, Integer> e : slots.entrySet()) {
      Object value = locals[e.getValue()];
      if (value != null) {
        result.put(e.getKey(), unwrap(value));
      }
    }
    return result;
  }

  private static Object unwrap(Object value) {
    return value instanceof RefCountedBuffer buffer ? buffer.getData().clone() : value;
  }
}
