package leap.truffle.compiled;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 局部变量槽位分配器，管理变量名到槽位索引的映射。
 *
 * 每个状态函数一个实例，按声明顺序分配。
 */
public final class SlotAllocator {
  private final Map<String, Integer> variableToSlot = new LinkedHashMap<>();
  private int nextSlotIndex = 0;

  /**
   * 为局部变量分配槽位
   */
  public int addLocal(String name) {
    if (variableToSlot.containsKey(name)) {
      throw new IllegalStateException("Duplicate variable: " + name);
    }
    int slotIndex = nextSlotIndex++;
    variableToSlot.put(name, slotIndex);
    return slotIndex;
  }

  /**
   * 获取变量的槽位索引
   */
  public int getSlotIndex(String name) {
    Integer index = variableToSlot.get(name);
    if (index == null) {
      throw new IllegalArgumentException("Unknown variable: " + name);
    }
    return index;
  }

  public boolean hasVariable(String name) {
    return variableToSlot.containsKey(name);
  }

  /**
   * 获取符号表（只读副本）
   */
  public Map<String, Integer> getSymbolTable() {
    return Map.copyOf(variableToSlot);
  }

  public int getSlotCount() {
    return nextSlotIndex;
  }
}
