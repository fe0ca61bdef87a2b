package leap.truffle.codegen;

import leap.truffle.core.SymbolKind;
import leap.truffle.core.Variables;
import leap.truffle.runtime.ErrorMessages;
import leap.truffle.core.ProgramValidationException;
import java.util.*;

/**
 * 符号种类表：全局变量一张表，局部变量按所属函数各一张表。
 */
public final class SymbolKindTable {
  private final Map<String, SymbolKind> globalTable = new LinkedHashMap<>();
  private final Map<String, Map<String, SymbolKind>> perFunctionTable = new LinkedHashMap<>();

  /**
   * 记录种类。实标量可以升级为复标量，其他不一致视为错误。
   *
   * @return 表是否发生变化
   */
  public boolean set(String function, String name, SymbolKind kind) {
    Map<String, SymbolKind> table = tableFor(function, name);
    SymbolKind existing = table.get(name);
    if (existing == null) {
      table.put(name, kind);
      return true;
    }
    if (existing.equals(kind)) {
      return false;
    }
    if (existing.equals(SymbolKind.REAL) && kind.equals(SymbolKind.COMPLEX)) {
      table.put(name, kind);
      return true;
    }
    if (existing.equals(SymbolKind.COMPLEX) && kind.equals(SymbolKind.REAL)) {
      return false;
    }
    throw new ProgramValidationException(ErrorMessages.conflictingSymbolKind(name, existing, kind));
  }

  /** 未知时返回 null。 */
  public SymbolKind lookup(String function, String name) {
    return tableFor(function, name).get(name);
  }

  public SymbolKind get(String function, String name) {
    SymbolKind kind = lookup(function, name);
    if (kind == null) {
      throw new ProgramValidationException(ErrorMessages.unknownSymbolKind(name, String.valueOf(function)));
    }
    return kind;
  }

  public Map<String, SymbolKind> getGlobalTable() {
    return Collections.unmodifiableMap(globalTable);
  }

  public Map<String, SymbolKind> getFunctionTable(String function) {
    return Collections.unmodifiableMap(perFunctionTable.getOrDefault(function, Map.of()));
  }

  private Map<String, SymbolKind> tableFor(String function, String name) {
    if (Variables.isStateVariable(name)) {
      return globalTable;
    }
    return perFunctionTable.computeIfAbsent(function, f -> new LinkedHashMap<>());
  }

  /**
   * 出现过的全部 ODE 分量 id。
   */
  public Set<String> getOdeComponentIds() {
    Set<String> ids = new TreeSet<>();
    collectComponents(globalTable, ids);
    for (Map<String, SymbolKind> table : perFunctionTable.values()) {
      collectComponents(table, ids);
    }
    return ids;
  }

  private static void collectComponents(Map<String, SymbolKind> table, Set<String> out) {
    for (SymbolKind kind : table.values()) {
      if (kind instanceof SymbolKind.OdeComponent c) {
        out.add(c.getComponentId());
      }
    }
  }

  @Override
  public String toString() {
    return "global=" + globalTable + ", functions=" + perFunctionTable;
  }
}
