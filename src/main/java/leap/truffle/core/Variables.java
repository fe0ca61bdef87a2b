package leap.truffle.core;

/**
 * 变量标识符命名空间。
 *
 * <p>前缀决定变量的角色：符号种类推断、解释器的逐步清理以及代码生成器的全局/局部划分都依赖这些前缀。</p>
 */
public final class Variables {
  private Variables() {}

  public static final String TIME = "<t>";
  public static final String DT = "<dt>";

  public static final String RESERVED_PREFIX = "<";
  public static final String PERSISTENT_PREFIX = "<p>";
  public static final String STATE_PREFIX = "<state>";
  public static final String FUNC_PREFIX = "<func>";
  public static final String BUILTIN_PREFIX = "<builtin>";
  public static final String SOLVER_PREFIX = "<solver>";
  public static final String RET_PREFIX = "<ret";
  public static final String RET_TIME_PREFIX = "<ret_time>";
  public static final String RET_TIME_ID_PREFIX = "<ret_time_id>";
  public static final String RET_STATE_PREFIX = "<ret_state>";

  /**
   * 是否为全局（跨函数、由 leap_state 持有）的变量。
   */
  public static boolean isStateVariable(String name) {
    return TIME.equals(name) || DT.equals(name)
        || name.startsWith(PERSISTENT_PREFIX)
        || name.startsWith(STATE_PREFIX)
        || name.startsWith(RET_PREFIX);
  }

  /**
   * 是否在两个步之间保留（解释器每步结束后清除其余变量）。
   */
  public static boolean survivesStep(String name) {
    return TIME.equals(name) || DT.equals(name)
        || name.startsWith(PERSISTENT_PREFIX)
        || name.startsWith(STATE_PREFIX);
  }

  /**
   * {@code <state>y} 对应的 ODE 分量 id；非状态变量返回 null。
   */
  public static String stateComponentId(String name) {
    return name.startsWith(STATE_PREFIX) ? name.substring(STATE_PREFIX.length()) : null;
  }

  public static String state(String componentId) {
    return STATE_PREFIX + componentId;
  }

  public static String retTime(String componentId) {
    return RET_TIME_PREFIX + componentId;
  }

  public static String retTimeId(String componentId) {
    return RET_TIME_ID_PREFIX + componentId;
  }

  public static String retState(String componentId) {
    return RET_STATE_PREFIX + componentId;
  }
}
