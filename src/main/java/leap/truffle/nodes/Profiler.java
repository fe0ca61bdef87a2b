package leap.truffle.nodes;

import leap.truffle.runtime.LeapConfig;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 节点执行计数器，LEAP_TRUFFLE_PROFILE 或 -Dleap.profiler.enabled=true 时启用。
 */
public final class Profiler {
  private static final Map<String, Long> COUNTERS = new ConcurrentHashMap<>();
  private static final boolean ENABLED = LeapConfig.PROFILE || Boolean.getBoolean("leap.profiler.enabled");
  private Profiler() {}
  public static void inc(String key) {
    if (!ENABLED) {
      return;
    }
    COUNTERS.merge(key, 1L, Long::sum);
    COUNTERS.merge("total", 1L, Long::sum);
  }
  /**
   * 按计数器名排序输出，便于比较解释执行与编译执行的节点访问量。
   */
  public static String dump() {
    if (!ENABLED) {
      return "Leap node profile disabled";
    }
    var sb = new StringBuilder();
    sb.append("Leap node profile (counts):\n");
    new java.util.TreeMap<>(COUNTERS).forEach((k, v) -> sb.append("  ").append(k).append(" = ").append(v).append('\n'));
    return sb.toString();
  }
}
