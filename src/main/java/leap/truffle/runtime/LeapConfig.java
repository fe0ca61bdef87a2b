package leap.truffle.runtime;

import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import java.util.logging.Logger;

/**
 * Leap 运行时配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次，避免热路径中的 System.getenv 调用。
 */
public final class LeapConfig {
  private LeapConfig() {}

  /**
   * 调试模式开关
   * 环境变量：LEAP_TRUFFLE_DEBUG
   * 启用时控制器与节点经 java.util.logging 输出执行轨迹
   */
  @CompilationFinal
  public static final boolean DEBUG = System.getenv("LEAP_TRUFFLE_DEBUG") != null;

  /**
   * 性能分析模式开关
   * 环境变量：LEAP_TRUFFLE_PROFILE
   */
  @CompilationFinal
  public static final boolean PROFILE = System.getenv("LEAP_TRUFFLE_PROFILE") != null;

  /**
   * 生成的 Fortran 代码是否默认带 write(*,*) 跟踪语句
   * 环境变量：LEAP_CODEGEN_TRACE
   */
  public static final boolean CODEGEN_TRACE = System.getenv("LEAP_CODEGEN_TRACE") != null;

  /**
   * 生成代码的最大行宽
   * 环境变量：LEAP_FORTRAN_LINE_WIDTH，默认 80
   */
  public static final int FORTRAN_LINE_WIDTH = parseInt(getEnvOrDefault("LEAP_FORTRAN_LINE_WIDTH", "80"), 80);

  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }

  private static int parseInt(String value, int fallback) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      Logger.getLogger(LeapConfig.class.getName()).warning(
          "invalid integer setting '" + value + "', using " + fallback);
      return fallback;
    }
  }
}
