package leap.truffle.codegen;

import java.util.List;
import java.util.Objects;

/**
 * ODE 分量的数值布局：目标语言基础类型加各维度的声明。
 *
 * 维度写法与 Fortran 一致，可以是长度 {@code "200"} 或上下界 {@code "-5:5"}。
 */
public final class ComponentLayout {
  private final String baseType;
  private final List<String> dimensions;

  public ComponentLayout(String baseType, List<String> dimensions) {
    this.baseType = Objects.requireNonNull(baseType, "baseType");
    this.dimensions = List.copyOf(dimensions);
  }

  public static ComponentLayout of(String baseType, String... dimensions) {
    return new ComponentLayout(baseType, List.of(dimensions));
  }

  public String getBaseType() {
    return baseType;
  }

  public List<String> getDimensions() {
    return dimensions;
  }

  /**
   * 元素总数，无维度时为 1。
   */
  public int size() {
    int size = 1;
    for (String dim : dimensions) {
      size *= extent(dim);
    }
    return size;
  }

  private static int extent(String dim) {
    String d = dim.trim();
    int colon = d.indexOf(':');
    try {
      if (colon < 0) {
        return Integer.parseInt(d);
      }
      int lower = Integer.parseInt(d.substring(0, colon).trim());
      int upper = Integer.parseInt(d.substring(colon + 1).trim());
      return upper - lower + 1;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("dimension is not a constant extent: " + dim, e);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ComponentLayout l && l.baseType.equals(baseType) && l.dimensions.equals(dimensions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(baseType, dimensions);
  }

  @Override
  public String toString() {
    return baseType + (dimensions.isEmpty() ? "" : "(" + String.join(",", dimensions) + ")");
  }
}
