package leap.truffle.compiled;

/**
 * 变量位置：全局变量按名字存放在程序中，局部变量位于帧槽位。
 */
public final class SlotRef {
  private final String name;
  private final int index;

  private SlotRef(String name, int index) {
    this.name = name;
    this.index = index;
  }

  public static SlotRef global(String name) {
    return new SlotRef(name, -1);
  }

  public static SlotRef local(String name, int index) {
    return new SlotRef(name, index);
  }

  public String getName() {
    return name;
  }

  public boolean isGlobal() {
    return index < 0;
  }

  int getIndex() {
    return index;
  }

  @Override
  public String toString() {
    return isGlobal() ? "global[" + name + "]" : String.format("slot[%s -> %d]", name, index);
  }
}
