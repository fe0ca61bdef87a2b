package leap.truffle.compiled;

/**
 * 带引用计数的数值缓冲区。
 *
 * 别名变量共享同一个实例，因此共享同一个计数。交换赋值可以替换底层数组而保留计数。
 */
public final class RefCountedBuffer {
  private final int id;
  private double[] data;
  private int refCount = 1;
  private boolean freed;

  RefCountedBuffer(int id, double[] data) {
    this.id = id;
    this.data = data;
  }

  public int getId() {
    return id;
  }

  public double[] getData() {
    return data;
  }

  public int length() {
    return data.length;
  }

  public int getRefCount() {
    return refCount;
  }

  public boolean isFreed() {
    return freed;
  }

  public int retain() {
    checkLive();
    return ++refCount;
  }

  public int release() {
    checkLive();
    if (refCount <= 0) {
      throw new IllegalStateException("refcount underflow on buffer #" + id);
    }
    return --refCount;
  }

  void setData(double[] data) {
    checkLive();
    this.data = data;
  }

  void markFreed() {
    freed = true;
    refCount = 0;
  }

  private void checkLive() {
    if (freed) {
      throw new IllegalStateException("use of freed buffer #" + id);
    }
  }

  @Override
  public String toString() {
    return "buffer#" + id + "[len=" + data.length + ", refcnt=" + refCount + (freed ? ", freed" : "") + "]";
  }
}
