package leap.truffle.compiled;

import java.util.*;
import java.util.logging.Logger;

/**
 * 缓冲区堆：分配与释放底层数组并计数，检测重复释放。
 *
 * 数组和缓冲区分开跟踪：交换赋值先分配临时数组，再把它接入已有缓冲区或包装为新缓冲区。
 */
public final class BufferHeap {
  private static final Logger logger = Logger.getLogger(BufferHeap.class.getName());

  private final Map<Integer, RefCountedBuffer> liveBuffers = new LinkedHashMap<>();
  private final Set<double[]> liveData = Collections.newSetFromMap(new IdentityHashMap<>());
  private int nextId;
  private long allocationCount;
  private long freeCount;

  /**
   * 分配一块尚未被缓冲区持有的数组。
   */
  public double[] allocateData(int size) {
    double[] data = new double[size];
    liveData.add(data);
    allocationCount++;
    return data;
  }

  public RefCountedBuffer allocate(int size) {
    return adopt(allocateData(size));
  }

  /**
   * 把由本堆分配的数组包装为引用计数为 1 的新缓冲区。
   */
  public RefCountedBuffer adopt(double[] data) {
    if (!liveData.contains(data)) {
      throw new IllegalStateException("array was not allocated by this heap");
    }
    RefCountedBuffer buffer = new RefCountedBuffer(nextId++, data);
    liveBuffers.put(buffer.getId(), buffer);
    logger.finest(() -> "allocated " + buffer);
    return buffer;
  }

  /**
   * 释放缓冲区当前的数组并换成 data，引用计数不变。
   */
  public void replaceData(RefCountedBuffer buffer, double[] data) {
    if (!liveData.contains(data)) {
      throw new IllegalStateException("array was not allocated by this heap");
    }
    freeData(buffer.getData());
    buffer.setData(data);
  }

  public void free(RefCountedBuffer buffer) {
    if (buffer.isFreed() || liveBuffers.remove(buffer.getId()) == null) {
      throw new IllegalStateException("double free of buffer #" + buffer.getId());
    }
    freeData(buffer.getData());
    buffer.markFreed();
    logger.finest(() -> "freed buffer#" + buffer.getId());
  }

  private void freeData(double[] data) {
    if (!liveData.remove(data)) {
      throw new IllegalStateException("double free of array");
    }
    freeCount++;
  }

  public Collection<RefCountedBuffer> getLiveBuffers() {
    return Collections.unmodifiableCollection(liveBuffers.values());
  }

  public int getLiveArrayCount() {
    return liveData.size();
  }

  public long getAllocationCount() {
    return allocationCount;
  }

  public long getFreeCount() {
    return freeCount;
  }
}
