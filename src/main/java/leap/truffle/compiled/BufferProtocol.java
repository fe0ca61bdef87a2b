package leap.truffle.compiled;

/**
 * ODE 分量变量的内存协议。每个操作返回变量赋值后应持有的缓冲区。
 */
public final class BufferProtocol {
  private BufferProtocol() {}

  /**
   * 别名赋值 {@code a = b}：先释放 a 原有的引用，再共享 b 的缓冲区。
   */
  public static RefCountedBuffer alias(BufferHeap heap, RefCountedBuffer target, RefCountedBuffer source) {
    if (target == source) {
      return target;
    }
    deinit(heap, target);
    source.retain();
    return source;
  }

  /**
   * 保证变量独占一个缓冲区：未关联时分配；被共享时放弃共享引用并重新分配。
   */
  public static RefCountedBuffer ensureUnique(BufferHeap heap, RefCountedBuffer current, int size) {
    if (current == null) {
      return heap.allocate(size);
    }
    if (current.getRefCount() != 1) {
      current.release();
      return heap.allocate(size);
    }
    return current;
  }

  /**
   * 自引用赋值的收尾：结果已写入临时数组 temp。
   * 独占时原地替换数组并沿用计数，共享时放弃旧引用并把 temp 包装为新缓冲区。
   */
  public static RefCountedBuffer swapIn(BufferHeap heap, RefCountedBuffer current, double[] temp) {
    if (current != null && current.getRefCount() == 1) {
      heap.replaceData(current, temp);
      return current;
    }
    if (current != null) {
      current.release();
    }
    return heap.adopt(temp);
  }

  /**
   * 释放变量持有的引用，计数归零时释放缓冲区。变量此后不再关联。
   */
  public static RefCountedBuffer deinit(BufferHeap heap, RefCountedBuffer current) {
    if (current == null) {
      return null;
    }
    if (current.getRefCount() == 1) {
      heap.free(current);
    } else {
      current.release();
    }
    return null;
  }
}
