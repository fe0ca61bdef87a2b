package leap.truffle.compiled;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * shutdown() 之后仍未释放的缓冲区。泄漏不是致命错误，交由调用方判断。
 */
public final class BufferLeakReport {

  public record Leak(int bufferId, int refCount, int length) {}

  private final List<Leak> leaks;
  private final long allocationCount;
  private final long freeCount;

  BufferLeakReport(Collection<RefCountedBuffer> remaining, long allocationCount, long freeCount) {
    List<Leak> list = new ArrayList<>();
    for (RefCountedBuffer b : remaining) {
      list.add(new Leak(b.getId(), b.getRefCount(), b.length()));
    }
    this.leaks = List.copyOf(list);
    this.allocationCount = allocationCount;
    this.freeCount = freeCount;
  }

  public List<Leak> getLeaks() {
    return leaks;
  }

  public boolean isClean() {
    return leaks.isEmpty();
  }

  public long getAllocationCount() {
    return allocationCount;
  }

  public long getFreeCount() {
    return freeCount;
  }

  @Override
  public String toString() {
    return "BufferLeakReport[allocations=" + allocationCount + ", frees=" + freeCount + ", leaks=" + leaks + "]";
  }
}
