package cfd.analyzer.search;

import java.util.Comparator;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * Pending states, smallest distance first; equal distances leave in insertion order. Offers are
 * dropped once the queue holds more than {@code maxLength} states.
 */
public final class Frontier<P> {

  private final PriorityQueue<Entry<P>> queue = new PriorityQueue<>(
    Comparator
      .<Entry<P>>comparingInt(e -> e.state().distance())
      .thenComparingLong(Entry::sequence)
  );
  private final int maxLength;
  private long nextSequence;
  private int peakSize;

  public Frontier(int maxLength) {
    this.maxLength = maxLength;
  }

  /** @return false if the state was dropped because the frontier is full */
  public boolean offer(SearchState<P> state) {
    if (queue.size() > maxLength) return false;
    queue.add(new Entry<>(state, nextSequence++));
    peakSize = Math.max(peakSize, queue.size());
    return true;
  }

  public SearchState<P> peek() {
    Entry<P> e = queue.peek();
    if (e == null) throw new NoSuchElementException("frontier is empty");
    return e.state();
  }

  public SearchState<P> poll() {
    Entry<P> e = queue.poll();
    if (e == null) throw new NoSuchElementException("frontier is empty");
    return e.state();
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  public int size() {
    return queue.size();
  }

  public int peakSize() {
    return peakSize;
  }

  private record Entry<P>(SearchState<P> state, long sequence) {}
}
