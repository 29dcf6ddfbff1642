package cfd.analyzer.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Persistent LIFO stack of {@link StackEntry}. {@link #push} and {@link #pop} return new stacks
 * sharing their tail with the receiver, so sibling search states can hold the same stack without
 * affecting each other. Equality and hash are structural over the whole sequence.
 */
public final class CallStack<P> implements Iterable<StackEntry<P>> {

  private static final CallStack<?> EMPTY = new CallStack<>(null, null);

  private final StackEntry<P> top;
  private final CallStack<P> rest;
  private final int size;
  private final int hash;

  private CallStack(StackEntry<P> top, CallStack<P> rest) {
    this.top = top;
    this.rest = rest;
    this.size = rest == null ? 0 : rest.size + 1;
    this.hash = rest == null ? 1 : 31 * rest.hash + top.hashCode();
  }

  @SuppressWarnings("unchecked")
  public static <P> CallStack<P> empty() {
    return (CallStack<P>) EMPTY;
  }

  /** Stack built from call positions listed outermost first; the last one ends up on top. */
  public static <P> CallStack<P> of(List<P> callsOutermostFirst) {
    CallStack<P> stack = empty();
    for (P call : callsOutermostFirst) {
      stack = stack.push(new StackEntry<>(call));
    }
    return stack;
  }

  public CallStack<P> push(StackEntry<P> entry) {
    return new CallStack<>(Objects.requireNonNull(entry, "entry"), this);
  }

  public CallStack<P> pop() {
    if (isEmpty()) throw new NoSuchElementException("pop on empty call stack");
    return rest;
  }

  public StackEntry<P> top() {
    if (isEmpty()) throw new NoSuchElementException("top of empty call stack");
    return top;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public int size() {
    return size;
  }

  /** Iterates from the top (innermost call) down to the outermost call. */
  @Override
  public Iterator<StackEntry<P>> iterator() {
    return new Iterator<>() {
      private CallStack<P> cursor = CallStack.this;

      @Override
      public boolean hasNext() {
        return !cursor.isEmpty();
      }

      @Override
      public StackEntry<P> next() {
        if (cursor.isEmpty()) throw new NoSuchElementException();
        StackEntry<P> e = cursor.top;
        cursor = cursor.rest;
        return e;
      }
    };
  }

  /** Call positions, outermost first (the order accepted by {@link #of}). */
  public List<P> calls() {
    List<P> out = new ArrayList<>(size);
    for (StackEntry<P> e : this) out.add(e.call());
    Collections.reverse(out);
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CallStack)) return false;
    CallStack<?> a = this;
    CallStack<?> b = (CallStack<?>) o;
    if (a.size != b.size || a.hash != b.hash) return false;
    while (!a.isEmpty()) {
      if (a == b) return true;
      if (!a.top.equals(b.top)) return false;
      a = a.rest;
      b = b.rest;
    }
    return true;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return calls().toString();
  }
}
