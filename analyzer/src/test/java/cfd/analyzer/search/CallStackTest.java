package cfd.analyzer.search;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class CallStackTest {

  @Test
  void pushLeavesOriginalUntouched() {
    CallStack<String> base = CallStack.<String>empty().push(new StackEntry<>("a"));
    CallStack<String> left = base.push(new StackEntry<>("b"));
    CallStack<String> right = base.push(new StackEntry<>("c"));

    assertEquals(1, base.size());
    assertEquals("b", left.top().call());
    assertEquals("c", right.top().call());
    assertEquals(base, left.pop());
    assertEquals(base, right.pop());
  }

  @Test
  void ofPutsLastCallOnTop() {
    CallStack<String> stack = CallStack.of(List.of("outer", "middle", "inner"));

    assertEquals("inner", stack.top().call());
    assertEquals(List.of("outer", "middle", "inner"), stack.calls());
  }

  @Test
  void equalityIsStructural() {
    CallStack<String> a = CallStack.of(List.of("x", "y"));
    CallStack<String> b = CallStack
      .<String>empty()
      .push(new StackEntry<>("x"))
      .push(new StackEntry<>("y"));

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, CallStack.of(List.of("y", "x")));
    assertNotEquals(a, CallStack.of(List.of("x")));
  }

  @Test
  void emptyStackRejectsPopAndTop() {
    CallStack<String> empty = CallStack.empty();

    assertTrue(empty.isEmpty());
    assertThrows(NoSuchElementException.class, empty::pop);
    assertThrows(NoSuchElementException.class, empty::top);
  }

  @Test
  void iteratesFromTopDown() {
    CallStack<String> stack = CallStack.of(List.of("a", "b", "c"));
    StringBuilder order = new StringBuilder();
    for (StackEntry<String> e : stack) order.append(e.call());

    assertEquals("cba", order.toString());
  }
}
