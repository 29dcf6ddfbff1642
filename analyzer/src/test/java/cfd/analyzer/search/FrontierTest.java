package cfd.analyzer.search;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class FrontierTest {

  private static SearchState<String> state(String p, int d) {
    return new SearchState<>(p, d, CallStack.empty());
  }

  @Test
  void pollsSmallestDistanceFirst() {
    Frontier<String> f = new Frontier<>(10);
    f.offer(state("far", 5));
    f.offer(state("near", 1));
    f.offer(state("mid", 3));

    assertEquals("near", f.poll().position());
    assertEquals("mid", f.poll().position());
    assertEquals("far", f.poll().position());
    assertTrue(f.isEmpty());
  }

  @Test
  void equalDistancesLeaveInInsertionOrder() {
    Frontier<String> f = new Frontier<>(10);
    f.offer(state("first", 2));
    f.offer(state("second", 2));
    f.offer(state("zero", 0));
    f.offer(state("third", 2));

    assertEquals("zero", f.poll().position());
    assertEquals("first", f.poll().position());
    assertEquals("second", f.poll().position());
    assertEquals("third", f.poll().position());
  }

  @Test
  void dropsOffersOnceMoreThanMaxLengthArePending() {
    Frontier<String> f = new Frontier<>(2);

    assertTrue(f.offer(state("a", 0)));
    assertTrue(f.offer(state("b", 0)));
    assertTrue(f.offer(state("c", 0)));
    assertFalse(f.offer(state("d", 0)));
    assertEquals(3, f.size());
    assertEquals(3, f.peakSize());
  }
}
