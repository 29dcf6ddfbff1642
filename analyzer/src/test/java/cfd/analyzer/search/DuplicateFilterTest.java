package cfd.analyzer.search;

import static org.junit.jupiter.api.Assertions.*;

import cfd.analyzer.program.Instruction;
import cfd.analyzer.program.Program;
import org.junit.jupiter.api.Test;

class DuplicateFilterTest {

  private final Program program = TestPrograms.callAndReturn();
  private final DuplicateFilter<Instruction> filter = new DuplicateFilter<>(program.graph());

  private SearchState<Instruction> state(String ref, int distance, CallStack<Instruction> stack) {
    return new SearchState<>(program.position(ref), distance, stack);
  }

  @Test
  void blockEntryIsRememberedRegardlessOfDistance() {
    filter.markSeen(state("helper:entry:0", 2, CallStack.empty()));

    assertTrue(filter.wasSeen(state("helper:entry:0", 7, CallStack.empty())));
    assertEquals(1, filter.size());
  }

  @Test
  void differentStackIsANewState() {
    Instruction call = program.position("main:entry:1");
    filter.markSeen(state("helper:entry:0", 2, CallStack.empty()));

    CallStack<Instruction> withCall = CallStack.<Instruction>empty().push(new StackEntry<>(call));
    assertFalse(filter.wasSeen(state("helper:entry:0", 2, withCall)));
  }

  @Test
  void positionsInsideABlockAreNotTracked() {
    filter.markSeen(state("helper:entry:1", 3, CallStack.empty()));

    assertFalse(filter.wasSeen(state("helper:entry:1", 3, CallStack.empty())));
    assertEquals(0, filter.size());
  }
}
