package cfd.analyzer.graph;

/**
 * A {@link ProgramGraph} broke one of its own invariants (a position outside its block, a position
 * without a kind, a fall-through off the end of a block). Aborts the search.
 */
public class MalformedGraphException extends RuntimeException {

  public MalformedGraphException(String message) {
    super(message);
  }

  public MalformedGraphException(String message, Throwable cause) {
    super(message, cause);
  }
}
