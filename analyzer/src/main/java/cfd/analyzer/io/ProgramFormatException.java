package cfd.analyzer.io;

/** A program description file could not be turned into a program. */
public class ProgramFormatException extends Exception {

  public ProgramFormatException(String message) {
    super(message);
  }

  public ProgramFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
