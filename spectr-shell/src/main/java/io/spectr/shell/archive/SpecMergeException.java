package io.spectr.shell.archive;

/** Raised when a delta cannot be applied to a spec. */
public class SpecMergeException extends Exception {
  public SpecMergeException(String message) {
    super(message);
  }

  public SpecMergeException(String message, Throwable cause) {
    super(message, cause);
  }
}
