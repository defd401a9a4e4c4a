package io.spectr.shell.validation;

/**
 * A problem found in a spec or delta spec.
 *
 * @param level severity
 * @param message what is wrong
 * @param line 1-based line the problem is reported at
 */
public record ValidationIssue(Level level, String message, int line) {

  public enum Level {
    ERROR,
    WARNING
  }

  static ValidationIssue error(String message, int line) {
    return new ValidationIssue(Level.ERROR, message, line);
  }

  static ValidationIssue warning(String message, int line) {
    return new ValidationIssue(Level.WARNING, message, line);
  }

  ValidationIssue asError() {
    return level == Level.ERROR ? this : new ValidationIssue(Level.ERROR, message, line);
  }

  @Override
  public String toString() {
    return level + " line " + line + ": " + message;
  }
}
