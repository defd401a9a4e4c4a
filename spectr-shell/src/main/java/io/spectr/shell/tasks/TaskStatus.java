package io.spectr.shell.tasks;

/** Status of a task as recorded in {@code tasks.jsonc}. */
public enum TaskStatus {
  PENDING("pending"),
  IN_PROGRESS("in_progress"),
  COMPLETED("completed");

  private final String value;

  TaskStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Whether a task in this status has a checked box in {@code tasks.md}. */
  public boolean checked() {
    return this == COMPLETED;
  }

  /** Returns the status written as {@code value}, or {@code null} when it is unknown. */
  public static TaskStatus of(String value) {
    for (TaskStatus s : values()) {
      if (s.value.equals(value)) {
        return s;
      }
    }
    return null;
  }
}
