package io.spectr.shell.tasks;

/** Raised when a task status file cannot be read or does not have the expected shape. */
public class TaskStoreException extends Exception {
  public TaskStoreException(String message) {
    super(message);
  }

  public TaskStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
