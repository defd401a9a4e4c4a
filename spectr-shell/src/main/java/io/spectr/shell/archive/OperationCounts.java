package io.spectr.shell.archive;

/** Number of delta operations of each kind that took effect in a merge. */
public record OperationCounts(int added, int modified, int removed, int renamed) {

  public int total() {
    return added + modified + removed + renamed;
  }
}
