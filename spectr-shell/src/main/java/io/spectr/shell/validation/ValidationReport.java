package io.spectr.shell.validation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Issues found by a validation run, ordered by line. */
public record ValidationReport(List<ValidationIssue> issues) {

  public ValidationReport {
    List<ValidationIssue> sorted = new ArrayList<>(issues);
    sorted.sort(Comparator.comparingInt(ValidationIssue::line));
    issues = List.copyOf(sorted);
  }

  /** Whether no issue is an error. */
  public boolean valid() {
    return errorCount() == 0;
  }

  public long errorCount() {
    return issues.stream().filter(i -> i.level() == ValidationIssue.Level.ERROR).count();
  }

  public long warningCount() {
    return issues.stream().filter(i -> i.level() == ValidationIssue.Level.WARNING).count();
  }
}
