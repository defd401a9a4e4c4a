package io.spectr.shell.validation;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.NodeHandle;
import io.spectr.markdown.api.NodeKind;
import io.spectr.markdown.spec.DeltaPlan;
import io.spectr.markdown.spec.RenameOp;
import io.spectr.markdown.spec.Requirement;
import io.spectr.markdown.spec.RequirementExtractor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks specs and delta specs for the problems that would make them unusable or a merge
 * lossy.
 *
 * <p>For a spec: a {@code ## Requirements} section must exist; each requirement should state
 * SHALL or MUST and should have at least one {@code #### Scenario:}; scenario headers at the
 * wrong level or written in bold are errors.
 *
 * <p>For a delta: it must contain at least one operation; ADDED and MODIFIED requirements need a
 * scenario and must not repeat a name; against a base spec, MODIFIED, REMOVED and renamed
 * requirements must exist and ADDED ones must not, unless the same delta removes or renames
 * them away. Without a base spec only ADDED is allowed.
 *
 * <p>In strict mode warnings are reported as errors.
 */
public final class DeltaValidator {
  private static final Logger log = LoggerFactory.getLogger(DeltaValidator.class);

  private static final Pattern NORMATIVE =
      Pattern.compile("\\b(shall|must)\\b", Pattern.CASE_INSENSITIVE);
  private static final String[] MALFORMED_SCENARIOS = {
    "### Scenario:", "##### Scenario:", "###### Scenario:", "**Scenario:"
  };

  private final boolean strict;

  public DeltaValidator(boolean strict) {
    this.strict = strict;
  }

  public DeltaValidator() {
    this(false);
  }

  public ValidationReport validateSpec(Document spec) {
    List<ValidationIssue> issues = new ArrayList<>();
    NodeHandle section = requirementsSection(spec);
    if (section == null) {
      issues.add(ValidationIssue.error("Missing required '## Requirements' section", 1));
    } else {
      for (Requirement r : RequirementExtractor.extractRequirements(spec)) {
        if (r.line() > section.line()) {
          checkRequirement(r, "Requirement '" + r.name() + "'", issues);
        }
      }
    }
    return report(issues);
  }

  /**
   * Validates a delta spec.
   *
   * @param delta the delta spec
   * @param base the spec the delta applies to, or {@code null} when it creates a new spec
   */
  public ValidationReport validateDelta(Document delta, Document base) {
    List<ValidationIssue> issues = new ArrayList<>();
    DeltaPlan plan = RequirementExtractor.extractDelta(delta);
    if (!plan.hasDeltas()) {
      issues.add(
          ValidationIssue.error(
              "Delta spec has no operations; expected ## ADDED, MODIFIED, REMOVED or RENAMED"
                  + " Requirements sections",
              1));
      return report(issues);
    }
    checkUnique(plan.added(), "ADDED", issues);
    checkUnique(plan.modified(), "MODIFIED", issues);
    for (Requirement r : plan.added()) {
      checkRequirement(r, "ADDED requirement '" + r.name() + "'", issues);
    }
    for (Requirement r : plan.modified()) {
      checkRequirement(r, "MODIFIED requirement '" + r.name() + "'", issues);
    }
    if (base == null) {
      checkNewSpec(delta, plan, issues);
    } else {
      checkAgainstBase(delta, plan, base, issues);
    }
    return report(issues);
  }

  private void checkRequirement(Requirement r, String label, List<ValidationIssue> issues) {
    if (!NORMATIVE.matcher(r.rawText()).find()) {
      issues.add(
          ValidationIssue.warning(
              label + " should contain SHALL or MUST to indicate a normative requirement",
              r.line()));
    }
    if (r.scenarios().isEmpty()) {
      int malformed = malformedScenarioLine(r);
      if (malformed > 0) {
        issues.add(
            ValidationIssue.error(
                label + ": scenarios must use '#### Scenario:' headers (4 hashtags)", malformed));
      } else {
        issues.add(ValidationIssue.warning(label + " should have at least one scenario", r.line()));
      }
    }
  }

  // 0 when the requirement has no scenario-like line in the wrong form
  private static int malformedScenarioLine(Requirement r) {
    String[] lines = r.rawText().split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].strip();
      for (String pattern : MALFORMED_SCENARIOS) {
        if (line.contains(pattern)) {
          return r.line() + i;
        }
      }
    }
    return 0;
  }

  private static void checkUnique(
      List<Requirement> requirements, String section, List<ValidationIssue> issues) {
    Set<String> seen = new HashSet<>();
    for (Requirement r : requirements) {
      if (!seen.add(r.normalizedName())) {
        issues.add(
            ValidationIssue.error(
                "Duplicate " + section + " requirement '" + r.name() + "'", r.line()));
      }
    }
  }

  private static void checkNewSpec(Document delta, DeltaPlan plan, List<ValidationIssue> issues) {
    for (Requirement r : plan.modified()) {
      issues.add(
          ValidationIssue.error(
              "MODIFIED requirement '" + r.name() + "' targets a spec that does not exist",
              r.line()));
    }
    for (String name : plan.removed()) {
      issues.add(
          ValidationIssue.error(
              "REMOVED requirement '" + name + "' targets a spec that does not exist",
              headerLine(delta, name)));
    }
    for (RenameOp op : plan.renamed()) {
      issues.add(
          ValidationIssue.error(
              "RENAMED requirement '" + op.from() + "' targets a spec that does not exist",
              renameLine(delta, op.from())));
    }
  }

  private static void checkAgainstBase(
      Document delta, DeltaPlan plan, Document base, List<ValidationIssue> issues) {
    Set<String> existing = new HashSet<>();
    for (Requirement r : RequirementExtractor.extractRequirements(base)) {
      existing.add(r.normalizedName());
    }
    Set<String> freed = new HashSet<>();
    for (RenameOp op : plan.renamed()) {
      String from = Requirement.normalize(op.from());
      if (!existing.contains(from)) {
        issues.add(
            ValidationIssue.error(
                "RENAMED requirement '" + op.from() + "' does not exist in the base spec",
                renameLine(delta, op.from())));
      }
      freed.add(from);
    }
    for (String name : plan.removed()) {
      String normalized = Requirement.normalize(name);
      if (!existing.contains(normalized)) {
        issues.add(
            ValidationIssue.error(
                "REMOVED requirement '" + name + "' does not exist in the base spec",
                headerLine(delta, name)));
      }
      freed.add(normalized);
    }
    Set<String> renamedTo = new HashSet<>();
    for (RenameOp op : plan.renamed()) {
      renamedTo.add(Requirement.normalize(op.to()));
    }
    for (Requirement r : plan.modified()) {
      if (!existing.contains(r.normalizedName()) && !renamedTo.contains(r.normalizedName())) {
        issues.add(
            ValidationIssue.error(
                "MODIFIED requirement '" + r.name() + "' does not exist in the base spec",
                r.line()));
      }
    }
    for (Requirement r : plan.added()) {
      if (existing.contains(r.normalizedName()) && !freed.contains(r.normalizedName())) {
        issues.add(
            ValidationIssue.error(
                "ADDED requirement '" + r.name() + "' already exists in the base spec", r.line()));
      }
    }
  }

  private static NodeHandle requirementsSection(Document doc) {
    for (NodeHandle block : doc.root().contentChildren()) {
      if (block.kind() == NodeKind.HEADER
          && block.level() == 2
          && "Requirements".equals(block.text().strip())) {
        return block;
      }
    }
    return null;
  }

  private static int headerLine(Document doc, String name) {
    String wanted = Requirement.normalize(name);
    for (NodeHandle h : doc.query("h3")) {
      String text = h.text().strip();
      if (text.startsWith("Requirement:")
          && Requirement.normalize(text.substring("Requirement:".length())).equals(wanted)) {
        return h.line();
      }
    }
    return 1;
  }

  private static int renameLine(Document doc, String from) {
    String wanted = from.toLowerCase(Locale.ROOT);
    for (NodeHandle item : doc.query("item")) {
      String text = item.text().toLowerCase(Locale.ROOT);
      if (text.contains("from:") && text.contains(wanted)) {
        return item.line();
      }
    }
    return 1;
  }

  private ValidationReport report(List<ValidationIssue> issues) {
    if (strict) {
      issues.replaceAll(ValidationIssue::asError);
    }
    ValidationReport report = new ValidationReport(issues);
    log.debug(
        "Validation found {} errors and {} warnings",
        report.errorCount(),
        report.warningCount());
    return report;
  }
}
