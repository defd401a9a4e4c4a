package io.spectr.shell.cli;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.EncodingException;
import io.spectr.markdown.api.Markdown;
import io.spectr.shell.validation.DeltaValidator;
import io.spectr.shell.validation.ValidationIssue;
import io.spectr.shell.validation.ValidationReport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;

/** Exits with 2 when the document has errors. */
@CommandLine.Command(
    name = "validate",
    description = "Check a spec, or a delta spec with --delta",
    mixinStandardHelpOptions = true)
public final class ValidateCommand extends DocumentCommand {

  static final int INVALID = 2;

  @CommandLine.Option(names = "--delta", description = "Validate FILE as a delta spec")
  boolean delta;

  @CommandLine.Option(
      names = {"-b", "--base"},
      paramLabel = "SPEC",
      description = "Spec the delta applies to; when missing the delta must only add")
  Path base;

  @CommandLine.Option(names = "--strict", description = "Report warnings as errors")
  boolean strict;

  @CommandLine.Option(names = "--json", description = "Print the report as JSON")
  boolean json;

  @Override
  int run(Document doc) throws IOException {
    DeltaValidator validator = new DeltaValidator(strict);
    ValidationReport report;
    if (delta || base != null) {
      Document baseDoc = null;
      if (base != null && Files.exists(base)) {
        try {
          baseDoc = Markdown.read(base);
        } catch (EncodingException e) {
          throw new IOException(base + " is not valid UTF-8: " + e.getMessage(), e);
        }
      }
      report = validator.validateDelta(doc, baseDoc);
    } else {
      report = validator.validateSpec(doc);
    }
    if (json) {
      System.out.println(Json.GSON.toJson(report));
    } else {
      for (ValidationIssue issue : report.issues()) {
        System.out.println(file + ":" + issue.line() + ": " + issue.level() + ": " + issue.message());
      }
      System.out.println(
          report.valid()
              ? file + " is valid"
              : file + " has " + report.errorCount() + " errors");
    }
    return report.valid() ? 0 : INVALID;
  }
}
