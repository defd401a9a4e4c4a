package io.spectr.shell.cli;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.spec.DeltaPlan;
import io.spectr.markdown.spec.RenameOp;
import io.spectr.markdown.spec.Requirement;
import io.spectr.markdown.spec.RequirementExtractor;
import picocli.CommandLine;

@CommandLine.Command(
    name = "delta",
    description = "Show the operations of a delta spec",
    mixinStandardHelpOptions = true)
public final class DeltaCommand extends DocumentCommand {

  @CommandLine.Option(names = "--json", description = "Print the delta plan as JSON")
  boolean json;

  @Override
  int run(Document doc) {
    DeltaPlan plan = RequirementExtractor.extractDelta(doc);
    if (json) {
      System.out.println(Json.GSON.toJson(plan));
      return 0;
    }
    if (!plan.hasDeltas()) {
      System.out.println("No delta operations");
      return 0;
    }
    for (Requirement r : plan.added()) {
      System.out.println("ADDED     " + r.name());
    }
    for (Requirement r : plan.modified()) {
      System.out.println("MODIFIED  " + r.name());
    }
    for (String name : plan.removed()) {
      System.out.println("REMOVED   " + name);
    }
    for (RenameOp op : plan.renamed()) {
      System.out.println("RENAMED   " + op.from() + " -> " + op.to());
    }
    System.out.println(plan.operationCount() + " operations");
    return 0;
  }
}
