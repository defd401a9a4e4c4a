package io.spectr.shell.cli;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.spec.Requirement;
import io.spectr.markdown.spec.RequirementExtractor;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(
    name = "requirements",
    description = "List the requirements of a spec",
    mixinStandardHelpOptions = true)
public final class RequirementsCommand extends DocumentCommand {

  @CommandLine.Option(names = "--json", description = "Print requirements as JSON")
  boolean json;

  @Override
  int run(Document doc) {
    List<Requirement> requirements = RequirementExtractor.extractRequirements(doc);
    if (json) {
      System.out.println(Json.GSON.toJson(requirements));
      return 0;
    }
    for (Requirement r : requirements) {
      System.out.println(r.line() + ": " + r.name() + " (" + scenarios(r.scenarios().size()) + ")");
      for (String scenario : r.scenarios()) {
        System.out.println("    - " + scenario);
      }
    }
    System.out.println(requirements.size() + " requirements");
    return 0;
  }

  private static String scenarios(int n) {
    return n == 1 ? "1 scenario" : n + " scenarios";
  }
}
