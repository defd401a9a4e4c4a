package io.spectr.shell.cli;

import io.spectr.markdown.api.Document;
import picocli.CommandLine;

@CommandLine.Command(
    name = "print",
    description = "Print a document exactly as parsed, or its syntax tree",
    mixinStandardHelpOptions = true)
public final class PrintCommand extends DocumentCommand {

  @CommandLine.Option(
      names = {"-t", "--tree"},
      description = "Print the syntax tree instead of the text")
  boolean tree;

  @Override
  int run(Document doc) {
    System.out.print(tree ? doc.dump() : doc.print());
    System.out.flush();
    return 0;
  }
}
