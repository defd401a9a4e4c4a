package io.spectr.shell.cli;

import io.spectr.markdown.api.Document;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import picocli.CommandLine;

@CommandLine.Command(
    name = "format",
    description = "Print a document in canonical form",
    mixinStandardHelpOptions = true)
public final class FormatCommand extends DocumentCommand {

  @CommandLine.Option(
      names = {"-w", "--write"},
      description = "Rewrite the file instead of printing")
  boolean write;

  @Override
  int run(Document doc) throws IOException {
    String formatted = doc.printNormalized();
    if (write) {
      Files.write(file, formatted.getBytes(StandardCharsets.UTF_8));
    } else {
      System.out.print(formatted);
      System.out.flush();
    }
    return 0;
  }
}
