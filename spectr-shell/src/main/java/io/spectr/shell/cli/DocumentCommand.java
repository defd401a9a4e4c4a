package io.spectr.shell.cli;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.EncodingException;
import io.spectr.markdown.api.Markdown;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

/** Base for commands that operate on one markdown file. */
abstract class DocumentCommand implements Callable<Integer> {

  @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Markdown file")
  Path file;

  @Override
  public Integer call() {
    if (!Files.isRegularFile(file)) {
      System.err.println("Error: File not found: " + file);
      return 1;
    }
    Document doc;
    try {
      doc = Markdown.read(file);
    } catch (EncodingException e) {
      System.err.println("Error: " + file + " is not valid UTF-8: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      System.err.println("Error: Failed to read " + file + ": " + e.getMessage());
      return 1;
    }
    try {
      return run(doc);
    } catch (IOException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  abstract int run(Document doc) throws IOException;
}
