package io.spectr.shell.cli;

import io.spectr.shell.archive.MergeResult;
import io.spectr.shell.archive.OperationCounts;
import io.spectr.shell.archive.SpecMergeException;
import io.spectr.shell.archive.SpecMerger;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "merge",
    description = "Apply a delta spec to a spec; a missing spec is created",
    mixinStandardHelpOptions = true)
public final class MergeCommand implements Callable<Integer> {

  @CommandLine.Parameters(index = "0", paramLabel = "SPEC", description = "Spec file")
  Path spec;

  @CommandLine.Parameters(index = "1", paramLabel = "DELTA", description = "Delta spec file")
  Path delta;

  @CommandLine.Option(
      names = {"-w", "--write"},
      description = "Write the merged spec instead of printing it")
  boolean write;

  @Override
  public Integer call() {
    if (!Files.isRegularFile(delta)) {
      System.err.println("Error: File not found: " + delta);
      return 1;
    }
    try {
      MergeResult result = SpecMerger.merge(spec, delta);
      if (write) {
        Path parent = spec.toAbsolutePath().getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        Files.write(spec, result.content().getBytes(StandardCharsets.UTF_8));
        OperationCounts c = result.counts();
        System.out.printf(
            "%s: %d added, %d modified, %d removed, %d renamed%n",
            spec, c.added(), c.modified(), c.removed(), c.renamed());
      } else {
        System.out.print(result.content());
        System.out.flush();
      }
      return 0;
    } catch (SpecMergeException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      System.err.println("Error: Failed to write " + spec + ": " + e.getMessage());
      return 1;
    }
  }
}
