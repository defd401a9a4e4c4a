package io.spectr.shell;

import io.spectr.shell.cli.DeltaCommand;
import io.spectr.shell.cli.FormatCommand;
import io.spectr.shell.cli.MergeCommand;
import io.spectr.shell.cli.PrintCommand;
import io.spectr.shell.cli.QueryCommand;
import io.spectr.shell.cli.RequirementsCommand;
import io.spectr.shell.cli.SyncCommand;
import io.spectr.shell.cli.TasksCommand;
import io.spectr.shell.cli.ValidateCommand;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "spectr",
    description = "Tools for spec, delta spec and task list documents",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {
      PrintCommand.class,
      FormatCommand.class,
      QueryCommand.class,
      RequirementsCommand.class,
      DeltaCommand.class,
      TasksCommand.class,
      SyncCommand.class,
      MergeCommand.class,
      ValidateCommand.class
    })
public final class Main implements Callable<Integer> {

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  public static void main(String[] args) {
    // must happen before the first logger is created
    if (Boolean.getBoolean("spectr.debug")) {
      System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
    }
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    spec.commandLine().usage(System.out);
    return 0;
  }
}
