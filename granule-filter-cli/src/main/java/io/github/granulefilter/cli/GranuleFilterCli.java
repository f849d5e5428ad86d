package io.github.granulefilter.cli;

import io.github.granulefilter.cli.command.CalcNodesCommand;
import io.github.granulefilter.cli.command.FilterCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for the Level-1C granule filter.
 */
@Command(
    name = "granule-filter",
    description = "Selects Level-1C archives that still need ARD processing",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {FilterCommand.class, CalcNodesCommand.class})
public class GranuleFilterCli implements Runnable {

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = new CommandLine(new GranuleFilterCli()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public void run() {
    // Show help when no subcommand is specified
    CommandLine.usage(this, System.out);
  }
}
