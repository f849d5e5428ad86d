package io.github.granulefilter.cli.command;

import io.github.granulefilter.cli.estimate.NodeEstimator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Estimates the nodes needed to process a scene list.
 */
@Command(
    name = "calcnodes",
    description = "Estimate the number of nodes required to process a level1 scene list")
public class CalcNodesCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(CalcNodesCommand.class);

  @Spec
  private CommandSpec spec;

  @Option(
      names = {"--level1-list"},
      description = "The level1 scene list",
      required = true)
  private Path level1List;

  @Option(
      names = {"--workers"},
      description = "The number of workers to request per node, 1 to 32 (default: ${DEFAULT-VALUE})",
      defaultValue = "28")
  private int workers;

  @Option(
      names = {"--walltime"},
      description = "Job walltime in hh:mm:ss format (default: ${DEFAULT-VALUE})",
      defaultValue = "48:00:00")
  private String walltime;

  @Option(
      names = {"--hours-per-granule"},
      description = "Processing hours per granule (default: ${DEFAULT-VALUE})",
      defaultValue = "1.5")
  private double hoursPerGranule;

  @Override
  public Integer call() throws IOException {
    if (workers < 1 || workers > 32) {
      throw new ParameterException(spec.commandLine(),
          "Invalid value for option '--workers': " + workers + " is not in the range 1 to 32");
    }

    final long granuleCount;
    try (Stream<String> lines = Files.lines(level1List)) {
      granuleCount = lines.count();
    }

    final int nodes;
    try {
      nodes = new NodeEstimator().nodesRequired(granuleCount, walltime, workers, hoursPerGranule);
    } catch (IllegalArgumentException e) {
      throw new ParameterException(spec.commandLine(), e.getMessage(), e);
    }
    log.debug("{} granules, walltime {}, {} workers -> {} nodes", granuleCount, walltime, workers, nodes);
    spec.commandLine().getOut().println("Nodes required " + nodes);
    spec.commandLine().getOut().flush();
    return 0;
  }
}
