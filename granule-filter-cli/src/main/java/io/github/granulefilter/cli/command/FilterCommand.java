package io.github.granulefilter.cli.command;

import io.github.granulefilter.cli.dagger.CliComponent;
import io.github.granulefilter.cli.output.WorklistWriter;
import io.github.granulefilter.filter.GranuleFilter;
import io.github.granulefilter.model.FilterConfiguration;
import io.github.granulefilter.model.FilterResult;
import io.github.granulefilter.model.ImmutableFilterConfiguration;
import io.github.granulefilter.model.RegionOfInterest;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Filter command writing the Level-1C datasets that need processing.
 */
@Command(
    name = "filter",
    description = "Filter a Level-1C scene list down to unprocessed scenes inside the area of interest")
public class FilterCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(FilterCommand.class);

  @Spec
  private CommandSpec spec;

  @Option(
      names = {"--level1-list"},
      description = "The unfiltered level1 scene list",
      required = true)
  private Path level1List;

  @Option(
      names = {"--s2-aoi"},
      description = "List of MGRS tiles of interest (default: ${DEFAULT-VALUE})",
      defaultValue = "${GRANULE_FILTER_S2_AOI:-/g/data/v10/eoancillarydata/S2_extent/S2_aoi.csv}")
  private Path s2Aoi;

  @Option(
      names = {"--pkgdir"},
      description = "The base output packaged directory (default: ${DEFAULT-VALUE})",
      defaultValue = "${GRANULE_FILTER_PKGDIR:-/g/data/if87/datacube/002/S2_MSI_ARD/packaged}")
  private Path pkgdir;

  @Option(
      names = {"--workdir"},
      description = "The base output working directory (default: ${DEFAULT-VALUE})",
      defaultValue = "${GRANULE_FILTER_WORKDIR:-/g/data/if87/datacube/002/S2_MSI_ARD/workdir}")
  private Path workdir;

  @Option(
      names = {"--file-prefix"},
      description = "The prefix of the output file (default: ${DEFAULT-VALUE})",
      defaultValue = "filtered")
  private String filePrefix;

  @Override
  public Integer call() {
    log.info("filter --level1-list {} --s2-aoi {} --pkgdir {} --workdir {} --file-prefix {}",
        level1List, s2Aoi, pkgdir, workdir, filePrefix);

    final FilterConfiguration configuration =
        ImmutableFilterConfiguration.builder()
            .regionOfInterestFile(s2Aoi)
            .packageDirectory(pkgdir)
            .workDirectory(workdir)
            .filePrefix(filePrefix)
            .build();

    final CliComponent component = CliComponent.create(configuration);
    final WorklistWriter writer = component.worklistWriter();

    // Input and configuration errors abort before any dataset is evaluated
    final List<Path> datasets;
    final RegionOfInterest roi;
    final Path sink;
    try {
      datasets = readDatasets(level1List);
      roi = component.regionOfInterestLoader().load(configuration.regionOfInterestFile());
      sink = writer.createSink(configuration.workDirectory(), configuration.filePrefix());
    } catch (IOException e) {
      log.error("Unable to start filtering: {}", e.toString());
      return 1;
    }

    final GranuleFilter filter = component.granuleFilter();
    final FilterResult result = filter.filter(datasets, roi);

    try {
      writer.write(sink, result.worklist());
    } catch (IOException e) {
      log.error("Unable to write {}: {}", sink, e.toString());
      return 1;
    }

    spec.commandLine().getOut().println(sink);
    spec.commandLine().getOut().flush();
    log.info("finished: {} datasets, {} granules", result.worklist().size(), result.granuleCount());
    return 0;
  }

  /**
   * Dataset references, one per line, trimmed. Blank lines are skipped.
   *
   * @throws IOException if the list cannot be read or is not valid UTF-8
   */
  static List<Path> readDatasets(final Path list) throws IOException {
    try (Stream<String> lines = Files.lines(list)) {
      return lines
          .map(String::trim)
          .filter(line -> !line.isEmpty())
          .map(Paths::get)
          .collect(Collectors.toList());
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }
}
