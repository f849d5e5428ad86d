package io.github.granulefilter.cli.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the filtered dataset list to a fresh file in the working directory.
 */
public class WorklistWriter {

  private static final Logger log = LoggerFactory.getLogger(WorklistWriter.class);
  private static final String SUFFIX = ".txt";

  @Inject
  public WorklistWriter() {
  }

  /**
   * Create an empty, uniquely named sink. Existing files are never reused.
   *
   * @param workDirectory the directory to create the sink in
   * @param prefix        the file name prefix
   * @return the sink path
   * @throws IOException if the file cannot be created
   */
  public Path createSink(final Path workDirectory, final String prefix) throws IOException {
    final Path sink = Files.createTempFile(workDirectory, prefix, SUFFIX);
    log.debug("Created worklist sink {}", sink);
    return sink;
  }

  /**
   * Write one dataset per line.
   *
   * @param sink     the sink created by {@link #createSink(Path, String)}
   * @param worklist the datasets
   * @throws IOException if writing fails
   */
  public void write(final Path sink, final List<Path> worklist) throws IOException {
    try (final BufferedWriter writer = Files.newBufferedWriter(sink)) {
      for (final Path dataset : worklist) {
        writer.write(dataset.toString());
        writer.newLine();
      }
    }
    log.info("Wrote {} datasets to {}", worklist.size(), sink);
  }
}
