package io.github.granulefilter.acquisition;

import io.github.granulefilter.archive.ProductArchive;
import io.github.granulefilter.archive.ProductArchives;
import io.github.granulefilter.exception.AcquisitionOpenException;
import io.github.granulefilter.metadata.NamingConventions;
import io.github.granulefilter.model.Acquisition;
import io.github.granulefilter.model.ImmutableAcquisition;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import javax.inject.Inject;

/**
 * Accepts a dataset that opens as a product archive and contains granule data.
 */
public class ArchiveAcquisitionReader implements AcquisitionReader {

  private static final String GRANULE_PREFIX = NamingConventions.GRANULE_DIRECTORY + "/";

  @Inject
  public ArchiveAcquisitionReader() {
  }

  @Override
  public Acquisition open(final Path dataset) throws AcquisitionOpenException {
    try (ProductArchive archive = ProductArchives.open(dataset)) {
      final List<String> members = archive.listMembers();
      if (members.isEmpty()) {
        throw new AcquisitionOpenException(dataset, "Dataset is empty");
      }
      final long granuleDirectories = members.stream()
          .map(ArchiveAcquisitionReader::granuleDirectory)
          .filter(directory -> !directory.isEmpty())
          .distinct()
          .count();
      if (granuleDirectories == 0) {
        throw new AcquisitionOpenException(dataset, "No " + GRANULE_PREFIX + " entries");
      }
      return ImmutableAcquisition.builder()
          .dataset(dataset)
          .layout(archive.layout())
          .granuleDirectoryCount((int) granuleDirectories)
          .build();
    } catch (IOException e) {
      throw new AcquisitionOpenException(dataset, "Cannot open dataset: " + e.getMessage(), e);
    }
  }

  /**
   * The {@code GRANULE/<name>} directory a member belongs to, or empty.
   */
  private static String granuleDirectory(final String member) {
    final int start;
    if (member.startsWith(GRANULE_PREFIX)) {
      start = 0;
    } else {
      final int slash = member.indexOf("/" + GRANULE_PREFIX);
      if (slash < 0) {
        return "";
      }
      start = slash + 1;
    }
    final int end = member.indexOf('/', start + GRANULE_PREFIX.length());
    return end < 0 ? "" : member.substring(0, end);
  }
}
