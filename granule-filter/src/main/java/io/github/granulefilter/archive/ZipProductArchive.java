package io.github.granulefilter.archive;

import io.github.granulefilter.metadata.NamingConventions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Product packaged as a single zip file.
 */
public class ZipProductArchive extends AbstractProductArchive {

  private final ZipFile zipFile;

  /**
   * Opens the zip file.
   *
   * @param location the archive path
   * @throws IOException if the file is not a readable zip archive
   */
  public ZipProductArchive(final Path location) throws IOException {
    super(location);
    this.zipFile = new ZipFile(location.toFile());
  }

  @Override
  public ArchiveLayout layout() {
    return ArchiveLayout.COMPRESSED;
  }

  @Override
  protected List<String> loadMembers() {
    final List<String> names = new ArrayList<>(zipFile.size());
    zipFile.stream().filter(entry -> !entry.isDirectory()).forEach(entry -> names.add(entry.getName()));
    return Collections.unmodifiableList(names);
  }

  @Override
  public byte[] readMember(final String name) throws IOException {
    final ZipEntry entry = zipFile.getEntry(name);
    if (entry == null) {
      throw new NoSuchFileException(location() + "!/" + name);
    }
    try (InputStream in = zipFile.getInputStream(entry)) {
      return in.readAllBytes();
    }
  }

  @Override
  public Optional<String> productMetadataMember() throws IOException {
    final Optional<String> canonical = findMember(NamingConventions.PRODUCT_METADATA_TOKEN);
    if (canonical.isPresent()) {
      return canonical;
    }
    return findMember(
        NamingConventions.productMetadataPattern(location().getFileName().toString()));
  }

  @Override
  public Optional<String> granuleMetadataMember(
      final String granuleId, final String processingBaseline) throws IOException {
    return searchGranuleMetadata(granuleId, processingBaseline);
  }

  @Override
  public void close() throws IOException {
    zipFile.close();
  }
}
