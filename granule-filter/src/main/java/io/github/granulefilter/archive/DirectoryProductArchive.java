package io.github.granulefilter.archive;

import io.github.granulefilter.metadata.NamingConventions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Product expanded into a directory tree.
 */
public class DirectoryProductArchive extends AbstractProductArchive {

  private final Path root;
  private final String productDocument;

  /**
   * Product rooted at {@code root} with the product metadata at the fixed name
   * {@link NamingConventions#PRODUCT_METADATA_TOKEN}.
   *
   * @param root the product directory
   */
  public DirectoryProductArchive(final Path root) {
    this(root, root, NamingConventions.PRODUCT_METADATA_TOKEN);
  }

  /**
   * Product whose metadata document was given explicitly.
   *
   * @param location        the dataset reference
   * @param root            the product directory
   * @param productDocument product metadata path relative to the root
   */
  public DirectoryProductArchive(
      final Path location, final Path root, final String productDocument) {
    super(location);
    this.root = root;
    this.productDocument = productDocument;
  }

  @Override
  public ArchiveLayout layout() {
    return ArchiveLayout.EXPANDED;
  }

  @Override
  protected List<String> loadMembers() throws IOException {
    try (Stream<Path> files = Files.walk(root)) {
      return files
          .filter(Files::isRegularFile)
          .map(this::memberName)
          .sorted()
          .collect(Collectors.toUnmodifiableList());
    }
  }

  @Override
  public byte[] readMember(final String name) throws IOException {
    return Files.readAllBytes(resolve(name));
  }

  @Override
  public Optional<String> productMetadataMember() throws IOException {
    if (Files.isRegularFile(resolve(productDocument))) {
      return Optional.of(productDocument);
    }
    final Path rootName = root.getFileName();
    if (rootName == null) {
      return Optional.empty();
    }
    return findMember(NamingConventions.productMetadataPattern(rootName.toString()));
  }

  @Override
  public Optional<String> granuleMetadataMember(
      final String granuleId, final String processingBaseline) throws IOException {
    final String direct = NamingConventions.granuleMetadataPath(granuleId);
    if (Files.isRegularFile(resolve(direct))) {
      return Optional.of(direct);
    }
    return searchGranuleMetadata(granuleId, processingBaseline);
  }

  @Override
  public void close() {
    // nothing held open
  }

  /**
   * Member path under the root.
   *
   * @throws NoSuchFileException if the name points outside the product directory
   */
  private Path resolve(final String name) throws NoSuchFileException {
    final Path base = root.normalize();
    final Path resolved = base.resolve(name).normalize();
    if (!resolved.startsWith(base)) {
      throw new NoSuchFileException(name, null, "outside product root " + root);
    }
    return resolved;
  }

  private String memberName(final Path file) {
    return root.relativize(file).toString().replace(root.getFileSystem().getSeparator(), "/");
  }
}
