package io.github.granulefilter.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Opens a dataset reference with the archive implementation matching its layout.
 */
public final class ProductArchives {

  private ProductArchives() {
  }

  /**
   * Opens a dataset.
   *
   * <ul>
   *   <li>a directory is an expanded product;</li>
   *   <li>an {@code .xml} file is the product metadata of the expanded product in its parent
   *       directory;</li>
   *   <li>anything else is read as a zip archive.</li>
   * </ul>
   *
   * @param dataset the dataset reference
   * @return the open archive
   * @throws IOException if the dataset does not exist or cannot be opened
   */
  public static ProductArchive open(final Path dataset) throws IOException {
    if (Files.isDirectory(dataset)) {
      return new DirectoryProductArchive(dataset);
    }
    if (!Files.isRegularFile(dataset)) {
      throw new NoSuchFileException(dataset.toString());
    }
    final String name = dataset.getFileName().toString();
    if (name.toLowerCase(Locale.ROOT).endsWith(".xml")) {
      final Path root = dataset.toAbsolutePath().getParent();
      return new DirectoryProductArchive(dataset, root, name);
    }
    return new ZipProductArchive(dataset);
  }
}
