package io.github.granulefilter.locator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Finds packages laid out as {@code <pkgdir>/<yyyy-MM-dd>/<ARD granule id>/CHECKSUM.sha1}.
 *
 * <p>A package directory counts as complete only once its checksum file is written.
 */
public class DirectoryPackageLocator implements PackageLocator {

  static final String CHECKSUM_FILE = "CHECKSUM.sha1";

  private final Path packageDirectory;

  public DirectoryPackageLocator(final Path packageDirectory) {
    this.packageDirectory = packageDirectory;
  }

  @Override
  public boolean exists(final Path level1, final String granuleId, final LocalDate date) {
    return Files.exists(packagePath(granuleId, date).resolve(CHECKSUM_FILE));
  }

  /**
   * Directory of the output package of a granule.
   *
   * @param granuleId the Level-1C granule identifier
   * @param date      the sensing date
   * @return the package directory
   */
  public Path packagePath(final String granuleId, final LocalDate date) {
    return packageDirectory
        .resolve(date.format(DateTimeFormatter.ISO_LOCAL_DATE))
        .resolve(granuleId.replace("L1C", "ARD"));
  }
}
