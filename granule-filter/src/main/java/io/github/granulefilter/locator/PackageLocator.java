package io.github.granulefilter.locator;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Answers whether a granule has already been turned into an output package.
 */
public interface PackageLocator {

  /**
   * Whether the output package exists.
   *
   * @param level1    the raw dataset the granule belongs to
   * @param granuleId the granule identifier
   * @param date      the UTC sensing date of the granule
   * @return true if the package exists
   */
  boolean exists(Path level1, String granuleId, LocalDate date);
}
