package io.github.granulefilter.model;

import java.nio.file.Path;
import org.immutables.value.Value;

/**
 * Settings for a filtering run.
 */
@Value.Immutable
public interface FilterConfiguration {

  /**
   * File listing the MGRS tiles of interest, one per line without the grid prefix.
   */
  Path regionOfInterestFile();

  /**
   * Base directory of the output packages, partitioned by sensing date.
   */
  Path packageDirectory();

  /**
   * Directory that receives the filtered list.
   */
  Path workDirectory();

  /**
   * Prefix of the filtered list's file name.
   */
  @Value.Default
  default String filePrefix() {
    return "filtered";
  }
}
