package io.github.granulefilter.model;

import io.github.granulefilter.archive.ArchiveLayout;
import java.nio.file.Path;
import org.immutables.value.Value;

/**
 * Handle for a raw dataset that passed structural validation.
 */
@Value.Immutable
public interface Acquisition {

  Path dataset();

  ArchiveLayout layout();

  /**
   * Number of granule directories found in the dataset.
   */
  int granuleDirectoryCount();
}
