package io.github.granulefilter.model;

import io.github.granulefilter.metadata.ImageIdentityTag;
import java.nio.file.Path;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Granules extracted from one dataset, keyed by granule identifier in document order.
 */
@Value.Immutable
public interface ExtractionResult {

  /**
   * The dataset that was scanned.
   */
  Path dataset();

  /**
   * Processing baseline declared by the product metadata, e.g. "02.09".
   */
  String processingBaseline();

  /**
   * Tag that carries image identity in this document's schema.
   */
  ImageIdentityTag imageIdentityTag();

  /**
   * Granules by identifier.
   */
  Map<String, GranuleRecord> granules();

  /**
   * Number of granules bundled in the dataset.
   */
  @Value.Derived
  default int granuleCount() {
    return granules().size();
  }

  @Value.Check
  default void check() {
    if (granules().isEmpty()) {
      throw new IllegalStateException("Extraction result for " + dataset() + " has no granules");
    }
  }
}
