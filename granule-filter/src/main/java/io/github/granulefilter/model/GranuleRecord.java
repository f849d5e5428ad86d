package io.github.granulefilter.model;

import io.github.granulefilter.metadata.NamingConventions;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.immutables.value.Value;

/**
 * A single granule found in a product's metadata.
 */
@Value.Immutable
public interface GranuleRecord {

  /**
   * Granule identifier as declared by the product metadata.
   */
  String granuleId();

  /**
   * Acquisition time read from the granule metadata.
   */
  Instant sensingTime();

  /**
   * Image identity values of the granule, in document order.
   */
  List<String> imageIds();

  /**
   * MGRS tile code embedded in the granule identifier.
   */
  @Value.Derived
  default String tileCode() {
    return NamingConventions.tileCode(granuleId());
  }

  /**
   * UTC calendar date of the acquisition, used to partition output packages.
   */
  @Value.Derived
  default LocalDate sensingDate() {
    return sensingTime().atOffset(ZoneOffset.UTC).toLocalDate();
  }
}
