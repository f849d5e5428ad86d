package io.github.granulefilter.model;

import java.util.Set;
import org.immutables.value.Value;

/**
 * Tile codes for which processing is requested.
 */
@Value.Immutable
public interface RegionOfInterest {

  /**
   * Tile codes, including the grid prefix (e.g. "T55HFA").
   */
  Set<String> tileCodes();

  /**
   * Whether the tile is part of the region.
   *
   * @param tileCode the tile code
   * @return true if the tile is of interest
   */
  default boolean contains(final String tileCode) {
    return tileCodes().contains(tileCode);
  }

  /**
   * Region built from the given tile codes.
   *
   * @param tileCodes the tile codes
   * @return the region of interest
   */
  static RegionOfInterest of(final String... tileCodes) {
    return ImmutableRegionOfInterest.builder().addTileCodes(tileCodes).build();
  }
}
