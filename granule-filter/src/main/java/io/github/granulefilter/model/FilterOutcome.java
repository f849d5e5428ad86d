package io.github.granulefilter.model;

/**
 * Why a dataset was included in or excluded from the worklist.
 */
public enum FilterOutcome {
  /**
   * Needs processing.
   */
  ACCEPTED,

  /**
   * A granule lies outside the region of interest.
   */
  OUTSIDE_REGION,

  /**
   * An output package already exists.
   */
  ALREADY_PROCESSED,

  /**
   * The raw dataset failed structural validation.
   */
  ACQUISITION_ERROR,

  /**
   * Metadata could not be located or parsed.
   */
  METADATA_ERROR,

  /**
   * No granule was examined.
   */
  NO_GRANULES
}
