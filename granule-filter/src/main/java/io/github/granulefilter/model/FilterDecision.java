package io.github.granulefilter.model;

import java.nio.file.Path;
import org.immutables.value.Value;

/**
 * Decision taken for a single dataset.
 */
@Value.Immutable
public interface FilterDecision {

  Path dataset();

  FilterOutcome outcome();

  /**
   * Granules bundled by the dataset; zero unless the dataset is included.
   */
  @Value.Default
  default int granuleCount() {
    return 0;
  }

  @Value.Derived
  default boolean include() {
    return outcome() == FilterOutcome.ACCEPTED;
  }

  /**
   * Exclusion with the given outcome.
   *
   * @param dataset the dataset
   * @param outcome the reason for exclusion
   * @return the decision
   */
  static FilterDecision excluded(final Path dataset, final FilterOutcome outcome) {
    return ImmutableFilterDecision.builder().dataset(dataset).outcome(outcome).build();
  }

  /**
   * Acceptance carrying the dataset's granule count.
   *
   * @param dataset      the dataset
   * @param granuleCount granules bundled by the dataset
   * @return the decision
   */
  static FilterDecision accepted(final Path dataset, final int granuleCount) {
    return ImmutableFilterDecision.builder()
        .dataset(dataset)
        .outcome(FilterOutcome.ACCEPTED)
        .granuleCount(granuleCount)
        .build();
  }
}
