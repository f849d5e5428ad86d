package io.github.granulefilter.model;

import java.nio.file.Path;
import java.util.List;
import org.immutables.value.Value;

/**
 * Output of a filtering pass.
 */
@Value.Immutable
public interface FilterResult {

  /**
   * Datasets to process, in input order.
   */
  List<Path> worklist();

  /**
   * Total granules represented by the worklist.
   */
  int granuleCount();

  /**
   * One decision per input dataset, in input order.
   */
  List<FilterDecision> decisions();
}
