package io.github.granulefilter.acquisition;

import io.github.granulefilter.exception.AcquisitionOpenException;
import io.github.granulefilter.model.Acquisition;
import java.nio.file.Path;

/**
 * Structural sanity check of a raw dataset, run before metadata extraction.
 */
public interface AcquisitionReader {

  /**
   * Open a dataset.
   *
   * @param dataset the dataset reference
   * @return a handle describing the dataset
   * @throws AcquisitionOpenException if the dataset is not a readable product
   */
  Acquisition open(Path dataset) throws AcquisitionOpenException;
}
