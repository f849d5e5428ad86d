package io.github.granulefilter.exception;

import java.nio.file.Path;

/**
 * Failure confined to a single dataset. A batch never aborts on one of these.
 */
public abstract class DatasetException extends Exception {

  private final Path dataset;

  /**
   * Constructor.
   *
   * @param dataset the dataset being evaluated
   * @param message the message
   * @param cause   the underlying cause, may be null
   */
  protected DatasetException(final Path dataset, final String message, final Throwable cause) {
    super(message, cause);
    this.dataset = dataset;
  }

  /**
   * The dataset that failed.
   *
   * @return the dataset path
   */
  public Path getDataset() {
    return dataset;
  }
}
