package io.github.granulefilter.exception;

import java.nio.file.Path;

/**
 * The raw dataset failed structural validation.
 */
public class AcquisitionOpenException extends DatasetException {

  public AcquisitionOpenException(final Path dataset, final String message) {
    super(dataset, message, null);
  }

  public AcquisitionOpenException(final Path dataset, final String message, final Throwable cause) {
    super(dataset, message, cause);
  }
}
