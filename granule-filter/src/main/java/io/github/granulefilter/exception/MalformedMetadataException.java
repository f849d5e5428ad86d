package io.github.granulefilter.exception;

import java.nio.file.Path;

/**
 * A metadata document was found but a required field is absent or unparsable.
 */
public class MalformedMetadataException extends DatasetException {

  public MalformedMetadataException(final Path dataset, final String message) {
    super(dataset, message, null);
  }

  public MalformedMetadataException(final Path dataset, final String message, final Throwable cause) {
    super(dataset, message, cause);
  }
}
