package io.github.granulefilter.exception;

import java.nio.file.Path;

/**
 * No product or granule metadata document could be located by any search strategy.
 */
public class MetadataNotFoundException extends DatasetException {

  public MetadataNotFoundException(final Path dataset, final String message) {
    super(dataset, message, null);
  }

  public MetadataNotFoundException(final Path dataset, final String message, final Throwable cause) {
    super(dataset, message, cause);
  }
}
