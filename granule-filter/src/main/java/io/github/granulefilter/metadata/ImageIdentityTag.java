package io.github.granulefilter.metadata;

import org.w3c.dom.Element;

/**
 * Element naming the images of a granule. The name changed between processing baselines.
 */
public enum ImageIdentityTag {
  /**
   * Older products.
   */
  IMAGE_ID,

  /**
   * Newer products.
   */
  IMAGE_FILE;

  /**
   * Tag used by a document, decided from its first granule.
   *
   * @param firstGranule the first granule element of the document
   * @return {@link #IMAGE_ID} if the granule has non-empty {@code IMAGE_ID} text, else {@link
   *     #IMAGE_FILE}
   */
  public static ImageIdentityTag detect(final Element firstGranule) {
    final var nodes = firstGranule.getElementsByTagName(IMAGE_ID.name());
    if (nodes.getLength() > 0 && !nodes.item(0).getTextContent().isBlank()) {
      return IMAGE_ID;
    }
    return IMAGE_FILE;
  }
}
