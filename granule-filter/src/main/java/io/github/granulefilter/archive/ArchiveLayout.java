package io.github.granulefilter.archive;

/**
 * Physical layout of a raw product.
 */
public enum ArchiveLayout {
  /**
   * A single zip file.
   */
  COMPRESSED,

  /**
   * An expanded directory tree.
   */
  EXPANDED
}
