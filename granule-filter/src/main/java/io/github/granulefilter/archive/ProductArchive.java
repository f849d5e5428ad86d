package io.github.granulefilter.archive;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the members of a raw product, independent of its layout.
 *
 * <p>Member names are {@code /}-separated. Implementations hold open resources and must be
 * closed.
 */
public interface ProductArchive extends Closeable {

  /**
   * The dataset reference this archive was opened from.
   *
   * @return the path
   */
  Path location();

  /**
   * The physical layout.
   *
   * @return the layout
   */
  ArchiveLayout layout();

  /**
   * All member names.
   *
   * @return member names in archive order
   * @throws IOException if the members cannot be listed
   */
  List<String> listMembers() throws IOException;

  /**
   * Content of a member.
   *
   * @param name the member name
   * @return the bytes
   * @throws IOException if the member is missing or unreadable
   */
  byte[] readMember(String name) throws IOException;

  /**
   * Member holding the product metadata.
   *
   * @return the member name, or empty if no search strategy finds one
   * @throws IOException if the members cannot be listed
   */
  Optional<String> productMetadataMember() throws IOException;

  /**
   * Member holding a granule's metadata.
   *
   * @param granuleId          the granule identifier
   * @param processingBaseline the product's processing baseline
   * @return the member name, or empty if no search strategy finds one
   * @throws IOException if the members cannot be listed
   */
  Optional<String> granuleMetadataMember(String granuleId, String processingBaseline)
      throws IOException;
}
