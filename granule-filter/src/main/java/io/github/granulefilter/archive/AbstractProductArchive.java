package io.github.granulefilter.archive;

import io.github.granulefilter.metadata.NamingConventions;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Member searches shared by both layouts.
 */
abstract class AbstractProductArchive implements ProductArchive {

  private final Path location;
  private List<String> members;

  protected AbstractProductArchive(final Path location) {
    this.location = location;
  }

  @Override
  public Path location() {
    return location;
  }

  @Override
  public List<String> listMembers() throws IOException {
    if (members == null) {
      members = loadMembers();
    }
    return members;
  }

  /**
   * Reads the member names from the underlying storage. Called once.
   *
   * @return member names
   * @throws IOException if listing fails
   */
  protected abstract List<String> loadMembers() throws IOException;

  /**
   * First member whose name contains the token.
   */
  protected Optional<String> findMember(final String token) throws IOException {
    return listMembers().stream().filter(name -> name.contains(token)).findFirst();
  }

  /**
   * Granule metadata search by canonical name, then by the name derived from the granule
   * identifier.
   *
   * <p>When several members carry the canonical name, the one under a directory naming the
   * granule's tile is preferred.
   */
  protected Optional<String> searchGranuleMetadata(
      final String granuleId, final String processingBaseline) throws IOException {
    final List<String> canonical =
        listMembers().stream()
            .filter(name -> name.contains(NamingConventions.GRANULE_METADATA_TOKEN))
            .collect(Collectors.toList());
    if (!canonical.isEmpty()) {
      if (canonical.size() > 1 && NamingConventions.hasTileCode(granuleId)) {
        final String tile = "_" + NamingConventions.tileCode(granuleId) + "_";
        return Optional.of(
            canonical.stream().filter(name -> name.contains(tile)).findFirst()
                .orElse(canonical.get(0)));
      }
      return Optional.of(canonical.get(0));
    }
    return findMember(NamingConventions.granuleMetadataPattern(granuleId, processingBaseline));
  }

  @Override
  public String toString() {
    return layout() + " " + location;
  }
}
