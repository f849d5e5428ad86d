package io.github.granulefilter.filter;

import io.github.granulefilter.model.ImmutableRegionOfInterest;
import io.github.granulefilter.model.RegionOfInterest;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.inject.Inject;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the area-of-interest tile list.
 */
public class RegionOfInterestLoader {

  private static final Logger log = LoggerFactory.getLogger(RegionOfInterestLoader.class);

  /**
   * Grid prefix added to every tile code in the file.
   */
  public static final String TILE_PREFIX = "T";

  @Inject
  public RegionOfInterestLoader() {
  }

  /**
   * Read tile codes from the first column of each record, trimmed and prefixed with {@link
   * #TILE_PREFIX}. Blank lines are skipped.
   *
   * @param file the AOI file
   * @return the region of interest
   * @throws IOException if the file cannot be read
   */
  public RegionOfInterest load(final Path file) throws IOException {
    final ImmutableRegionOfInterest.Builder builder = ImmutableRegionOfInterest.builder();
    int count = 0;
    try (final Reader reader = Files.newBufferedReader(file);
        final CSVParser parser =
            new CSVParser(
                reader,
                CSVFormat.DEFAULT.builder()
                    .setTrim(true)
                    .setIgnoreEmptyLines(true)
                    .setIgnoreSurroundingSpaces(true)
                    .build())) {

      for (final CSVRecord record : parser) {
        final String tile = record.get(0);
        if (tile.isEmpty()) {
          continue;
        }
        builder.addTileCodes(TILE_PREFIX + tile);
        count++;
      }
    }
    final RegionOfInterest roi = builder.build();
    log.info("Loaded {} tiles ({} unique) from {}", count, roi.tileCodes().size(), file);
    return roi;
  }
}
