package io.github.granulefilter.metadata;

import io.github.granulefilter.archive.ProductArchive;
import io.github.granulefilter.archive.ProductArchives;
import io.github.granulefilter.exception.MalformedMetadataException;
import io.github.granulefilter.exception.MetadataNotFoundException;
import io.github.granulefilter.model.ExtractionResult;
import io.github.granulefilter.model.GranuleRecord;
import io.github.granulefilter.model.ImmutableExtractionResult;
import io.github.granulefilter.model.ImmutableGranuleRecord;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * Reads granule identity and sensing time from the metadata embedded in a Level-1C product.
 */
public class MetadataExtractor {

  static final String PROCESSING_BASELINE = "/*/*/Product_Info/PROCESSING_BASELINE";
  static final String SENSING_TIME = "/*/*/SENSING_TIME";
  static final String GRANULE_IDENTIFIER = "granuleIdentifier";

  private final Logger log;

  /**
   * Constructor.
   */
  @Inject
  public MetadataExtractor() {
    this(LoggerFactory.getLogger(MetadataExtractor.class));
  }

  /**
   * Constructor with an explicit logger.
   *
   * @param log the logger
   */
  public MetadataExtractor(final Logger log) {
    this.log = log;
  }

  /**
   * Extract the granules of a dataset.
   *
   * @param dataset the dataset reference
   * @return granules keyed by identifier, never empty
   * @throws MetadataNotFoundException   if the product or a granule metadata document cannot be
   *                                     located
   * @throws MalformedMetadataException  if a located document lacks a required field
   */
  public ExtractionResult extract(final Path dataset)
      throws MetadataNotFoundException, MalformedMetadataException {
    final ProductArchive archive;
    try {
      archive = ProductArchives.open(dataset);
    } catch (IOException e) {
      throw new MetadataNotFoundException(dataset, "Cannot open dataset: " + e.getMessage(), e);
    }
    try (archive) {
      return extract(archive);
    } catch (IOException e) {
      throw new MetadataNotFoundException(dataset, "Cannot read dataset: " + e.getMessage(), e);
    }
  }

  /**
   * Extract the granules of an open archive.
   *
   * @param archive the archive
   * @return granules keyed by identifier, never empty
   * @throws MetadataNotFoundException  if a metadata document cannot be located
   * @throws MalformedMetadataException if a located document lacks a required field
   * @throws IOException                if the archive members cannot be listed
   */
  public ExtractionResult extract(final ProductArchive archive)
      throws MetadataNotFoundException, MalformedMetadataException, IOException {
    final Path dataset = archive.location();
    final String productMember = archive.productMetadataMember()
        .orElseThrow(() -> new MetadataNotFoundException(dataset, "No product metadata in " + archive));
    log.debug("Product metadata for {} is {}", dataset, productMember);

    final MetadataDocument product = read(archive, productMember);
    final String baseline = product.text(PROCESSING_BASELINE)
        .orElseThrow(() -> new MalformedMetadataException(dataset,
            "No processing baseline in " + productMember));

    final List<Element> granules = granuleElements(dataset, productMember, product);
    final ImageIdentityTag imageTag = ImageIdentityTag.detect(granules.get(0));

    final Map<String, GranuleRecord> records = new LinkedHashMap<>();
    for (final Element granule : granules) {
      final String granuleId = granule.getAttribute(GRANULE_IDENTIFIER).trim();
      if (granuleId.isEmpty() || !NamingConventions.hasTileCode(granuleId)
          || granuleId.contains("/") || granuleId.contains("\\")) {
        throw new MalformedMetadataException(dataset,
            "Invalid " + GRANULE_IDENTIFIER + " '" + granuleId + "' in " + productMember);
      }
      final Instant sensingTime = sensingTime(archive, granuleId, baseline);
      records.put(granuleId, ImmutableGranuleRecord.builder()
          .granuleId(granuleId)
          .sensingTime(sensingTime)
          .imageIds(imageIds(granule, imageTag))
          .build());
    }

    return ImmutableExtractionResult.builder()
        .dataset(dataset)
        .processingBaseline(baseline)
        .imageIdentityTag(imageTag)
        .granules(records)
        .build();
  }

  private List<Element> granuleElements(
      final Path dataset, final String productMember, final MetadataDocument product)
      throws MalformedMetadataException {
    for (final GranuleListLayout layout : GranuleListLayout.values()) {
      final List<Element> granules = product.elements(layout.expression());
      if (!granules.isEmpty()) {
        log.debug("Found {} granules in {} using {} layout", granules.size(), productMember, layout);
        return granules;
      }
    }
    throw new MalformedMetadataException(dataset, "No granule list in " + productMember);
  }

  private Instant sensingTime(
      final ProductArchive archive, final String granuleId, final String baseline)
      throws MetadataNotFoundException, MalformedMetadataException, IOException {
    final Path dataset = archive.location();
    final Optional<String> located;
    try {
      located = archive.granuleMetadataMember(granuleId, baseline);
    } catch (IllegalArgumentException e) {
      throw new MalformedMetadataException(dataset,
          "Invalid " + GRANULE_IDENTIFIER + " '" + granuleId + "': " + e.getMessage(), e);
    }
    final String member = located.orElseThrow(() -> new MetadataNotFoundException(dataset,
        "No granule metadata for " + granuleId + " in " + archive));
    final String text = read(archive, member).text(SENSING_TIME)
        .orElseThrow(() -> new MalformedMetadataException(dataset, "No sensing time in " + member));
    try {
      return SensingTimes.parse(text);
    } catch (DateTimeParseException e) {
      throw new MalformedMetadataException(dataset,
          "Unparsable sensing time '" + text + "' in " + member, e);
    }
  }

  private MetadataDocument read(final ProductArchive archive, final String member)
      throws MalformedMetadataException {
    try {
      return MetadataDocument.parse(archive.readMember(member));
    } catch (IOException e) {
      throw new MalformedMetadataException(archive.location(),
          "Cannot read " + member + ": " + e.getMessage(), e);
    }
  }

  private static List<String> imageIds(final Element granule, final ImageIdentityTag tag) {
    final NodeList nodes = granule.getElementsByTagName(tag.name());
    final List<String> ids = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      final String text = nodes.item(i).getTextContent().trim();
      if (!text.isEmpty()) {
        ids.add(text);
      }
    }
    return ids;
  }
}
