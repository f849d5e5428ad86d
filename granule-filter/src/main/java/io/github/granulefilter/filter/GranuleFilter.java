package io.github.granulefilter.filter;

import io.github.granulefilter.acquisition.AcquisitionReader;
import io.github.granulefilter.exception.AcquisitionOpenException;
import io.github.granulefilter.exception.DatasetException;
import io.github.granulefilter.locator.PackageLocator;
import io.github.granulefilter.metadata.MetadataExtractor;
import io.github.granulefilter.model.Acquisition;
import io.github.granulefilter.model.ExtractionResult;
import io.github.granulefilter.model.FilterDecision;
import io.github.granulefilter.model.FilterOutcome;
import io.github.granulefilter.model.FilterResult;
import io.github.granulefilter.model.GranuleRecord;
import io.github.granulefilter.model.ImmutableFilterResult;
import io.github.granulefilter.model.RegionOfInterest;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;

/**
 * Decides which raw datasets must be queued for processing.
 *
 * <p>A dataset is decided by the first granule examined: a tile outside the region of interest
 * or an existing package excludes it, otherwise it is accepted with all of its granules. Failures
 * to open or read a dataset exclude that dataset only.
 */
public class GranuleFilter {

  private final AcquisitionReader acquisitionReader;
  private final MetadataExtractor metadataExtractor;
  private final PackageLocator packageLocator;
  private final Logger log;

  /**
   * Constructor.
   *
   * @param acquisitionReader structural check run before extraction
   * @param metadataExtractor granule metadata source
   * @param packageLocator    already-processed oracle
   * @param log               receives per-dataset warnings and decisions
   */
  public GranuleFilter(
      final AcquisitionReader acquisitionReader,
      final MetadataExtractor metadataExtractor,
      final PackageLocator packageLocator,
      final Logger log) {
    this.acquisitionReader = acquisitionReader;
    this.metadataExtractor = metadataExtractor;
    this.packageLocator = packageLocator;
    this.log = log;
  }

  /**
   * Filter datasets in input order.
   *
   * @param datasets the raw datasets
   * @param roi      the region of interest
   * @return the worklist, its granule total and one decision per dataset
   */
  public FilterResult filter(final List<Path> datasets, final RegionOfInterest roi) {
    final ImmutableFilterResult.Builder result = ImmutableFilterResult.builder();
    int granuleCount = 0;

    for (final Path dataset : datasets) {
      final FilterDecision decision = evaluate(dataset, roi);
      result.addDecisions(decision);
      if (decision.include()) {
        result.addWorklist(dataset);
        granuleCount += decision.granuleCount();
      }
    }

    final FilterResult filterResult = result.granuleCount(granuleCount).build();
    log.info("{} of {} datasets need processing ({} granules)",
        filterResult.worklist().size(), datasets.size(), granuleCount);
    return filterResult;
  }

  /**
   * Decide a single dataset.
   *
   * @param dataset the raw dataset
   * @param roi     the region of interest
   * @return the decision
   */
  public FilterDecision evaluate(final Path dataset, final RegionOfInterest roi) {
    try {
      final Acquisition acquisition = acquisitionReader.open(dataset);
      log.debug("Opened {} with {} granule directories", dataset,
          acquisition.granuleDirectoryCount());
    } catch (AcquisitionOpenException e) {
      log.warn("encountered unexpected error for {}: {}", dataset, e.getMessage(), e);
      return FilterDecision.excluded(dataset, FilterOutcome.ACQUISITION_ERROR);
    } catch (RuntimeException e) {
      log.warn("encountered unexpected error for {}: {}", dataset, e.toString(), e);
      return FilterDecision.excluded(dataset, FilterOutcome.ACQUISITION_ERROR);
    }

    final ExtractionResult extraction;
    try {
      extraction = metadataExtractor.extract(dataset);
    } catch (DatasetException e) {
      log.warn("unable to read metadata for {}: {}", dataset, e.getMessage(), e);
      return FilterDecision.excluded(dataset, FilterOutcome.METADATA_ERROR);
    } catch (RuntimeException e) {
      log.warn("unable to read metadata for {}: {}", dataset, e.toString(), e);
      return FilterDecision.excluded(dataset, FilterOutcome.METADATA_ERROR);
    }

    return decide(dataset, extraction, roi);
  }

  /**
   * Apply region and already-processed policy to extracted granules.
   *
   * @param dataset    the raw dataset
   * @param extraction its granules
   * @param roi        the region of interest
   * @return the decision
   */
  FilterDecision decide(
      final Path dataset, final ExtractionResult extraction, final RegionOfInterest roi) {
    final Iterator<GranuleRecord> granules = extraction.granules().values().iterator();
    if (!granules.hasNext()) {
      return FilterDecision.excluded(dataset, FilterOutcome.NO_GRANULES);
    }

    // the first granule decides for the whole archive
    final GranuleRecord granule = granules.next();
    final String tileCode = granule.tileCode();
    if (!roi.contains(tileCode)) {
      log.info("granule {} with MGRS tile ID {} outside AOI", granule.granuleId(), tileCode);
      return FilterDecision.excluded(dataset, FilterOutcome.OUTSIDE_REGION);
    }

    if (packageLocator.exists(dataset, granule.granuleId(), granule.sensingDate())) {
      log.debug("granule {} already processed", granule.granuleId());
      return FilterDecision.excluded(dataset, FilterOutcome.ALREADY_PROCESSED);
    }

    log.info("level1 dataset {} needs to be processed", dataset);
    return FilterDecision.accepted(dataset, extraction.granuleCount());
  }
}
