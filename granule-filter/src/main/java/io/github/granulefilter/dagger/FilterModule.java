package io.github.granulefilter.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.granulefilter.acquisition.AcquisitionReader;
import io.github.granulefilter.acquisition.ArchiveAcquisitionReader;
import io.github.granulefilter.filter.GranuleFilter;
import io.github.granulefilter.locator.DirectoryPackageLocator;
import io.github.granulefilter.locator.PackageLocator;
import io.github.granulefilter.metadata.MetadataExtractor;
import io.github.granulefilter.model.FilterConfiguration;
import javax.inject.Singleton;
import org.slf4j.LoggerFactory;

/**
 * The type Filter module.
 */
@Module
public class FilterModule {

  /**
   * Instantiates a new Filter module.
   */
  public FilterModule() {
    // Default constructor
  }

  /**
   * Package locator backed by the configured package directory.
   *
   * @param configuration the configuration
   * @return the package locator
   */
  @Provides
  @Singleton
  public PackageLocator packageLocator(final FilterConfiguration configuration) {
    return new DirectoryPackageLocator(configuration.packageDirectory());
  }

  /**
   * Acquisition reader.
   *
   * @param reader the archive acquisition reader
   * @return the acquisition reader
   */
  @Provides
  @Singleton
  public AcquisitionReader acquisitionReader(final ArchiveAcquisitionReader reader) {
    return reader;
  }

  /**
   * Granule filter.
   *
   * @param acquisitionReader the acquisition reader
   * @param metadataExtractor the metadata extractor
   * @param packageLocator    the package locator
   * @return the granule filter
   */
  @Provides
  @Singleton
  public GranuleFilter granuleFilter(
      final AcquisitionReader acquisitionReader,
      final MetadataExtractor metadataExtractor,
      final PackageLocator packageLocator) {
    return new GranuleFilter(
        acquisitionReader,
        metadataExtractor,
        packageLocator,
        LoggerFactory.getLogger(GranuleFilter.class));
  }
}
