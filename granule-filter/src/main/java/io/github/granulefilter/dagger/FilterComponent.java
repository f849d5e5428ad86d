package io.github.granulefilter.dagger;

import dagger.Component;
import io.github.granulefilter.filter.GranuleFilter;
import io.github.granulefilter.filter.RegionOfInterestLoader;
import io.github.granulefilter.locator.PackageLocator;
import io.github.granulefilter.metadata.MetadataExtractor;
import io.github.granulefilter.model.FilterConfiguration;
import javax.inject.Singleton;

/**
 * The interface Filter component.
 */
@Singleton
@Component(modules = {FilterModule.class, ConfigurationModule.class})
public interface FilterComponent {

  /**
   * Instance filter component.
   *
   * @param configuration the configuration
   * @return the filter component
   */
  static FilterComponent instance(final FilterConfiguration configuration) {
    return DaggerFilterComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * Granule filter.
   *
   * @return the granule filter
   */
  GranuleFilter granuleFilter();

  /**
   * Metadata extractor.
   *
   * @return the metadata extractor
   */
  MetadataExtractor metadataExtractor();

  /**
   * Region of interest loader.
   *
   * @return the region of interest loader
   */
  RegionOfInterestLoader regionOfInterestLoader();

  /**
   * Package locator.
   *
   * @return the package locator
   */
  PackageLocator packageLocator();
}
