package io.github.granulefilter.cli.dagger;

import dagger.Component;
import io.github.granulefilter.cli.output.WorklistWriter;
import io.github.granulefilter.dagger.ConfigurationModule;
import io.github.granulefilter.dagger.FilterModule;
import io.github.granulefilter.filter.GranuleFilter;
import io.github.granulefilter.filter.RegionOfInterestLoader;
import io.github.granulefilter.model.FilterConfiguration;
import javax.inject.Singleton;

/**
 * Dagger component for CLI tool.
 */
@Singleton
@Component(modules = {CliModule.class, FilterModule.class, ConfigurationModule.class})
public interface CliComponent {

  /**
   * Create CLI component with configuration.
   *
   * @param configuration the configuration
   * @return the CLI component
   */
  static CliComponent create(final FilterConfiguration configuration) {
    return DaggerCliComponent.builder()
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
   * Region of interest loader.
   *
   * @return the region of interest loader
   */
  RegionOfInterestLoader regionOfInterestLoader();

  /**
   * Worklist writer.
   *
   * @return the worklist writer
   */
  WorklistWriter worklistWriter();
}
