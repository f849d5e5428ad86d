package io.github.granulefilter.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.granulefilter.model.FilterConfiguration;
import javax.inject.Singleton;

/**
 * Supplies the run configuration to the graph.
 */
@Module
public class ConfigurationModule {

  private final FilterConfiguration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final FilterConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public FilterConfiguration configuration() {
    return configuration;
  }
}
