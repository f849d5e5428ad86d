package io.github.granulefilter.cli.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.granulefilter.cli.output.WorklistWriter;
import javax.inject.Singleton;

/**
 * Dagger module providing CLI dependencies.
 */
@Module
public class CliModule {

  /**
   * Provide worklist writer.
   *
   * @return the worklist writer
   */
  @Provides
  @Singleton
  public WorklistWriter worklistWriter() {
    return new WorklistWriter();
  }
}
