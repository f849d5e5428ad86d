package io.github.granulefilter.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.STRING;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.github.granulefilter.acquisition.AcquisitionReader;
import io.github.granulefilter.archive.ArchiveLayout;
import io.github.granulefilter.exception.AcquisitionOpenException;
import io.github.granulefilter.exception.MalformedMetadataException;
import io.github.granulefilter.exception.MetadataNotFoundException;
import io.github.granulefilter.locator.PackageLocator;
import io.github.granulefilter.metadata.ImageIdentityTag;
import io.github.granulefilter.metadata.MetadataExtractor;
import io.github.granulefilter.model.ExtractionResult;
import io.github.granulefilter.model.FilterDecision;
import io.github.granulefilter.model.FilterOutcome;
import io.github.granulefilter.model.FilterResult;
import io.github.granulefilter.model.ImmutableAcquisition;
import io.github.granulefilter.model.ImmutableExtractionResult;
import io.github.granulefilter.model.ImmutableGranuleRecord;
import io.github.granulefilter.model.RegionOfInterest;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

/**
 * Unit tests for GranuleFilter.
 */
@ExtendWith(MockitoExtension.class)
class GranuleFilterTest {

  private static final String GRANULE_55HFA =
      "S2A_OPER_MSI_L1C_TL_VGS1_20210301T012345_A029751_T55HFA_N02.09";
  private static final RegionOfInterest ROI = RegionOfInterest.of("T55HFA", "T50HMH");

  @Mock private AcquisitionReader acquisitionReader;

  @Mock private MetadataExtractor metadataExtractor;

  @Mock private PackageLocator packageLocator;

  private ListAppender<ILoggingEvent> events;
  private GranuleFilter granuleFilter;

  @BeforeEach
  void setUp() throws Exception {
    final ch.qos.logback.classic.Logger logger = (ch.qos.logback.classic.Logger)
        LoggerFactory.getLogger(GranuleFilterTest.class.getName() + "." + UUID.randomUUID());
    logger.setLevel(Level.DEBUG);
    logger.setAdditive(false);
    events = new ListAppender<>();
    events.start();
    logger.addAppender(events);

    granuleFilter =
        new GranuleFilter(acquisitionReader, metadataExtractor, packageLocator, logger);
  }

  @Test
  void filter_newGranuleInRegion_isQueued() throws Exception {
    // Given
    final Path dataset = dataset("a");
    openable();
    when(metadataExtractor.extract(dataset))
        .thenReturn(extraction(dataset, Map.of(GRANULE_55HFA, "2021-03-01T00:12:00Z")));

    // When
    final FilterResult result = granuleFilter.filter(List.of(dataset), RegionOfInterest.of("T55HFA"));

    // Then
    assertThat(result.worklist()).containsExactly(dataset);
    assertThat(result.granuleCount()).isEqualTo(1);
    assertThat(result.decisions()).extracting(FilterDecision::outcome)
        .containsExactly(FilterOutcome.ACCEPTED);
    verify(packageLocator).exists(dataset, GRANULE_55HFA, LocalDate.of(2021, 3, 1));
  }

  @Test
  void filter_secondRunAfterPackaging_queuesNothing() throws Exception {
    final Path dataset = dataset("a");
    openable();
    when(metadataExtractor.extract(dataset))
        .thenReturn(extraction(dataset, Map.of(GRANULE_55HFA, "2021-03-01T00:12:00Z")));

    final FilterResult first = granuleFilter.filter(List.of(dataset), RegionOfInterest.of("T55HFA"));
    when(packageLocator.exists(dataset, GRANULE_55HFA, LocalDate.of(2021, 3, 1))).thenReturn(true);
    final FilterResult second = granuleFilter.filter(List.of(dataset), RegionOfInterest.of("T55HFA"));

    assertThat(first.worklist()).containsExactly(dataset);
    assertThat(second.worklist()).isEmpty();
    assertThat(second.granuleCount()).isZero();
    assertThat(second.decisions().get(0).outcome()).isEqualTo(FilterOutcome.ALREADY_PROCESSED);
    assertThat(second.decisions().get(0).include()).isFalse();
  }

  @Test
  void filter_firstGranuleOutsideRegion_excludesWholeDataset() throws Exception {
    // Given: the second granule would match
    final Path dataset = dataset("straddling");
    openable();
    when(metadataExtractor.extract(dataset)).thenReturn(extraction(dataset, ordered(
        "g1_T99ZZZ_N02.09", "2021-03-01T00:00:00Z",
        "g2_T50HMH_N02.09", "2021-03-01T00:00:00Z")));

    // When
    final FilterResult result = granuleFilter.filter(List.of(dataset), RegionOfInterest.of("T50HMH"));

    // Then
    assertThat(result.worklist()).isEmpty();
    assertThat(result.decisions().get(0).outcome()).isEqualTo(FilterOutcome.OUTSIDE_REGION);
    verifyNoInteractions(packageLocator);
    assertThat(messages(Level.INFO)).anyMatch(m -> m.contains("T99ZZZ outside AOI"));
  }

  @Test
  void filter_acceptedMultiGranuleDataset_countsEveryGranule() throws Exception {
    final Path dataset = dataset("multi");
    openable();
    when(metadataExtractor.extract(dataset)).thenReturn(extraction(dataset, ordered(
        "g1_T55HFA_N02.01", "2016-01-01T00:00:00Z",
        "g2_T99ZZZ_N02.01", "2016-01-01T00:00:00Z",
        "g3_T50HMH_N02.01", "2016-01-01T00:00:00Z")));

    final FilterResult result = granuleFilter.filter(List.of(dataset), ROI);

    assertThat(result.worklist()).containsExactly(dataset);
    assertThat(result.granuleCount()).isEqualTo(3);
    assertThat(result.decisions().get(0).granuleCount()).isEqualTo(3);
    verify(packageLocator, times(1)).exists(any(), anyString(), any());
    verify(packageLocator).exists(dataset, "g1_T55HFA_N02.01", LocalDate.of(2016, 1, 1));
  }

  @Test
  void filter_firstGranuleAlreadyProcessed_consultsLocatorOnce() throws Exception {
    final Path dataset = dataset("multi");
    openable();
    when(metadataExtractor.extract(dataset)).thenReturn(extraction(dataset, ordered(
        "g1_T55HFA_N02.01", "2016-01-01T00:00:00Z",
        "g2_T55HFA_N02.01", "2016-01-02T00:00:00Z")));
    when(packageLocator.exists(dataset, "g1_T55HFA_N02.01", LocalDate.of(2016, 1, 1)))
        .thenReturn(true);

    final FilterResult result = granuleFilter.filter(List.of(dataset), ROI);

    assertThat(result.worklist()).isEmpty();
    verify(packageLocator, never()).exists(dataset, "g2_T55HFA_N02.01", LocalDate.of(2016, 1, 2));
  }

  @Test
  void filter_metadataFailure_skipsOnlyThatDataset() throws Exception {
    // Given
    final Path first = dataset("1");
    final Path second = dataset("2");
    final Path third = dataset("3");
    openable();
    when(metadataExtractor.extract(first))
        .thenReturn(extraction(first, Map.of("a_T55HFA_N02.09", "2021-03-01T00:00:00Z")));
    when(metadataExtractor.extract(second))
        .thenThrow(new MetadataNotFoundException(second, "No product metadata"));
    when(metadataExtractor.extract(third))
        .thenReturn(extraction(third, Map.of("c_T50HMH_N02.09", "2021-03-02T00:00:00Z")));

    // When
    final FilterResult result = granuleFilter.filter(List.of(first, second, third), ROI);

    // Then
    assertThat(result.worklist()).containsExactly(first, third);
    assertThat(result.granuleCount()).isEqualTo(2);
    assertThat(result.decisions()).extracting(FilterDecision::outcome).containsExactly(
        FilterOutcome.ACCEPTED, FilterOutcome.METADATA_ERROR, FilterOutcome.ACCEPTED);
    assertThat(messages(Level.WARN)).singleElement(STRING)
        .contains(second.toString())
        .contains("No product metadata");
  }

  @Test
  void filter_unexpectedMetadataError_skipsOnlyThatDataset() throws Exception {
    // Given
    final Path first = dataset("1");
    final Path second = dataset("2");
    final Path third = dataset("3");
    openable();
    when(metadataExtractor.extract(first))
        .thenReturn(extraction(first, Map.of("a_T55HFA_N02.09", "2021-03-01T00:00:00Z")));
    when(metadataExtractor.extract(second))
        .thenThrow(new IllegalArgumentException("Granule identifier too short: a_T55HF"));
    when(metadataExtractor.extract(third))
        .thenReturn(extraction(third, Map.of("c_T50HMH_N02.09", "2021-03-02T00:00:00Z")));

    // When
    final FilterResult result = granuleFilter.filter(List.of(first, second, third), ROI);

    // Then
    assertThat(result.worklist()).containsExactly(first, third);
    assertThat(result.decisions()).extracting(FilterDecision::outcome).containsExactly(
        FilterOutcome.ACCEPTED, FilterOutcome.METADATA_ERROR, FilterOutcome.ACCEPTED);
    assertThat(messages(Level.WARN)).singleElement(STRING)
        .contains(second.toString())
        .contains("too short");
  }

  @Test
  void filter_malformedMetadata_isSkipped() throws Exception {
    final Path dataset = dataset("bad");
    openable();
    when(metadataExtractor.extract(dataset))
        .thenThrow(new MalformedMetadataException(dataset, "No sensing time"));

    final FilterResult result = granuleFilter.filter(List.of(dataset), ROI);

    assertThat(result.worklist()).isEmpty();
    assertThat(result.decisions().get(0).outcome()).isEqualTo(FilterOutcome.METADATA_ERROR);
    assertThat(events.list).filteredOn(e -> e.getLevel() == Level.WARN)
        .singleElement()
        .satisfies(e -> assertThat(e.getThrowableProxy()).isNotNull());
  }

  @Test
  void filter_acquisitionFailure_skipsWithoutExtracting() throws Exception {
    final Path dataset = dataset("corrupt");
    when(acquisitionReader.open(dataset))
        .thenThrow(new AcquisitionOpenException(dataset, "No GRANULE/ entries"));

    final FilterResult result = granuleFilter.filter(List.of(dataset), ROI);

    assertThat(result.worklist()).isEmpty();
    assertThat(result.decisions().get(0).outcome()).isEqualTo(FilterOutcome.ACQUISITION_ERROR);
    verifyNoInteractions(metadataExtractor, packageLocator);
    assertThat(messages(Level.WARN)).singleElement(STRING)
        .contains("encountered unexpected error for " + dataset);
  }

  @Test
  void filter_unexpectedAcquisitionError_isSkipped() throws Exception {
    final Path dataset = dataset("odd");
    when(acquisitionReader.open(dataset)).thenThrow(new IllegalStateException("boom"));

    final FilterResult result = granuleFilter.filter(List.of(dataset), ROI);

    assertThat(result.decisions().get(0).outcome()).isEqualTo(FilterOutcome.ACQUISITION_ERROR);
    assertThat(messages(Level.WARN)).singleElement(STRING).contains("boom");
  }

  @Test
  void filter_repeatedRuns_produceSameWorklistInInputOrder() throws Exception {
    final Path a = dataset("a");
    final Path b = dataset("b");
    final Path c = dataset("c");
    openable();
    when(metadataExtractor.extract(a))
        .thenReturn(extraction(a, Map.of("a_T50HMH_N02.09", "2021-03-01T00:00:00Z")));
    when(metadataExtractor.extract(b))
        .thenReturn(extraction(b, Map.of("b_T01ABC_N02.09", "2021-03-01T00:00:00Z")));
    when(metadataExtractor.extract(c))
        .thenReturn(extraction(c, Map.of("c_T55HFA_N02.09", "2021-03-01T00:00:00Z")));

    final FilterResult first = granuleFilter.filter(List.of(c, b, a), ROI);
    final FilterResult second = granuleFilter.filter(List.of(c, b, a), ROI);

    assertThat(first.worklist()).containsExactly(c, a);
    assertThat(second).isEqualTo(first);
  }

  @Test
  void decide_withoutGranules_excludes() {
    final Path dataset = dataset("empty");
    final ExtractionResult empty = mock(ExtractionResult.class);
    when(empty.granules()).thenReturn(Map.of());

    final FilterDecision decision = granuleFilter.decide(dataset, empty, ROI);

    assertThat(decision.include()).isFalse();
    assertThat(decision.outcome()).isEqualTo(FilterOutcome.NO_GRANULES);
    assertThat(decision.granuleCount()).isZero();
  }

  private void openable() throws Exception {
    when(acquisitionReader.open(any())).thenAnswer(invocation ->
        ImmutableAcquisition.builder()
            .dataset(invocation.<Path>getArgument(0))
            .layout(ArchiveLayout.COMPRESSED)
            .granuleDirectoryCount(1)
            .build());
  }

  private static Path dataset(final String name) {
    return Paths.get("/data/l1c", name + ".zip");
  }

  private static String[] ordered(final String... granulesAndTimes) {
    return granulesAndTimes;
  }

  private static ExtractionResult extraction(final Path dataset, final Map<String, String> granules) {
    return extraction(dataset, granules.entrySet().stream()
        .flatMap(e -> Stream.of(e.getKey(), e.getValue()))
        .toArray(String[]::new));
  }

  private static ExtractionResult extraction(final Path dataset, final String[] granulesAndTimes) {
    final ImmutableExtractionResult.Builder builder = ImmutableExtractionResult.builder()
        .dataset(dataset)
        .processingBaseline("02.09")
        .imageIdentityTag(ImageIdentityTag.IMAGE_FILE);
    for (int i = 0; i < granulesAndTimes.length; i += 2) {
      builder.putGranules(granulesAndTimes[i], ImmutableGranuleRecord.builder()
          .granuleId(granulesAndTimes[i])
          .sensingTime(Instant.parse(granulesAndTimes[i + 1]))
          .build());
    }
    return builder.build();
  }

  private List<String> messages(final Level level) {
    return events.list.stream()
        .filter(event -> event.getLevel() == level)
        .map(ILoggingEvent::getFormattedMessage)
        .collect(Collectors.toList());
  }
}
