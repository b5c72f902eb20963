package com.songbook.ensemble.service;

import com.songbook.ensemble.config.EnsembleProperties;
import com.songbook.ensemble.exception.AggregationEmptyException;
import com.songbook.ensemble.exception.EnsembleConfigurationException;
import com.songbook.ensemble.exception.SourceHttpException;
import com.songbook.ensemble.exception.SourceSchemaException;
import com.songbook.ensemble.exception.SourceTimeoutException;
import com.songbook.ensemble.infra.SourceClient;
import com.songbook.ensemble.model.AggregatedItem;
import com.songbook.ensemble.model.EnsembleCommand;
import com.songbook.ensemble.model.EnsembleResult;
import com.songbook.ensemble.model.PlaylistRequest;
import com.songbook.ensemble.model.RawCandidate;
import com.songbook.ensemble.model.SourceConfig;
import com.songbook.ensemble.model.SourceFailure;
import com.songbook.ensemble.model.SourceFailureKind;
import com.songbook.ensemble.model.SourceResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnsembleServiceTest {

    private static final SourceConfig S1 = SourceConfig.of("S1", "http://s1.local/recommend", 0.5);
    private static final SourceConfig S2 = SourceConfig.of("S2", "http://s2.local/recommend", 0.5);
    private static final Duration SHORT_TIMEOUT = Duration.ofMillis(200);

    @Mock
    private SourceClient sourceClient;

    private ExecutorService executor;
    private EnsembleServiceImpl ensembleService;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        EnsembleProperties properties = new EnsembleProperties(
            20, 10, Duration.ofSeconds(2), Duration.ofMillis(50), Duration.ofSeconds(5), true, 4,
            List.of(new EnsembleProperties.Source("configured", URI.create("http://configured.local/recommend"), null))
        );
        ensembleService = new EnsembleServiceImpl(
            new SourceDispatcher(sourceClient, executor),
            new ScoreNormalizer(),
            new WeightedCombiner(),
            new ContributionAggregator(),
            new ResultRanker(),
            properties
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("Aggregation scenarios")
    class Scenarios {

        @Test
        @DisplayName("A: shared item normalized to 1.0 in both sources ranks first with both contributors")
        void scenarioA() {
            stubScenarioA();

            EnsembleResult result = ensembleService.aggregate(command(List.of(S1, S2), 10, true));

            assertThat(result.items()).extracting(AggregatedItem::canonicalKey).containsExactly("X", "Y");
            AggregatedItem x = result.items().get(0);
            assertThat(x.finalScore()).isCloseTo(1.0, within(1e-12));
            assertThat(x.contributingSources()).containsExactly("S1", "S2");
            AggregatedItem y = result.items().get(1);
            assertThat(y.finalScore()).isZero();
            assertThat(y.contributingSources()).containsExactly("S1");
            assertThat(result.failures()).isEmpty();
        }

        @Test
        @DisplayName("B: top_k_final of 1 keeps only the best item")
        void scenarioB() {
            stubScenarioA();

            EnsembleResult result = ensembleService.aggregate(command(List.of(S1, S2), 1, true));

            assertThat(result.items()).extracting(AggregatedItem::canonicalKey).containsExactly("X");
        }

        @Test
        @DisplayName("C: a timed-out source aborts a fail-fast call and its request is cancelled")
        void scenarioC() throws InterruptedException {
            CountDownLatch interrupted = new CountDownLatch(1);
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any()))
                .thenReturn(result("S1", candidate("X", 10)));
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any())).thenAnswer(invocation -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return result("S2", candidate("X", 5));
            });

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(S1, S2), 10, true)))
                .isInstanceOf(SourceTimeoutException.class)
                .hasMessageContaining("S2");

            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("D: a timed-out source is recorded and skipped in best-effort mode")
        void scenarioD() {
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any()))
                .thenReturn(result("S1", candidate("X", 10), candidate("Y", 0)));
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any())).thenAnswer(invocation -> {
                Thread.sleep(10_000);
                return result("S2", candidate("Z", 5));
            });

            EnsembleResult result = ensembleService.aggregate(command(List.of(S1, S2), 10, false));

            assertThat(result.items()).extracting(AggregatedItem::canonicalKey).containsExactly("X", "Y");
            assertThat(result.items()).allSatisfy(item -> assertThat(item.contributingSources()).containsExactly("S1"));
            assertThat(result.sourceResults()).extracting(SourceResult::sourceName).containsExactly("S1");
            assertThat(result.failures()).extracting(SourceFailure::sourceName, SourceFailure::kind)
                .containsExactly(tuple("S2", SourceFailureKind.TIMEOUT));
        }

        @Test
        @DisplayName("E: an empty source list is rejected before any call")
        void scenarioE() {
            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(), 10, true)))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("At least one source");

            verifyNoInteractions(sourceClient);
        }

        private void stubScenarioA() {
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any()))
                .thenReturn(result("S1", candidate("X", 10), candidate("Y", 0)));
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any()))
                .thenReturn(result("S2", candidate("X", 5)));
        }
    }

    @Nested
    @DisplayName("Failure policy")
    class FailurePolicy {

        @Test
        @DisplayName("Should surface the first error and cancel the sibling in fail-fast mode")
        void shouldCancelSiblingsOnFirstError() throws InterruptedException {
            CountDownLatch slowStarted = new CountDownLatch(1);
            CountDownLatch interrupted = new CountDownLatch(1);
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any())).thenAnswer(invocation -> {
                slowStarted.await(2, TimeUnit.SECONDS);
                throw new SourceHttpException("S1", 503, null);
            });
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any())).thenAnswer(invocation -> {
                slowStarted.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return result("S2", candidate("X", 1));
            });

            long started = System.nanoTime();
            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(S1, S2), 10, true)))
                .isInstanceOf(SourceHttpException.class)
                .hasMessageContaining("503");

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("Should raise the first declared failure when every source fails in best-effort mode")
        void shouldRaiseFirstDeclaredFailureWhenNothingSucceeds() {
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any())).thenAnswer(invocation -> {
                Thread.sleep(50);
                throw new SourceSchemaException("S1", "unexpected response type STRING");
            });
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any()))
                .thenThrow(new SourceHttpException("S2", 500, null));

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(S1, S2), 10, false)))
                .isInstanceOf(SourceSchemaException.class)
                .hasMessageContaining("S1");
        }

        @Test
        @DisplayName("Should keep HTTP failures as metadata in best-effort mode")
        void shouldRecordHttpFailure() {
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any()))
                .thenThrow(new SourceHttpException("S1", 502, null));
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any()))
                .thenReturn(result("S2", candidate("X", 3), candidate("Y", 1)));

            EnsembleResult result = ensembleService.aggregate(command(List.of(S1, S2), 10, false));

            assertThat(result.items()).extracting(AggregatedItem::canonicalKey).containsExactly("X", "Y");
            assertThat(result.failures()).singleElement()
                .satisfies(failure -> {
                    assertThat(failure.sourceName()).isEqualTo("S1");
                    assertThat(failure.kind()).isEqualTo(SourceFailureKind.HTTP);
                    assertThat(failure.message()).contains("502");
                });
        }

        @Test
        @DisplayName("Should wrap unexpected task errors as source failures")
        void shouldWrapUnexpectedErrors() {
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any()))
                .thenThrow(new IllegalStateException("connection pool closed"));

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(S1), 10, true)))
                .isInstanceOf(SourceHttpException.class)
                .hasMessageContaining("connection pool closed");
        }

        @Test
        @DisplayName("Should fail with AggregationEmptyException when sources answer with nothing")
        void shouldFailWhenNoCandidates() {
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any())).thenReturn(result("S1"));
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any())).thenReturn(result("S2"));

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(S1, S2), 10, true)))
                .isInstanceOf(AggregationEmptyException.class)
                .hasMessageContaining("S1")
                .hasMessageContaining("S2");
        }
    }

    @Nested
    @DisplayName("Weights and ordering")
    class WeightsAndOrdering {

        @Test
        @DisplayName("Should take descriptive fields from the first declared source even when it answers last")
        void shouldMergeInDeclaredOrder() {
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any())).thenAnswer(invocation -> {
                Thread.sleep(150);
                return SourceResult.raw("S1", List.of(new RawCandidate("X", "Title from S1", "A", "D", 1.0)), 0);
            });
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any()))
                .thenReturn(SourceResult.raw("S2", List.of(new RawCandidate("X", "Title from S2", "B", "E", 1.0)), 0));

            EnsembleResult result = ensembleService.aggregate(command(List.of(S1, S2), 10, true));

            assertThat(result.items().get(0).title()).isEqualTo("Title from S1");
            assertThat(result.sourceResults()).extracting(SourceResult::sourceName).containsExactly("S1", "S2");
        }

        @Test
        @DisplayName("Should use equal weights of 1/N when no weight is given")
        void shouldDefaultToEqualWeights() {
            SourceConfig a = SourceConfig.of("A", "http://a.local/r", null);
            SourceConfig b = SourceConfig.of("B", "http://b.local/r", null);
            SourceConfig c = SourceConfig.of("C", "http://c.local/r", null);
            when(sourceClient.fetch(eq(a), any(), anyInt(), any())).thenReturn(result("A", candidate("X", 1)));
            when(sourceClient.fetch(eq(b), any(), anyInt(), any())).thenReturn(result("B", candidate("X", 1)));
            when(sourceClient.fetch(eq(c), any(), anyInt(), any())).thenReturn(result("C", candidate("Y", 1)));

            EnsembleResult result = ensembleService.aggregate(command(List.of(a, b, c), 10, true));

            assertThat(result.items().get(0).finalScore()).isCloseTo(2.0 / 3.0, within(1e-12));
            assertThat(result.items().get(1).finalScore()).isCloseTo(1.0 / 3.0, within(1e-12));
        }

        @Test
        @DisplayName("Should treat a missing weight as zero when other sources carry one")
        void shouldZeroUnspecifiedWeights() {
            SourceConfig weighted = SourceConfig.of("weighted", "http://a.local/r", 2.0);
            SourceConfig unweighted = SourceConfig.of("unweighted", "http://b.local/r", null);
            when(sourceClient.fetch(eq(weighted), any(), anyInt(), any())).thenReturn(result("weighted", candidate("X", 1)));
            when(sourceClient.fetch(eq(unweighted), any(), anyInt(), any())).thenReturn(result("unweighted", candidate("Y", 1)));

            EnsembleResult result = ensembleService.aggregate(command(List.of(weighted, unweighted), 10, true));

            assertThat(result.items()).extracting(AggregatedItem::canonicalKey).containsExactly("X", "Y");
            assertThat(result.items().get(0).finalScore()).isEqualTo(2.0);
            assertThat(result.items().get(1).finalScore()).isZero();
            assertThat(result.items().get(1).contributingSources()).containsExactly("unweighted");
        }

        @Test
        @DisplayName("Should honour every output invariant across overlapping sources")
        void shouldHoldOutputInvariants() {
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any())).thenReturn(
                result("S1", candidate("A", 9), candidate("B", 7), candidate("C", 7), candidate("D", 1)));
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any())).thenReturn(
                result("S2", candidate("C", 0.9), candidate("E", 0.2), candidate("B", 0.2)));

            EnsembleResult result = ensembleService.aggregate(command(List.of(S1, S2), 4, true));

            List<AggregatedItem> items = result.items();
            assertThat(items).hasSizeLessThanOrEqualTo(4);
            assertThat(items).extracting(AggregatedItem::canonicalKey).doesNotHaveDuplicates();
            assertThat(items).allSatisfy(item -> {
                assertThat(item.finalScore()).isGreaterThanOrEqualTo(0.0);
                assertThat(item.contributingSources()).isNotEmpty();
            });
            assertThat(items).isSortedAccordingTo(ResultRanker.RANKING_ORDER);
        }

        @Test
        @DisplayName("Should keep scores finite when raw scores span the whole double range")
        void shouldStayFiniteOnExtremeRawScores() {
            SourceConfig single = SourceConfig.of("S1", "http://s1.local/recommend", 1.0);
            when(sourceClient.fetch(eq(single), any(), anyInt(), any()))
                .thenReturn(result("S1", candidate("X", 1e308), candidate("Y", -1e308)));

            EnsembleResult result = ensembleService.aggregate(command(List.of(single), 10, true));

            assertThat(result.items()).extracting(AggregatedItem::canonicalKey).containsExactly("X", "Y");
            assertThat(result.items().get(0).finalScore()).isEqualTo(1.0);
            assertThat(result.items().get(1).finalScore()).isZero();
        }

        @Test
        @DisplayName("Should report records dropped by each source")
        void shouldExposeDroppedRecords() {
            when(sourceClient.fetch(eq(S1), any(), anyInt(), any()))
                .thenReturn(SourceResult.raw("S1", List.of(candidate("X", 1)), 2));
            when(sourceClient.fetch(eq(S2), any(), anyInt(), any())).thenReturn(result("S2", candidate("X", 1)));

            EnsembleResult result = ensembleService.aggregate(command(List.of(S1, S2), 10, true));

            assertThat(result.droppedRecords()).containsExactly(Map.entry("S1", 2), Map.entry("S2", 0));
        }
    }

    @Nested
    @DisplayName("Request validation and defaults")
    class Validation {

        @Test
        void shouldRejectAllZeroWeights() {
            SourceConfig zero1 = SourceConfig.of("z1", "http://a.local/r", 0.0);
            SourceConfig zero2 = SourceConfig.of("z2", "http://b.local/r", 0.0);

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(zero1, zero2), 10, true)))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("zero");
            verifyNoInteractions(sourceClient);
        }

        @Test
        void shouldRejectInfiniteWeight() {
            SourceConfig infinite = SourceConfig.of("inf", "http://a.local/r", Double.POSITIVE_INFINITY);

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(S1, infinite), 10, true)))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("finite");
            verifyNoInteractions(sourceClient);
        }

        @Test
        void shouldRejectWeightsOverflowingTheirSum() {
            SourceConfig huge1 = SourceConfig.of("huge1", "http://a.local/r", Double.MAX_VALUE);
            SourceConfig huge2 = SourceConfig.of("huge2", "http://b.local/r", Double.MAX_VALUE);

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(huge1, huge2), 10, true)))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("finite");
            verifyNoInteractions(sourceClient);
        }

        @Test
        void shouldRejectFractionalPlaylistIds() {
            EnsembleCommand command = EnsembleCommand.builder()
                .playlistIds(List.of(1, 1.5))
                .sources(List.of(S1))
                .build();

            assertThatThrownBy(() -> ensembleService.aggregate(command))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("1.5");
            verifyNoInteractions(sourceClient);
        }

        @Test
        void shouldRejectDuplicateSourceNames() {
            SourceConfig copy = SourceConfig.of("S1", "http://elsewhere.local/r", 0.2);

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(S1, copy), 10, true)))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("Duplicate");
        }

        @Test
        void shouldRejectNegativeWeight() {
            SourceConfig negative = SourceConfig.of("neg", "http://a.local/r", -0.1);

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(S1, negative), 10, true)))
                .isInstanceOf(EnsembleConfigurationException.class);
        }

        @Test
        void shouldRejectRelativeEndpoint() {
            SourceConfig relative = SourceConfig.of("rel", "/recommend/bert", 1.0);

            assertThatThrownBy(() -> ensembleService.aggregate(command(List.of(relative), 10, true)))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("rel");
        }

        @Test
        void shouldRejectTooManySources() {
            List<SourceConfig> sources = List.of(
                SourceConfig.of("a", "http://a.local/r", 1.0), SourceConfig.of("b", "http://b.local/r", 1.0),
                SourceConfig.of("c", "http://c.local/r", 1.0), SourceConfig.of("d", "http://d.local/r", 1.0),
                SourceConfig.of("e", "http://e.local/r", 1.0));

            assertThatThrownBy(() -> ensembleService.aggregate(command(sources, 10, true)))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("At most 4");
        }

        @Test
        void shouldRejectEmptyPlaylist() {
            EnsembleCommand command = EnsembleCommand.builder()
                .playlistIds(List.of())
                .sources(List.of(S1))
                .build();

            assertThatThrownBy(() -> ensembleService.aggregate(command))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("Playlist");
        }

        @Test
        void shouldRejectNonScalarPlaylistIds() {
            EnsembleCommand command = EnsembleCommand.builder()
                .playlistIds(List.of(1, Map.of("id", 2)))
                .sources(List.of(S1))
                .build();

            assertThatThrownBy(() -> ensembleService.aggregate(command))
                .isInstanceOf(EnsembleConfigurationException.class);
        }

        @Test
        void shouldRejectNonPositiveTopK() {
            EnsembleCommand command = EnsembleCommand.builder()
                .playlistIds(List.of(1))
                .sources(List.of(S1))
                .topKFinal(0)
                .build();

            assertThatThrownBy(() -> ensembleService.aggregate(command))
                .isInstanceOf(EnsembleConfigurationException.class)
                .hasMessageContaining("top_k_final");
        }

        @Test
        @DisplayName("Should fall back to configured sources and defaults, passing the playlist through unchanged")
        void shouldUseConfiguredDefaults() {
            SourceConfig configured = SourceConfig.of("configured", "http://configured.local/recommend", null);
            when(sourceClient.fetch(eq(configured), any(), anyInt(), any()))
                .thenReturn(result("configured", candidate("X", 1)));

            EnsembleCommand command = EnsembleCommand.builder()
                .playlistIds(Arrays.asList(3, "a7", 3))
                .build();
            EnsembleResult result = ensembleService.aggregate(command);

            ArgumentCaptor<PlaylistRequest> playlist = ArgumentCaptor.forClass(PlaylistRequest.class);
            verify(sourceClient).fetch(eq(configured), playlist.capture(), eq(20), eq(Duration.ofSeconds(2)));
            assertThat(playlist.getValue().ids()).containsExactly(3, "a7", 3);
            assertThat(result.items()).extracting(AggregatedItem::canonicalKey).containsExactly("X");
            assertThat(result.items().get(0).finalScore()).isEqualTo(1.0);
        }
    }

    private EnsembleCommand command(List<SourceConfig> sources, int topKFinal, boolean failFast) {
        return EnsembleCommand.builder()
            .playlistIds(List.of(12, 57, 301))
            .sources(sources)
            .topKPerSource(5)
            .topKFinal(topKFinal)
            .timeoutPerSource(SHORT_TIMEOUT)
            .failFast(failFast)
            .build();
    }

    private static SourceResult result(String source, RawCandidate... candidates) {
        return SourceResult.raw(source, List.of(candidates), 0);
    }

    private static RawCandidate candidate(String key, double score) {
        return new RawCandidate(key, "Title " + key, "Author " + key, "Description " + key, score);
    }
}
