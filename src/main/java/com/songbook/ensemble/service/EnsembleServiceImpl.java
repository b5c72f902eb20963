package com.songbook.ensemble.service;

import com.songbook.ensemble.config.EnsembleProperties;
import com.songbook.ensemble.exception.AggregationEmptyException;
import com.songbook.ensemble.exception.EnsembleConfigurationException;
import com.songbook.ensemble.exception.SourceException;
import com.songbook.ensemble.model.AggregatedItem;
import com.songbook.ensemble.model.EnsembleCommand;
import com.songbook.ensemble.model.EnsembleResult;
import com.songbook.ensemble.model.EnsembleState;
import com.songbook.ensemble.model.NormalizedContribution;
import com.songbook.ensemble.model.PlaylistRequest;
import com.songbook.ensemble.model.SourceConfig;
import com.songbook.ensemble.model.SourceFailure;
import com.songbook.ensemble.model.SourceResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnsembleServiceImpl implements EnsembleService {

    private final SourceDispatcher sourceDispatcher;
    private final ScoreNormalizer scoreNormalizer;
    private final WeightedCombiner weightedCombiner;
    private final ContributionAggregator contributionAggregator;
    private final ResultRanker resultRanker;
    private final EnsembleProperties properties;

    @Override
    public EnsembleResult aggregate(EnsembleCommand command) {
        String invocationId = UUID.randomUUID().toString().substring(0, 8);
        transition(invocationId, EnsembleState.IDLE);

        List<SourceConfig> sources = resolveSources(command);
        Map<String, Double> weights = resolveWeights(sources);
        PlaylistRequest playlist = new PlaylistRequest(validatePlaylist(command.playlistIds()));
        int topKPerSource = positive(Optional.ofNullable(command.topKPerSource()).orElse(properties.topKPerSource()), "top_k_per_source");
        int topKFinal = positive(Optional.ofNullable(command.topKFinal()).orElse(properties.topKFinal()), "top_k_final");
        Duration timeout = Optional.ofNullable(command.timeoutPerSource()).orElse(properties.sourceTimeout());
        if (timeout.isNegative() || timeout.isZero()) {
            throw new EnsembleConfigurationException("Source timeout must be positive");
        }
        boolean failFast = Optional.ofNullable(command.failFast()).orElse(properties.failFast());
        Duration deadline = sharedDeadline(timeout);

        log.info("Ensemble {}: {} playlist ids, {} sources, top {} per source, top {} overall, deadline {} ms, {}",
            invocationId, playlist.ids().size(), sources.size(), topKPerSource, topKFinal,
            deadline.toMillis(), failFast ? "fail-fast" : "best-effort");

        transition(invocationId, EnsembleState.DISPATCHING);
        SourceDispatcher.Outcome outcome;
        try {
            outcome = sourceDispatcher.dispatch(sources, playlist, topKPerSource, timeout, deadline, failFast,
                () -> transition(invocationId, EnsembleState.COLLECTING));
        } catch (SourceException e) {
            transition(invocationId, EnsembleState.FAILED);
            log.warn("Ensemble {} aborted: {}", invocationId, e.getMessage());
            throw e;
        }

        List<SourceResult> collected = new ArrayList<>();
        List<SourceFailure> failures = new ArrayList<>();
        for (SourceConfig source : sources) {
            Optional.ofNullable(outcome.results().get(source.name())).ifPresent(collected::add);
            Optional.ofNullable(outcome.failures().get(source.name())).map(SourceFailure::from).ifPresent(failures::add);
        }

        if (collected.isEmpty()) {
            transition(invocationId, EnsembleState.FAILED);
            SourceException first = sources.stream()
                .map(source -> outcome.failures().get(source.name()))
                .filter(Objects::nonNull)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No result and no failure for any source"));
            log.warn("Ensemble {}: every source failed, raising {}", invocationId, first.getMessage());
            throw first;
        }

        transition(invocationId, EnsembleState.NORMALIZING);
        List<SourceResult> normalized = collected.stream()
            .map(scoreNormalizer::normalize)
            .toList();

        transition(invocationId, EnsembleState.COMBINING);
        List<NormalizedContribution> contributions = new ArrayList<>();
        normalized.forEach(result -> contributions.addAll(
            weightedCombiner.combine(result, weights.get(result.sourceName()))));

        transition(invocationId, EnsembleState.AGGREGATING);
        Map<String, AggregatedItem> aggregated = contributionAggregator.aggregate(contributions);
        if (aggregated.isEmpty()) {
            transition(invocationId, EnsembleState.FAILED);
            throw new AggregationEmptyException(normalized.stream().map(SourceResult::sourceName).toList());
        }

        transition(invocationId, EnsembleState.RANKING);
        List<AggregatedItem> ranked = resultRanker.rank(aggregated, topKFinal);

        transition(invocationId, EnsembleState.DONE);
        log.info("Ensemble {}: {} distinct items from {} sources, returning {}; {} source(s) failed",
            invocationId, aggregated.size(), normalized.size(), ranked.size(), failures.size());

        return new EnsembleResult(ranked, normalized, failures);
    }

    private List<SourceConfig> resolveSources(EnsembleCommand command) {
        List<SourceConfig> sources = command.sources() != null
            ? command.sources()
            : properties.sources().stream()
                .map(source -> new SourceConfig(source.name(), source.endpoint(), source.weight()))
                .toList();

        if (sources.isEmpty()) {
            throw new EnsembleConfigurationException("At least one source must be configured");
        }
        if (sources.size() > properties.maxSources()) {
            throw new EnsembleConfigurationException(
                "At most " + properties.maxSources() + " sources are allowed, got " + sources.size());
        }

        Set<String> names = new HashSet<>();
        for (SourceConfig source : sources) {
            if (source == null || source.name() == null || source.name().isBlank()) {
                throw new EnsembleConfigurationException("Every source needs a name");
            }
            if (!names.add(source.name())) {
                throw new EnsembleConfigurationException("Duplicate source name: " + source.name());
            }
            validateEndpoint(source);
            if (source.weight() != null && (!Double.isFinite(source.weight()) || source.weight() < 0)) {
                throw new EnsembleConfigurationException(
                    "Weight of source " + source.name() + " must be a finite number, zero or positive, got " + source.weight());
            }
        }
        return sources;
    }

    private void validateEndpoint(SourceConfig source) {
        URI endpoint = source.endpoint();
        String scheme = endpoint == null ? null : endpoint.getScheme();
        if (scheme == null || endpoint.getHost() == null
            || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new EnsembleConfigurationException(
                "Source " + source.name() + " needs an absolute http(s) endpoint, got " + endpoint);
        }
    }

    /**
     * Equal weights of 1/N when no source carries one; otherwise unspecified weights count as zero.
     */
    private Map<String, Double> resolveWeights(List<SourceConfig> sources) {
        boolean anySpecified = sources.stream().anyMatch(source -> source.weight() != null);
        double equalWeight = 1.0 / sources.size();

        Map<String, Double> weights = new LinkedHashMap<>();
        for (SourceConfig source : sources) {
            double weight = anySpecified ? Optional.ofNullable(source.weight()).orElse(0.0) : equalWeight;
            weights.put(source.name(), weight);
        }

        if (weights.values().stream().allMatch(weight -> weight == 0.0)) {
            throw new EnsembleConfigurationException("All source weights resolve to zero");
        }
        if (!Double.isFinite(weights.values().stream().mapToDouble(Double::doubleValue).sum())) {
            throw new EnsembleConfigurationException("Source weights must add up to a finite number");
        }
        return weights;
    }

    private List<Object> validatePlaylist(List<Object> playlistIds) {
        if (playlistIds == null || playlistIds.isEmpty()) {
            throw new EnsembleConfigurationException("Playlist must contain at least one id");
        }
        for (Object id : playlistIds) {
            if (!(id instanceof String || isIntegral(id))) {
                throw new EnsembleConfigurationException("Playlist ids must be integers or strings, got " + id);
            }
        }
        return playlistIds;
    }

    private static boolean isIntegral(Object id) {
        return id instanceof Integer || id instanceof Long || id instanceof Short
            || id instanceof Byte || id instanceof BigInteger;
    }

    private int positive(int value, String name) {
        if (value < 1) {
            throw new EnsembleConfigurationException(name + " must be at least 1, got " + value);
        }
        return value;
    }

    private Duration sharedDeadline(Duration timeoutPerSource) {
        Duration deadline = timeoutPerSource.plus(properties.deadlineGrace());
        return deadline.compareTo(properties.maxDeadline()) > 0 ? properties.maxDeadline() : deadline;
    }

    private void transition(String invocationId, EnsembleState state) {
        log.debug("Ensemble {} -> {}", invocationId, state);
    }
}
