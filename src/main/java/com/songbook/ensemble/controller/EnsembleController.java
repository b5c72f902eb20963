package com.songbook.ensemble.controller;

import com.songbook.ensemble.exception.EnsembleConfigurationException;
import com.songbook.ensemble.model.EnsembleCommand;
import com.songbook.ensemble.model.EnsembleResult;
import com.songbook.ensemble.model.SourceConfig;
import com.songbook.ensemble.service.EnsembleService;
import com.songbook.ensemble.service.ExplanationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/ensemble")
@RequiredArgsConstructor
public class EnsembleController {

    private final EnsembleService ensembleService;
    private final ExplanationService explanationService;

    @PostMapping("/recommendations")
    public ResponseEntity<EnsembleResponse> recommend(@Valid @RequestBody EnsembleRequest request) {
        EnsembleResult result = ensembleService.aggregate(toCommand(request));
        return ResponseEntity.ok(EnsembleResponse.from(result));
    }

    @PostMapping("/explanation")
    public ResponseEntity<ExplanationResponse> explain(@Valid @RequestBody EnsembleRequest request) {
        EnsembleResult result = ensembleService.aggregate(toCommand(request));
        String explanation = explanationService.explain(request.playlistIds(), result);

        return ResponseEntity.ok(new ExplanationResponse(
            explanation,
            result.items().stream().map(RecommendationItem::from).toList()
        ));
    }

    private EnsembleCommand toCommand(EnsembleRequest request) {
        List<SourceConfig> sources = request.sources() == null ? null : request.sources().stream()
            .map(source -> new SourceConfig(source.name(), parseEndpoint(source), source.weight()))
            .toList();

        return EnsembleCommand.builder()
            .playlistIds(request.playlistIds())
            .sources(sources)
            .topKPerSource(request.topKPerSource())
            .topKFinal(request.topKFinal())
            .timeoutPerSource(request.timeoutMs() == null ? null : Duration.ofMillis(request.timeoutMs()))
            .failFast(request.failFast())
            .build();
    }

    private URI parseEndpoint(SourceRequest source) {
        try {
            return URI.create(source.endpoint().trim());
        } catch (IllegalArgumentException e) {
            throw new EnsembleConfigurationException(
                "Source " + source.name() + " has a malformed endpoint: " + source.endpoint());
        }
    }
}
