package com.songbook.ensemble.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.songbook.ensemble.exception.SourceException;
import com.songbook.ensemble.exception.SourceHttpException;
import com.songbook.ensemble.exception.SourceSchemaException;
import com.songbook.ensemble.exception.SourceTimeoutException;
import com.songbook.ensemble.model.PlaylistRequest;
import com.songbook.ensemble.model.SourceConfig;
import com.songbook.ensemble.model.SourceResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

@Slf4j
@Component
public class WebClientSourceClient implements SourceClient {

    private final WebClient webClient;
    private final SourceResponseParser parser;

    public WebClientSourceClient(WebClient.Builder webClientBuilder, SourceResponseParser parser) {
        this.webClient = webClientBuilder.build();
        this.parser = parser;
    }

    @Override
    public SourceResult fetch(SourceConfig source, PlaylistRequest playlist, int topK, Duration timeout) {
        String name = source.name();
        log.debug("Requesting {} candidates from source {} at {} (timeout {} ms)",
            topK, name, source.endpoint(), timeout.toMillis());

        JsonNode body = webClient.post()
            .uri(source.endpoint())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new ScoringRequest(playlist.ids(), topK))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout, Mono.error(() -> new SourceTimeoutException(name, timeout)))
            .onErrorMap(ex -> !(ex instanceof SourceException), ex -> translate(name, ex))
            .block();

        if (body == null) {
            throw new SourceSchemaException(name, "response body is empty");
        }

        SourceResult result = parser.parse(name, body);
        log.debug("Source {} returned {} usable candidates ({} dropped)",
            name, result.candidates().size(), result.droppedRecords());
        return result;
    }

    private SourceException translate(String sourceName, Throwable ex) {
        if (ex instanceof WebClientResponseException responseException) {
            // A 2xx status here means the body could not be decoded.
            if (responseException.getStatusCode().is2xxSuccessful()) {
                return new SourceSchemaException(sourceName, "response body is not valid JSON", ex);
            }
            return new SourceHttpException(sourceName, responseException.getStatusCode().value(), ex);
        }
        if (ex instanceof CodecException) {
            return new SourceSchemaException(sourceName, "response body is not valid JSON", ex);
        }
        return SourceHttpException.transport(sourceName, ex);
    }
}
