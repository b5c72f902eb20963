package com.songbook.ensemble.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.songbook.ensemble.exception.SourceSchemaException;
import com.songbook.ensemble.model.RawCandidate;
import com.songbook.ensemble.model.SourceResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Turns a source response body into typed candidates.
 * <p>
 * The body is either a JSON array of records or an object holding that array under
 * one of {@link #WRAPPER_KEYS}. Each record must resolve isbn, similarity, title,
 * author and description through the aliases below; records that do not are
 * dropped and counted.
 */
@Slf4j
@Component
public class SourceResponseParser {

    static final List<String> WRAPPER_KEYS = List.of("results", "recommendations", "books", "items");

    static final List<String> KEY_FIELDS = List.of("isbn", "isbn13", "isbn10");
    static final List<String> SCORE_FIELDS = List.of("similarity", "similarity_score", "score");
    static final List<String> TITLE_FIELDS = List.of("title", "book_title");
    static final List<String> AUTHOR_FIELDS = List.of("author", "authors");
    static final List<String> DESCRIPTION_FIELDS = List.of("description", "summary");

    public SourceResult parse(String sourceName, JsonNode body) {
        JsonNode records = locateRecords(sourceName, body);

        List<RawCandidate> candidates = new ArrayList<>(records.size());
        int dropped = 0;
        for (JsonNode record : records) {
            Optional<RawCandidate> candidate = toCandidate(record);
            if (candidate.isPresent()) {
                candidates.add(candidate.get());
            } else {
                dropped++;
            }
        }

        if (candidates.isEmpty() && dropped > 0) {
            throw new SourceSchemaException(sourceName,
                "none of the " + dropped + " records carries isbn, similarity, title, author and description");
        }
        if (dropped > 0) {
            log.warn("Source {}: dropped {} of {} records with missing or invalid fields",
                sourceName, dropped, records.size());
        }

        return SourceResult.raw(sourceName, candidates, dropped);
    }

    private JsonNode locateRecords(String sourceName, JsonNode body) {
        if (body == null || body.isMissingNode() || body.isNull()) {
            throw new SourceSchemaException(sourceName, "response body is empty");
        }
        if (body.isArray()) {
            return body;
        }
        if (body.isObject()) {
            for (String key : WRAPPER_KEYS) {
                JsonNode candidateList = body.get(key);
                if (candidateList != null && candidateList.isArray()) {
                    return candidateList;
                }
            }
            List<String> fields = new ArrayList<>();
            body.fieldNames().forEachRemaining(fields::add);
            throw new SourceSchemaException(sourceName,
                "response object has no list under " + WRAPPER_KEYS + "; fields present: " + fields);
        }
        throw new SourceSchemaException(sourceName, "unexpected response type " + body.getNodeType());
    }

    private Optional<RawCandidate> toCandidate(JsonNode record) {
        if (record == null || !record.isObject()) {
            return Optional.empty();
        }

        JsonNode key = firstPresent(record, KEY_FIELDS);
        JsonNode score = firstPresent(record, SCORE_FIELDS);
        JsonNode title = firstPresent(record, TITLE_FIELDS);
        JsonNode author = firstPresent(record, AUTHOR_FIELDS);
        JsonNode description = firstPresent(record, DESCRIPTION_FIELDS);
        if (key == null || score == null || title == null || author == null || description == null) {
            return Optional.empty();
        }

        Optional<String> canonicalKey = readKey(key);
        Optional<Double> rawScore = readScore(score);
        if (canonicalKey.isEmpty() || rawScore.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new RawCandidate(
            canonicalKey.get(),
            readText(title),
            readText(author),
            readText(description),
            rawScore.get()
        ));
    }

    /**
     * First alias carrying a non-null value; an explicit null only when every present alias is null.
     */
    private JsonNode firstPresent(JsonNode record, List<String> aliases) {
        JsonNode explicitNull = null;
        for (String alias : aliases) {
            JsonNode value = record.get(alias);
            if (value == null) {
                continue;
            }
            if (!value.isNull()) {
                return value;
            }
            if (explicitNull == null) {
                explicitNull = value;
            }
        }
        return explicitNull;
    }

    private Optional<String> readKey(JsonNode node) {
        String key;
        if (node.isTextual()) {
            key = node.textValue().trim();
        } else if (node.isIntegralNumber()) {
            key = node.bigIntegerValue().toString();
        } else {
            return Optional.empty();
        }
        return key.isEmpty() ? Optional.empty() : Optional.of(key);
    }

    private Optional<Double> readScore(JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    private String readText(JsonNode node) {
        if (node.isNull()) {
            return "";
        }
        if (node.isArray()) {
            return StreamSupport.stream(node.spliterator(), false)
                .filter(element -> !element.isNull())
                .map(JsonNode::asText)
                .map(String::trim)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining(", "));
        }
        return node.asText().trim();
    }
}
