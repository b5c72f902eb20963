package com.songbook.ensemble.service;

import com.songbook.ensemble.model.AggregatedItem;
import com.songbook.ensemble.model.EnsembleResult;
import com.songbook.ensemble.model.RawCandidate;
import com.songbook.ensemble.model.SourceResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds the comparative prompt: the playlist, the leading picks of every source and
 * the merged ranking, followed by the reviewing instructions.
 */
@Component
public class ExplanationPromptBuilder {

    static final int DESCRIPTION_LIMIT = 180;

    private static final String PROMPT_TEMPLATE =
        """
            Role: You are an expert bookseller comparing recommendations produced by several models.
            Task: Comment on and synthesise the most relevant recommendations for the playlist below.

            Playlist (song ids):
            %s

            Recommendations by model:
            %s

            Merged ranking:
            %s

            Instructions:
            - Compare the models: point out strong picks and where they diverge.
            - Cite 2-3 relevant recommendations per model with a short reason.
            - Flag doubtful or off-topic suggestions.
            - Finish with 3 books to prioritise across all models, each with a concise justification.

            Output: answer in fewer than 180 words, in the clear and direct tone of a bookseller's advice.
            """;

    @Value("${app.explanation.max-per-source:5}")
    private int maxPerSource = 5;

    public String build(List<Object> playlistIds, EnsembleResult result) {
        return String.format(PROMPT_TEMPLATE,
            formatPlaylist(playlistIds),
            formatSources(result.sourceResults()),
            formatRanking(result.items()));
    }

    private String formatPlaylist(List<Object> playlistIds) {
        if (playlistIds == null || playlistIds.isEmpty()) {
            return "- (empty playlist)";
        }
        return playlistIds.stream()
            .map(id -> "- " + id)
            .collect(Collectors.joining("\n"));
    }

    private String formatSources(List<SourceResult> sources) {
        String blocks = sources.stream()
            .filter(source -> !source.candidates().isEmpty())
            .map(source -> source.sourceName() + ":\n" + source.candidates().stream()
                .limit(maxPerSource)
                .map(this::formatCandidate)
                .collect(Collectors.joining("\n")))
            .collect(Collectors.joining("\n\n"));
        return blocks.isEmpty() ? "- no recommendation available." : blocks;
    }

    private String formatCandidate(RawCandidate candidate) {
        String title = candidate.title().isBlank() ? "Unknown title" : candidate.title();
        String author = candidate.author().isBlank() ? "Unknown author" : candidate.author();
        return String.format(Locale.ROOT, "- %s, %s (score: %.2f): %s",
            title, author, candidate.rawScore(), truncate(candidate.description()));
    }

    private String formatRanking(List<AggregatedItem> items) {
        return items.stream()
            .map(item -> String.format(Locale.ROOT, "- %s, %s (ensemble score: %.2f, models: %s)",
                item.title(), item.author(), item.finalScore(), String.join(", ", item.contributingSources())))
            .collect(Collectors.joining("\n"));
    }

    static String truncate(String description) {
        String text = description == null ? "" : description.strip();
        if (text.length() <= DESCRIPTION_LIMIT) {
            return text;
        }
        String head = text.substring(0, DESCRIPTION_LIMIT);
        int lastSpace = head.lastIndexOf(' ');
        return (lastSpace > 0 ? head.substring(0, lastSpace) : head) + "...";
    }
}
