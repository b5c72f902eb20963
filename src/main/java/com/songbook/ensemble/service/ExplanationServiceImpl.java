package com.songbook.ensemble.service;

import com.songbook.ensemble.exception.ExplanationUnavailableException;
import com.songbook.ensemble.model.EnsembleResult;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class ExplanationServiceImpl implements ExplanationService {

    private final ObjectProvider<ChatModel> chatModel;
    private final ExplanationPromptBuilder promptBuilder;

    public ExplanationServiceImpl(ObjectProvider<ChatModel> chatModel, ExplanationPromptBuilder promptBuilder) {
        this.chatModel = chatModel;
        this.promptBuilder = promptBuilder;
    }

    @Override
    public String explain(List<Object> playlistIds, EnsembleResult result) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            throw new ExplanationUnavailableException("No language model is configured (set app.gemini.api-key)");
        }

        String prompt = promptBuilder.build(playlistIds, result);
        log.debug("Requesting explanation for {} ranked items from {} sources",
            result.items().size(), result.sourceResults().size());

        try {
            String explanation = model.chat(prompt);
            if (explanation == null || explanation.isBlank()) {
                throw new ExplanationUnavailableException("Language model returned an empty explanation");
            }
            return explanation.strip();
        } catch (ExplanationUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.error("Explanation generation failed", e);
            throw new ExplanationUnavailableException("Explanation generation failed", e);
        }
    }
}
