package com.songbook.ensemble.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat model behind the explanation endpoint. Only created when a Gemini key is set.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.gemini", name = "api-key")
public class LangChainConfig {

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.model:gemini-2.0-flash}")
    private String modelName;

    @Value("${app.gemini.timeout:60s}")
    private Duration timeout;

    @Bean
    public ChatModel chatLanguageModel() {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .timeout(timeout)
            .maxRetries(2)
            .logRequests(true)
            .logResponses(true)
            .build();
    }
}
