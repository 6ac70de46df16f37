package com.replymail.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * langchain4j model beans
 * - replyChatModel: reply generation
 * - evaluatorChatModel: retrieval decision, temperature 0 for stable output
 * - embeddingModel: retrieval index
 */
@Slf4j
@Configuration
public class LangChainConfig {

    @Bean("replyChatModel")
    public ChatModel replyChatModel(AssistantProperties properties) {
        AssistantProperties.Ai ai = properties.getAi();
        log.info("Reply model: {} (temperature {})", ai.getChatModel(), ai.getReplyTemperature());
        return OpenAiChatModel.builder()
                .apiKey(ai.getOpenaiApiKey())
                .modelName(ai.getChatModel())
                .temperature(ai.getReplyTemperature())
                .timeout(Duration.ofSeconds(ai.getTimeoutSeconds()))
                .build();
    }

    @Bean("evaluatorChatModel")
    public ChatModel evaluatorChatModel(AssistantProperties properties) {
        AssistantProperties.Ai ai = properties.getAi();
        return OpenAiChatModel.builder()
                .apiKey(ai.getOpenaiApiKey())
                .modelName(ai.getChatModel())
                .temperature(ai.getEvaluatorTemperature())
                .timeout(Duration.ofSeconds(ai.getTimeoutSeconds()))
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(AssistantProperties properties) {
        AssistantProperties.Ai ai = properties.getAi();
        log.info("Embedding model: {}", ai.getEmbeddingModel());
        return OpenAiEmbeddingModel.builder()
                .apiKey(ai.getOpenaiApiKey())
                .modelName(ai.getEmbeddingModel())
                .timeout(Duration.ofSeconds(ai.getTimeoutSeconds()))
                .build();
    }
}
