package com.salesanalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring AI configuration for the Claude ChatClient used by the live sentiment scorer.
 *
 * Only active with {@code app.ai.scorer.enabled=true}; without it no model beans
 * exist and the scorer reports itself unavailable, so streams run on synthetic samples.
 *
 * Usage:
 * <pre>{@code
 * String json = claudeClient.prompt()
 *     .system(SYSTEM_PROMPT)
 *     .user(customerUtterances)
 *     .call()
 *     .content();
 * }</pre>
 *
 * @see com.salesanalytics.sentiment.ClaudeSentimentScorer
 */
@Configuration
@ConditionalOnProperty(name = "app.ai.scorer.enabled", havingValue = "true")
@Slf4j
public class SpringAIConfig {

    @Value("${spring.ai.anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${spring.ai.anthropic.api-key}")
    private String anthropicApiKey;

    @Value("${spring.ai.anthropic.chat.options.model:claude-3-5-haiku-latest}")
    private String claudeModel;

    @Value("${spring.ai.anthropic.chat.options.max-tokens:200}")
    private int maxTokens;

    /**
     * Anthropic chat model for sentiment scoring. Short answers only, so a small
     * token ceiling keeps each tick cheap.
     */
    @Bean
    public AnthropicChatModel claudeChatModel() {
        log.info("Configuring Claude ChatModel: model={}, baseUrl={}", claudeModel, anthropicBaseUrl);

        AnthropicApi anthropicApi = AnthropicApi.builder()
                .baseUrl(anthropicBaseUrl)
                .apiKey(anthropicApiKey)
                .build();

        AnthropicChatOptions options = AnthropicChatOptions.builder()
                .model(claudeModel)
                .maxTokens(maxTokens)
                .temperature(0.0)
                .build();

        return AnthropicChatModel.builder()
                .anthropicApi(anthropicApi)
                .defaultOptions(options)
                .build();
    }

    @Bean
    public ChatClient claudeClient(AnthropicChatModel claudeChatModel) {
        log.debug("Creating Claude ChatClient bean");
        return ChatClient.create(claudeChatModel);
    }
}
