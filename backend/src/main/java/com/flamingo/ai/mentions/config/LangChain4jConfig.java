package com.flamingo.ai.mentions.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chat model used by the extraction agent. Client-side retries are off: 429s surface to the
 * coordinator, which owns backoff, and other transient failures go through the {@code llm} retry.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String apiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-5-mini}")
  private String extractionModel;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:8192}")
  private int maxOutputTokens;

  @Value("${langchain4j.openai.chat-model.timeout-seconds:120}")
  private int requestTimeoutSeconds;

  @Bean
  public ChatModel chatModel() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "No LLM API key configured for mention extraction; set OPENAI_API_KEY.");
    }

    OpenAiChatModel.OpenAiChatModelBuilder builder =
        OpenAiChatModel.builder()
            .apiKey(apiKey)
            .modelName(extractionModel)
            .maxCompletionTokens(maxOutputTokens)
            .timeout(Duration.ofSeconds(requestTimeoutSeconds))
            .maxRetries(0)
            .responseFormat("json_object");
    if (!baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }

    log.info("Extraction model: {} (max output tokens {})", extractionModel, maxOutputTokens);
    return builder.build();
  }
}
