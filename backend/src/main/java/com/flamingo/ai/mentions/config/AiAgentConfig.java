package com.flamingo.ai.mentions.config;

import com.flamingo.ai.mentions.agent.MentionExtractionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agents are interfaces annotated with @SystemMessage/@UserMessage; AiServices.builder() builds
 * the implementation.
 */
@Configuration
public class AiAgentConfig {

  /** Mention extraction agent backing the chunk extraction backend. */
  @Bean
  public MentionExtractionAgent mentionExtractionAgent(ChatModel chatModel) {
    return AiServices.builder(MentionExtractionAgent.class).chatModel(chatModel).build();
  }
}
