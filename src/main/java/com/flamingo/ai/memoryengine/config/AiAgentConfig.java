package com.flamingo.ai.memoryengine.config;

import com.flamingo.ai.memoryengine.agent.EntityExtractionAgent;
import com.flamingo.ai.memoryengine.agent.MemorySummaryAgent;
import com.flamingo.ai.memoryengine.agent.QueryIntentAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the AI agents behind the language-model service.
 *
 * <p>Agents with structured output use the JSON-mode {@code chatModel}; free-text agents use
 * {@code textChatModel}.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public EntityExtractionAgent entityExtractionAgent(ChatModel chatModel) {
    return AiServices.builder(EntityExtractionAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public QueryIntentAgent queryIntentAgent(ChatModel chatModel) {
    return AiServices.builder(QueryIntentAgent.class).chatModel(chatModel).build();
  }

  /** Summary agent for long records and consolidation groups. */
  @Bean
  public MemorySummaryAgent memorySummaryAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(MemorySummaryAgent.class).chatModel(textChatModel).build();
  }
}
