package com.flamingo.ai.argumentation.config;

import com.flamingo.ai.argumentation.agent.ArgumentRecommendationAgent;
import com.flamingo.ai.argumentation.agent.ComponentSuggestionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the suggestion agents built with LangChain4j AI Services.
 *
 * <p>Pattern: agent interfaces declare @SystemMessage/@UserMessage, concrete implementations come
 * from AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Per-component suggestion agent. Free-text output, one or two sentences. */
  @Bean
  public ComponentSuggestionAgent componentSuggestionAgent(ChatModel chatModel) {
    return AiServices.builder(ComponentSuggestionAgent.class).chatModel(chatModel).build();
  }

  /** General recommendation agent covering all extracted components at once. */
  @Bean
  public ArgumentRecommendationAgent argumentRecommendationAgent(ChatModel chatModel) {
    return AiServices.builder(ArgumentRecommendationAgent.class).chatModel(chatModel).build();
  }
}
