package com.flamingo.ai.checklist.config;

import com.flamingo.ai.checklist.agent.ActionExtractionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Action extraction agent. One call per document node, structured JSON output. */
  @Bean
  public ActionExtractionAgent actionExtractionAgent(ChatModel chatModel) {
    return AiServices.builder(ActionExtractionAgent.class).chatModel(chatModel).build();
  }
}
