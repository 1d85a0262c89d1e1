package com.autoweekly.highlights.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chat model configuration for Spring AI.
 *
 * <p>Provides the {@link ChatClient.Builder} used for report summaries and for translating the
 * final document. The {@link OpenAiChatModel} itself is autoconfigured from {@code
 * spring.ai.openai.*} (api key, base url, model); any OpenAI-compatible endpoint works.
 */
@Configuration
public class ChatGptConfig {

  @Bean
  public ChatClient.Builder chatClientBuilder(OpenAiChatModel openAiChatModel) {
    return ChatClient.builder(openAiChatModel);
  }
}
