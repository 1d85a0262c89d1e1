package com.autoweekly.highlights.service;

import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link TextGenerationClient} backed by a Spring AI {@link ChatClient}.
 *
 * <p>The instructions go in as the system message and the document text as the user message.
 */
@Log4j2
public class ChatClientTextGenerationClient implements TextGenerationClient {

  private final ChatClient chat;

  public ChatClientTextGenerationClient(ChatClient.Builder builder) {
    this.chat = Objects.requireNonNull(builder, "builder must not be null").build();
  }

  @Override
  public String generate(String instructions, String content) {
    log.debug(
        "chat.request systemChars={} userChars={}",
        instructions == null ? 0 : instructions.length(),
        content == null ? 0 : content.length());
    return chat.prompt().system(instructions).user(content).call().content();
  }
}
