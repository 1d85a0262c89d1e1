package com.autoweekly.highlights.service;

/**
 * Single-shot text-in/text-out model call used for summarization and translation.
 *
 * <p>Implementations may return {@code null} or an empty string when the model produced nothing;
 * callers validate the result.
 */
@FunctionalInterface
public interface TextGenerationClient {

  String generate(String instructions, String content);
}
