package com.autoweekly.highlights.service;

import java.io.IOException;
import java.nio.file.Path;

/** Conversion service: turns one stored document into plain text. No retries at this layer. */
@FunctionalInterface
public interface DocumentTextExtractor {

  String extractText(Path document) throws IOException;
}
