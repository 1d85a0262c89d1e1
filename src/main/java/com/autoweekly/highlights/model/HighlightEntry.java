package com.autoweekly.highlights.model;

import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Normalized form of one summary artifact.
 *
 * <p>Derived on every assembly and never persisted on its own. {@code header} is always in the
 * canonical {@code YYYY-MM-DD,<source>: <title>} shape (or one of its degraded forms when source
 * or title are empty), and {@code date} is the date rendered at its start.
 */
@Value
@Builder
public class HighlightEntry {

  String itemId;

  String header;

  LocalDate date;

  @Singular List<String> bullets;

  String link;
}
