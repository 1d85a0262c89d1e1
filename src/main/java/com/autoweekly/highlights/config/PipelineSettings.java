package com.autoweekly.highlights.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable configuration for one pipeline run.
 *
 * <p>All directories are already resolved for {@link #period}: {@code inboxDir} and {@code
 * storeDir} are the per-period folders, {@code workDir} holds the per-phase artifact folders, and
 * {@code finalDir} receives the final documents.
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {

  /** Order in which entries are rendered into the final document. */
  public enum RenderOrder {
    /** Header date descending, then header text, then item id. */
    SORTED,
    /** Whatever order the worker results arrived in. */
    ARRIVAL
  }

  /** Period label used in paths, the title and links. */
  String period;

  /** Trusted anchor date that embedded dates are checked against. */
  LocalDate referenceDate;

  Path inboxDir;
  Path storeDir;
  Path workDir;
  Path finalDir;

  /** Lower-case extensions (without dot) that are staged from the inbox. */
  @Singular Set<String> acceptedExtensions;

  int workerCount;

  Duration callTimeout;

  int minSummaryLength;

  int dateWindowDays;

  RenderOrder renderOrder;

  String linkTemplate;

  String titleTemplate;

  String summaryPrompt;

  String translationPrompt;

  boolean translationEnabled;

  public boolean accepts(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return false;
    }
    return acceptedExtensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  public String title() {
    return titleTemplate.replace("{period}", period);
  }

  public String linkFor(String itemId) {
    return linkTemplate.replace("{period}", period).replace("{itemId}", itemId);
  }

  public Path finalDocumentPath() {
    return finalDir.resolve(period + "_highlights.md");
  }

  public Path translatedDocumentPath() {
    return finalDir.resolve(period + "_highlights_translated.md");
  }
}
