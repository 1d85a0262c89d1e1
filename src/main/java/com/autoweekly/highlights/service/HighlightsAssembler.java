package com.autoweekly.highlights.service;

import com.autoweekly.highlights.config.PipelineSettings;
import com.autoweekly.highlights.model.HighlightEntry;
import com.autoweekly.highlights.model.SummaryRef;
import com.autoweekly.highlights.store.ArtifactKind;
import com.autoweekly.highlights.store.ArtifactStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Builds the final highlights document from summary artifacts.
 *
 * <p>Each summary is normalized and rendered as:
 *
 * <pre>
 *
 * **2025-09-10,BigBank: Title**
 *
 * - point one
 * - point two
 *
 * [Report Link](https://.../2025-09-12/abc123.pdf)
 *
 * </pre>
 *
 * under a single title line. The file is rewritten on every run.
 */
@Log4j2
public class HighlightsAssembler {

  static final Comparator<HighlightEntry> SORTED_ORDER =
      Comparator.comparing(HighlightEntry::getDate, Comparator.reverseOrder())
          .thenComparing(HighlightEntry::getHeader)
          .thenComparing(HighlightEntry::getItemId);

  private final ArtifactStore store;
  private final HeaderDateNormalizer normalizer;
  private final PipelineSettings settings;

  public HighlightsAssembler(
      ArtifactStore store, HeaderDateNormalizer normalizer, PipelineSettings settings) {
    this.store = Objects.requireNonNull(store);
    this.normalizer = Objects.requireNonNull(normalizer);
    this.settings = Objects.requireNonNull(settings);
  }

  /**
   * Normalizes, orders, renders and writes the given summaries.
   *
   * @return the written document, or empty when no summary could be read
   */
  public Optional<Path> assemble(List<SummaryRef> summaries) throws IOException {
    List<HighlightEntry> entries = toEntries(summaries);
    if (entries.isEmpty()) {
      log.warn("assemble.skip reason=noReadableSummaries candidates={}", summaries.size());
      return Optional.empty();
    }
    Path target = settings.finalDocumentPath();
    store.writeAtomically(target, render(entries));
    log.info(
        "assemble.done entries={} order={} file={}",
        entries.size(),
        settings.getRenderOrder(),
        target);
    return Optional.of(target);
  }

  /** Normalized entries in render order; unreadable summaries are skipped. */
  public List<HighlightEntry> toEntries(List<SummaryRef> summaries) {
    List<HighlightEntry> entries = new ArrayList<>(summaries.size());
    for (SummaryRef ref : summaries) {
      String summary;
      try {
        summary = store.read(ref.getSummaryPath());
      } catch (IOException e) {
        log.error("assemble.read.failed itemId={} msg={}", ref.getItemId(), e.getMessage());
        continue;
      }
      String cleaned = store.readIfPresent(ArtifactKind.CLEANED, ref.getItemId()).orElse(null);
      entries.add(normalizer.normalize(ref.getItemId(), summary, cleaned));
    }
    if (settings.getRenderOrder() == PipelineSettings.RenderOrder.SORTED) {
      entries.sort(SORTED_ORDER);
    }
    return entries;
  }

  public String render(List<HighlightEntry> entries) {
    List<String> lines = new ArrayList<>();
    lines.add(settings.title());
    lines.add("");
    for (HighlightEntry entry : entries) {
      lines.add("");
      lines.add("**" + entry.getHeader() + "**");
      lines.add("");
      if (!entry.getBullets().isEmpty()) {
        lines.addAll(entry.getBullets());
        lines.add("");
      }
      lines.add("[Report Link](" + entry.getLink() + ")");
      lines.add("");
    }
    return String.join("\n", lines).stripTrailing() + "\n";
  }
}
