package com.autoweekly.highlights.service;

import com.autoweekly.highlights.config.PipelineSettings;
import com.autoweekly.highlights.model.ItemOutcome;
import com.autoweekly.highlights.model.ItemOutcome.Phase;
import com.autoweekly.highlights.model.StagedItem;
import com.autoweekly.highlights.store.ArtifactKind;
import com.autoweekly.highlights.store.ArtifactStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Runs one staged item end to end.
 *
 * <ol>
 *   <li>Convert the stored document to text (skipped when the text artifact exists).
 *   <li>Clean the text at the boilerplate boundary (skipped when the cleaned artifact exists).
 *   <li>Summarize the cleaned text (skipped when the summary artifact exists).
 * </ol>
 *
 * <p>{@link #process} never throws: any failure is logged and reported as a failed {@link
 * ItemOutcome}, and the item leaves no summary behind. Instances are shared by all workers and hold
 * no per-item state.
 */
@Log4j2
public class ItemProcessor {

  private final ArtifactStore store;
  private final DocumentTextExtractor extractor;
  private final BoilerplateCleaner cleaner;
  private final TextGenerationClient summarizer;
  private final ExternalCallExecutor calls;
  private final PipelineSettings settings;

  public ItemProcessor(
      ArtifactStore store,
      DocumentTextExtractor extractor,
      BoilerplateCleaner cleaner,
      TextGenerationClient summarizer,
      ExternalCallExecutor calls,
      PipelineSettings settings) {
    this.store = Objects.requireNonNull(store);
    this.extractor = Objects.requireNonNull(extractor);
    this.cleaner = Objects.requireNonNull(cleaner);
    this.summarizer = Objects.requireNonNull(summarizer);
    this.calls = Objects.requireNonNull(calls);
    this.settings = Objects.requireNonNull(settings);
  }

  public ItemOutcome process(StagedItem item) {
    String itemId = item.getItemId();
    long t0 = System.nanoTime();
    try {
      convert(item);
      clean(itemId);
      Path summary = summarize(itemId);
      log.info(
          "item.success itemId={} durationMs={}", itemId, (System.nanoTime() - t0) / 1_000_000);
      return ItemOutcome.completed(itemId, summary);
    } catch (PipelineStepException e) {
      log.error("item.failed itemId={} phase={} msg={}", itemId, e.getPhase(), e.getMessage());
      return ItemOutcome.failed(itemId, e.getPhase(), e.getMessage());
    } catch (RuntimeException e) {
      log.error("item.failed itemId={} msg={}", itemId, e.getMessage(), e);
      return ItemOutcome.failed(itemId, null, String.valueOf(e.getMessage()));
    }
  }

  Path convert(StagedItem item) {
    String itemId = item.getItemId();
    if (store.exists(ArtifactKind.TEXT, itemId)) {
      log.info("convert.skip itemId={} reason=exists", itemId);
      return store.path(ArtifactKind.TEXT, itemId);
    }
    Path source = item.getStoredPath();
    log.info("convert.start itemId={} file={}", itemId, source.getFileName());
    try {
      String text = calls.call("convert " + itemId, () -> extractor.extractText(source));
      return store.write(
          ArtifactKind.TEXT,
          itemId,
          source.getFileName() + "\n\n" + (text == null ? "" : text));
    } catch (ExternalCallException | IOException e) {
      throw new PipelineStepException(itemId, Phase.CONVERT, e.getMessage(), e);
    }
  }

  Path clean(String itemId) {
    if (store.exists(ArtifactKind.CLEANED, itemId)) {
      log.debug("clean.skip itemId={} reason=exists", itemId);
      return store.path(ArtifactKind.CLEANED, itemId);
    }
    try {
      String converted = store.read(store.path(ArtifactKind.TEXT, itemId));
      String cleaned = cleaner.clean(converted);
      log.info(
          "clean.done itemId={} chars={} keptChars={}",
          itemId,
          converted.length(),
          cleaned.length());
      return store.write(ArtifactKind.CLEANED, itemId, cleaned);
    } catch (IOException e) {
      throw new PipelineStepException(itemId, Phase.CLEAN, e.getMessage(), e);
    }
  }

  Path summarize(String itemId) {
    if (store.exists(ArtifactKind.SUMMARY, itemId)) {
      log.info("summarize.skip itemId={} reason=exists", itemId);
      return store.path(ArtifactKind.SUMMARY, itemId);
    }
    String content;
    try {
      content = store.read(store.path(ArtifactKind.CLEANED, itemId));
    } catch (IOException e) {
      throw new PipelineStepException(itemId, Phase.SUMMARIZE, e.getMessage(), e);
    }
    if (content.isBlank()) {
      throw new PipelineStepException(itemId, Phase.SUMMARIZE, "cleaned content is empty");
    }

    log.info("summarize.start itemId={} chars={}", itemId, content.length());
    String summary;
    try {
      summary =
          calls.call(
              "summarize " + itemId,
              () -> summarizer.generate(settings.getSummaryPrompt(), content));
    } catch (ExternalCallException e) {
      throw new PipelineStepException(itemId, Phase.SUMMARIZE, e.getMessage(), e);
    }

    if (summary == null || summary.strip().length() < settings.getMinSummaryLength()) {
      throw new PipelineStepException(
          itemId,
          Phase.SUMMARIZE,
          "summary empty or shorter than " + settings.getMinSummaryLength() + " chars");
    }
    try {
      return store.write(ArtifactKind.SUMMARY, itemId, summary);
    } catch (IOException e) {
      throw new PipelineStepException(itemId, Phase.SUMMARIZE, e.getMessage(), e);
    }
  }
}
