package com.autoweekly.highlights.service;

import com.autoweekly.highlights.config.PipelineSettings;
import com.autoweekly.highlights.model.ItemOutcome;
import com.autoweekly.highlights.model.PipelineRunReport;
import com.autoweekly.highlights.model.PipelineRunReport.Mode;
import com.autoweekly.highlights.model.StagedItem;
import com.autoweekly.highlights.model.SummaryRef;
import com.autoweekly.highlights.store.ArtifactStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * HighlightsPipelineService
 *
 * <ol>
 *   <li>Stage inbox files into the content store ({@link ContentStager}), sequentially.
 *   <li>Convert, clean and summarize every staged item on the worker pool ({@link
 *       ConversionOrchestrator}).
 *   <li>Assemble the final document from the successful summaries ({@link HighlightsAssembler}).
 *   <li>Translate the final document ({@link TranslationService}).
 * </ol>
 *
 * <p>When nothing new was staged the run recovers: it rebuilds the document from summaries already
 * on disk, or failing that re-processes the items already in the content store. Items that are
 * processed again skip every phase whose artifact already exists.
 */
@Log4j2
public class HighlightsPipelineService {

  private final ArtifactStore store;
  private final ContentStager stager;
  private final ConversionOrchestrator orchestrator;
  private final HighlightsAssembler assembler;
  private final TranslationService translation;
  private final PipelineSettings settings;

  public HighlightsPipelineService(
      ArtifactStore store,
      ContentStager stager,
      ConversionOrchestrator orchestrator,
      HighlightsAssembler assembler,
      TranslationService translation,
      PipelineSettings settings) {
    this.store = Objects.requireNonNull(store);
    this.stager = Objects.requireNonNull(stager);
    this.orchestrator = Objects.requireNonNull(orchestrator);
    this.assembler = Objects.requireNonNull(assembler);
    this.translation = Objects.requireNonNull(translation);
    this.settings = Objects.requireNonNull(settings);
  }

  public PipelineRunReport run() {
    String runId = UUID.randomUUID().toString();
    long t0 = System.nanoTime();
    log.info(
        "pipeline.start id={} period={} inbox={} workers={}",
        runId,
        settings.getPeriod(),
        store.inboxDir(),
        settings.getWorkerCount());

    PipelineRunReport.PipelineRunReportBuilder report =
        PipelineRunReport.builder().period(settings.getPeriod());

    try {
      store.ensureDirectories();

      List<StagedItem> staged = stager.stageInbox();
      report.stagedCount(staged.size());

      List<SummaryRef> summaries;
      if (!staged.isEmpty()) {
        report.mode(Mode.FRESH);
        summaries = processItems(staged, report);
      } else {
        summaries = store.listSummaries();
        if (!summaries.isEmpty()) {
          log.info("pipeline.recover source=summaries count={}", summaries.size());
          report.mode(Mode.RECOVERED_SUMMARIES);
        } else {
          List<StagedItem> stored = store.listStoredItems();
          if (stored.isEmpty()) {
            log.info("pipeline.finish id={} reason=nothingToProcess", runId);
            return report.mode(Mode.NOTHING).build();
          }
          log.info("pipeline.recover source=store count={}", stored.size());
          report.mode(Mode.RECOVERED_STORE);
          summaries = processItems(stored, report);
        }
      }

      if (summaries.isEmpty()) {
        log.warn("pipeline.finish id={} reason=noSummaries, nothing to assemble", runId);
        return report.build();
      }

      Optional<Path> document = assembler.assemble(summaries);
      if (document.isEmpty()) {
        return report.build();
      }
      report.finalDocument(document.get());

      if (settings.isTranslationEnabled()) {
        Path translated = settings.translatedDocumentPath();
        if (translation.translate(document.get(), translated)) {
          report.translatedDocument(translated);
        }
      }

      PipelineRunReport done = report.build();
      log.info(
          "pipeline.finish id={} mode={} staged={} succeeded={} failed={} file={} durationMs={}",
          runId,
          done.getMode(),
          done.getStagedCount(),
          done.succeededCount(),
          done.failedCount(),
          done.getFinalDocument(),
          (System.nanoTime() - t0) / 1_000_000);
      return done;

    } catch (IOException e) {
      log.error("pipeline.error id={} msg={}", runId, e.getMessage(), e);
      throw new UncheckedIOException("Highlights pipeline failed for " + settings.getPeriod(), e);
    }
  }

  private List<SummaryRef> processItems(
      List<StagedItem> items, PipelineRunReport.PipelineRunReportBuilder report) {
    List<ItemOutcome> outcomes = orchestrator.processAll(items);
    report.outcomes(outcomes);
    outcomes.stream()
        .filter(o -> !o.isCompleted())
        .forEach(
            o ->
                log.warn(
                    "pipeline.item.dropped itemId={} phase={} msg={}",
                    o.getItemId(),
                    o.getFailedPhase(),
                    o.getMessage()));
    return outcomes.stream()
        .filter(ItemOutcome::isCompleted)
        .map(ItemOutcome::toSummaryRef)
        .collect(Collectors.toList());
  }
}
