package com.autoweekly.highlights.runner;

import com.autoweekly.highlights.model.ItemOutcome;
import com.autoweekly.highlights.model.PipelineRunReport;
import com.autoweekly.highlights.service.HighlightsPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/** Runs the highlights pipeline once at startup and logs what the run produced. */
@Log4j2
@RequiredArgsConstructor
public class HighlightsRunner implements ApplicationRunner {

  private final HighlightsPipelineService pipeline;

  @Override
  public void run(ApplicationArguments args) {
    PipelineRunReport report = pipeline.run();

    for (ItemOutcome outcome : report.getOutcomes()) {
      if (!outcome.isCompleted()) {
        log.warn(
            "runner.item.failed itemId={} phase={} msg={}",
            outcome.getItemId(),
            outcome.getFailedPhase(),
            outcome.getMessage());
      }
    }

    if (report.getFinalDocument() == null) {
      log.info(
          "runner.finish period={} mode={} result=nothing to assemble",
          report.getPeriod(),
          report.getMode());
      return;
    }
    log.info(
        "runner.finish period={} mode={} document={} translated={}",
        report.getPeriod(),
        report.getMode(),
        report.getFinalDocument(),
        report.getTranslatedDocument() != null);
  }
}
