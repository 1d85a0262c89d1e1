package com.autoweekly.highlights.model;

import java.nio.file.Path;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What a single pipeline invocation did.
 *
 * <p>{@code finalDocument} is {@code null} when nothing could be assembled. {@code outcomes} is in
 * fan-in (completion) order and is empty in {@link Mode#RECOVERED_SUMMARIES} runs, where no item
 * was processed.
 */
@Value
@Builder
public class PipelineRunReport {

  /** How the set of summaries for this run was obtained. */
  public enum Mode {
    /** New inbox files were staged and processed. */
    FRESH,
    /** Inbox was empty; summaries already on disk were reused. */
    RECOVERED_SUMMARIES,
    /** Inbox was empty and no summaries existed; items were re-derived from the content store. */
    RECOVERED_STORE,
    /** Nothing to stage, reuse or re-derive. */
    NOTHING
  }

  String period;

  Mode mode;

  int stagedCount;

  @Singular List<ItemOutcome> outcomes;

  Path finalDocument;

  Path translatedDocument;

  public long failedCount() {
    return outcomes.stream().filter(o -> !o.isCompleted()).count();
  }

  public long succeededCount() {
    return outcomes.stream().filter(ItemOutcome::isCompleted).count();
  }
}
