package com.autoweekly.highlights.model;

import java.nio.file.Path;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of running one staged item through convert, clean and summarize.
 *
 * <p>A completed outcome always points at an existing summary artifact. A failed outcome records
 * the phase that failed and never has a summary; the item is left out of the final document.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ItemOutcome {

  /** Per-item processing phases, in execution order. */
  public enum Phase {
    CONVERT,
    CLEAN,
    SUMMARIZE
  }

  /** Terminal status of an item within one run. */
  public enum Status {
    COMPLETED,
    FAILED
  }

  String itemId;
  Status status;
  Phase failedPhase;
  Path summaryPath;
  String message;

  public static ItemOutcome completed(String itemId, Path summaryPath) {
    return new ItemOutcome(itemId, Status.COMPLETED, null, summaryPath, null);
  }

  public static ItemOutcome failed(String itemId, Phase phase, String message) {
    return new ItemOutcome(itemId, Status.FAILED, phase, null, message);
  }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }

  public SummaryRef toSummaryRef() {
    if (!isCompleted()) {
      throw new IllegalStateException("Item " + itemId + " has no summary");
    }
    return new SummaryRef(itemId, summaryPath);
  }
}
