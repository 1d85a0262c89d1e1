package com.autoweekly.highlights.service;

import com.autoweekly.highlights.model.ItemOutcome;
import lombok.Getter;

/** A per-item phase that could not produce its artifact. */
@Getter
public class PipelineStepException extends RuntimeException {

  private final String itemId;
  private final ItemOutcome.Phase phase;

  public PipelineStepException(String itemId, ItemOutcome.Phase phase, String message) {
    super(message);
    this.itemId = itemId;
    this.phase = phase;
  }

  public PipelineStepException(
      String itemId, ItemOutcome.Phase phase, String message, Throwable cause) {
    super(message, cause);
    this.itemId = itemId;
    this.phase = phase;
  }
}
