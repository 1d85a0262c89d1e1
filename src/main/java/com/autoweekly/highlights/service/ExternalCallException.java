package com.autoweekly.highlights.service;

/** An external conversion, summarization or translation call that failed or timed out. */
public class ExternalCallException extends RuntimeException {

  private final boolean timedOut;

  public ExternalCallException(String message, Throwable cause, boolean timedOut) {
    super(message, cause);
    this.timedOut = timedOut;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
