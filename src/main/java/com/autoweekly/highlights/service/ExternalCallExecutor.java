package com.autoweekly.highlights.service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs blocking calls to external services under a fixed per-call timeout.
 *
 * <p>The calling worker waits at most {@code timeout}; on expiry the call is cancelled with an
 * interrupt and reported as an {@link ExternalCallException} with {@code timedOut=true}. Any
 * exception thrown by the call itself is rethrown wrapped in the same type.
 *
 * <p>Calls run on a fixed pool of {@code maxConcurrentCalls} threads. A call that ignores the
 * interrupt keeps its thread until it returns, so later calls queue behind it instead of exceeding
 * the bound; time spent queued counts against their timeout.
 */
@Log4j2
public class ExternalCallExecutor implements AutoCloseable {

  private final Duration timeout;
  private final ThreadPoolTaskExecutor calls;

  public ExternalCallExecutor(Duration timeout, int maxConcurrentCalls) {
    this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    int size = Math.max(1, maxConcurrentCalls);

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setThreadNamePrefix("highlights-call-");
    executor.setDaemon(true);
    executor.initialize();
    this.calls = executor;
  }

  public <T> T call(String operation, Callable<T> call) {
    long t0 = System.nanoTime();
    Future<T> future = calls.submit(call);
    try {
      T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      log.debug(
          "external.call op={} durationMs={}", operation, (System.nanoTime() - t0) / 1_000_000);
      return result;
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("external.timeout op={} timeoutMs={}", operation, timeout.toMillis());
      throw new ExternalCallException(
          operation + " timed out after " + timeout.toMillis() + " ms", e, true);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      throw new ExternalCallException(operation + " failed: " + cause.getMessage(), cause, false);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ExternalCallException(operation + " interrupted", e, false);
    }
  }

  @Override
  public void close() {
    calls.shutdown();
  }
}
