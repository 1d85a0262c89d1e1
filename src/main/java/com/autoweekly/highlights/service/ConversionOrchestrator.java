package com.autoweekly.highlights.service;

import com.autoweekly.highlights.model.ItemOutcome;
import com.autoweekly.highlights.model.StagedItem;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import lombok.extern.log4j.Log4j2;

/**
 * Fans staged items out over the bounded worker pool and collects their outcomes.
 *
 * <p>One task per item; items share nothing but the filesystem, where every path is keyed by the
 * item's own id. Outcomes are returned in completion order, not submission order.
 */
@Log4j2
public class ConversionOrchestrator {

  private final ItemProcessor processor;
  private final Executor workers;

  public ConversionOrchestrator(ItemProcessor processor, Executor workers) {
    this.processor = Objects.requireNonNull(processor);
    this.workers = Objects.requireNonNull(workers);
  }

  public List<ItemOutcome> processAll(List<StagedItem> items) {
    if (items.isEmpty()) {
      return List.of();
    }
    log.info("orchestrator.start items={}", items.size());

    CompletionService<ItemOutcome> completion = new ExecutorCompletionService<>(workers);
    Map<Future<ItemOutcome>, String> submitted = new IdentityHashMap<>();
    for (StagedItem item : items) {
      submitted.put(completion.submit(() -> processor.process(item)), item.getItemId());
    }

    List<ItemOutcome> outcomes = new ArrayList<>(items.size());
    for (int i = 0; i < submitted.size(); i++) {
      Future<ItemOutcome> done;
      try {
        done = completion.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        submitted.keySet().forEach(f -> f.cancel(true));
        throw new IllegalStateException("Interrupted while waiting for workers", e);
      }
      String itemId = submitted.get(done);
      try {
        outcomes.add(done.get());
      } catch (ExecutionException e) {
        log.error("orchestrator.worker.error itemId={} msg={}", itemId, e.getMessage(), e);
        outcomes.add(ItemOutcome.failed(itemId, null, String.valueOf(e.getCause())));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while collecting worker results", e);
      }
    }

    long ok = outcomes.stream().filter(ItemOutcome::isCompleted).count();
    log.info(
        "orchestrator.finish items={} succeeded={} failed={}",
        items.size(),
        ok,
        outcomes.size() - ok);
    return outcomes;
  }
}
