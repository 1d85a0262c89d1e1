package com.autoweekly.highlights.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.autoweekly.highlights.model.ItemOutcome;
import com.autoweekly.highlights.model.ItemOutcome.Phase;
import com.autoweekly.highlights.model.StagedItem;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConversionOrchestratorTest {

  private ExecutorService workers;
  private ItemProcessor processor;

  @BeforeEach
  void setUp() {
    workers = Executors.newFixedThreadPool(3);
    processor = mock(ItemProcessor.class);
  }

  @AfterEach
  void tearDown() {
    workers.shutdownNow();
  }

  @Test
  void oneFailingItemDoesNotAffectTheOthers() {
    when(processor.process(any()))
        .thenAnswer(
            inv -> {
              StagedItem item = inv.getArgument(0);
              if (item.getItemId().equals("a")) {
                return ItemOutcome.failed("a", Phase.CONVERT, "corrupt");
              }
              return ItemOutcome.completed(item.getItemId(), Path.of(item.getItemId() + ".md"));
            });

    List<ItemOutcome> outcomes =
        new ConversionOrchestrator(processor, workers).processAll(items("a", "b", "c"));

    Map<String, ItemOutcome> byId = byId(outcomes);
    assertEquals(3, outcomes.size());
    assertFalse(byId.get("a").isCompleted());
    assertTrue(byId.get("b").isCompleted());
    assertTrue(byId.get("c").isCompleted());
  }

  @Test
  void unexpectedWorkerErrorBecomesFailedOutcome() {
    when(processor.process(any()))
        .thenAnswer(
            inv -> {
              StagedItem item = inv.getArgument(0);
              if (item.getItemId().equals("boom")) {
                throw new IllegalStateException("simulated");
              }
              return ItemOutcome.completed(item.getItemId(), Path.of(item.getItemId() + ".md"));
            });

    List<ItemOutcome> outcomes =
        new ConversionOrchestrator(processor, workers).processAll(items("boom", "ok"));

    Map<String, ItemOutcome> byId = byId(outcomes);
    assertFalse(byId.get("boom").isCompleted());
    assertTrue(byId.get("boom").getMessage().contains("simulated"));
    assertTrue(byId.get("ok").isCompleted());
  }

  @Test
  void outcomesArriveInCompletionOrder() {
    CountDownLatch fastDone = new CountDownLatch(1);
    when(processor.process(any()))
        .thenAnswer(
            inv -> {
              StagedItem item = inv.getArgument(0);
              if (item.getItemId().equals("slow")) {
                assertTrue(fastDone.await(5, TimeUnit.SECONDS));
                Thread.sleep(50);
              } else {
                fastDone.countDown();
              }
              return ItemOutcome.completed(item.getItemId(), Path.of(item.getItemId() + ".md"));
            });

    List<ItemOutcome> outcomes =
        new ConversionOrchestrator(processor, workers).processAll(items("slow", "fast"));

    assertEquals(
        List.of("fast", "slow"),
        outcomes.stream().map(ItemOutcome::getItemId).collect(Collectors.toList()));
  }

  @Test
  void emptyInputSubmitsNothing() {
    assertTrue(new ConversionOrchestrator(processor, workers).processAll(List.of()).isEmpty());
  }

  private static List<StagedItem> items(String... ids) {
    return Arrays.stream(ids)
        .map(id -> StagedItem.builder().itemId(id).storedPath(Path.of(id + ".pdf")).build())
        .collect(Collectors.toList());
  }

  private static Map<String, ItemOutcome> byId(List<ItemOutcome> outcomes) {
    return outcomes.stream().collect(Collectors.toMap(ItemOutcome::getItemId, Function.identity()));
  }
}
