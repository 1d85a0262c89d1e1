package com.autoweekly.highlights.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import org.junit.jupiter.api.Test;

class ExternalCallExecutorTest {

  @Test
  void returnsResultOfTheCall() {
    try (ExternalCallExecutor calls = new ExternalCallExecutor(Duration.ofSeconds(5), 2)) {
      assertEquals("ok", calls.call("op", () -> "ok"));
    }
  }

  @Test
  void failureIsWrappedAndNotMarkedAsTimeout() {
    try (ExternalCallExecutor calls = new ExternalCallExecutor(Duration.ofSeconds(5), 2)) {
      ExternalCallException e =
          assertThrows(
              ExternalCallException.class,
              () ->
                  calls.call(
                      "convert a1",
                      () -> {
                        throw new IllegalStateException("bad xref");
                      }));

      assertTrue(e.getMessage().contains("bad xref"));
      assertFalse(e.isTimedOut());
    }
  }

  @Test
  void callsThatIgnoreInterruptsNeverExceedTheBound() {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger maxRunning = new AtomicInteger();
    CountDownLatch release = new CountDownLatch(1);

    try (ExternalCallExecutor calls = new ExternalCallExecutor(Duration.ofMillis(100), 2)) {
      for (int i = 0; i < 5; i++) {
        ExternalCallException e =
            assertThrows(
                ExternalCallException.class,
                () ->
                    calls.call(
                        "stuck",
                        () -> {
                          maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                          try {
                            // parkNanos returns on interrupt without clearing it; keep waiting
                            while (release.getCount() > 0) {
                              LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(5));
                            }
                            return "late";
                          } finally {
                            running.decrementAndGet();
                          }
                        }));
        assertTrue(e.isTimedOut());
      }

      assertEquals(2, maxRunning.get());
      release.countDown();
    }
  }
}
