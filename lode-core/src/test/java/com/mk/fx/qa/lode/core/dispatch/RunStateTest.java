package com.mk.fx.qa.lode.core.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.lode.core.metrics.ResultAggregator;
import com.mk.fx.qa.lode.core.outcome.Outcome;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RunStateTest {

  @Test
  void claim_handsOutEachUnitOnce_underContention() throws Exception {
    int total = 10_000;
    var state = new RunState("run", total, new ResultAggregator("run", total, null));
    Set<Integer> claimed = ConcurrentHashMap.newKeySet();
    AtomicInteger exhausted = new AtomicInteger();
    var start = new CountDownLatch(1);
    List<Thread> threads = new ArrayList<>();
    for (int t = 0; t < 8; t++) {
      Thread thread =
          new Thread(
              () -> {
                try {
                  start.await();
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                  return;
                }
                int attempt;
                while ((attempt = state.claim()) >= 0) {
                  claimed.add(attempt);
                }
                exhausted.incrementAndGet();
              });
      threads.add(thread);
      thread.start();
    }
    start.countDown();
    for (Thread thread : threads) {
      thread.join(TimeUnit.SECONDS.toMillis(10));
    }

    assertEquals(8, exhausted.get());
    assertEquals(total, claimed.size());
    assertEquals(0, state.remaining());
    assertEquals(total, state.inFlight());
  }

  @Test
  void complete_releasesInFlightAndTracksElapsed() {
    var state = new RunState("run", 2, new ResultAggregator("run", 2, null));
    assertEquals(Duration.ZERO, state.elapsed());
    assertNull(state.startedAt());

    assertEquals(0, state.claim());
    assertEquals(1, state.claim());
    assertEquals(-1, state.claim());
    assertEquals(0, state.remaining());
    assertEquals(2, state.peakInFlight());

    state.complete(Outcome.success(Duration.ofMillis(1)));
    state.complete(Outcome.success(Duration.ofMillis(1)));

    assertEquals(0, state.inFlight());
    assertNotNull(state.startedAt());
    assertFalse(state.elapsed().isNegative());
    assertEquals(2, state.aggregator().completed());
  }

  @Test
  void abort_stopsFurtherClaims() {
    var state = new RunState("run", 5, new ResultAggregator("run", 5, null));
    assertEquals(0, state.claim());
    state.abort();
    assertTrue(state.isAborted());
    assertEquals(-1, state.claim());
    assertEquals(4, state.remaining());
  }

  @Test
  void constructor_rejectsEmptyRun() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new RunState("run", 0, new ResultAggregator("run", 0, null)));
  }
}
