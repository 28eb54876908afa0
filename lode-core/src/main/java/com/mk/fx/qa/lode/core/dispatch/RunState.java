package com.mk.fx.qa.lode.core.dispatch;

import com.mk.fx.qa.lode.core.metrics.ResultAggregator;
import com.mk.fx.qa.lode.core.outcome.Outcome;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared mutable state of one run: the remaining-work countdown, the aggregator and the run
 * timestamps. Owned jointly by all slots of a single run and never reused.
 */
public final class RunState {

  private final String runId;
  private final int totalRequests;
  private final ResultAggregator aggregator;

  private final AtomicInteger remaining;
  private final AtomicBoolean aborted = new AtomicBoolean();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger peakInFlight = new AtomicInteger();
  private final AtomicLong firstDispatchNanos = new AtomicLong();
  private final AtomicLong lastCompletionNanos = new AtomicLong();
  private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();
  private volatile Instant startedAt;

  public RunState(String runId, int totalRequests, ResultAggregator aggregator) {
    if (totalRequests < 1) {
      throw new IllegalArgumentException("totalRequests must be >= 1");
    }
    this.runId = Objects.requireNonNull(runId, "runId");
    this.totalRequests = totalRequests;
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.remaining = new AtomicInteger(totalRequests);
  }

  /**
   * Claims one unit of work. The countdown never drops below zero and no decrement is lost.
   *
   * @return zero-based index of the claimed unit, or -1 if no work remains or the run was aborted
   */
  int claim() {
    if (aborted.get()) {
      return -1;
    }
    int before = remaining.getAndUpdate(n -> n > 0 ? n - 1 : 0);
    if (before <= 0) {
      return -1;
    }
    long now = System.nanoTime();
    if (firstDispatchNanos.compareAndSet(0, now)) {
      startedAt = Instant.now();
    }
    int current = inFlight.incrementAndGet();
    peakInFlight.accumulateAndGet(current, Math::max);
    return totalRequests - before;
  }

  /** Folds a finished attempt and releases its in-flight slot. */
  void complete(Outcome outcome) {
    try {
      aggregator.fold(outcome);
    } finally {
      lastCompletionNanos.accumulateAndGet(System.nanoTime(), Math::max);
      inFlight.decrementAndGet();
    }
  }

  void track(CompletableFuture<?> attempt) {
    pending.add(attempt);
    attempt.whenComplete((ignored, error) -> pending.remove(attempt));
    // an attempt issued while abort() was iterating would otherwise stay in flight
    if (aborted.get()) {
      attempt.cancel(true);
    }
  }

  /** Stops further claims and cancels attempts still in flight. */
  void abort() {
    if (aborted.compareAndSet(false, true)) {
      pending.forEach(future -> future.cancel(true));
    }
  }

  public boolean isAborted() {
    return aborted.get();
  }

  public String runId() {
    return runId;
  }

  public int totalRequests() {
    return totalRequests;
  }

  public int remaining() {
    return remaining.get();
  }

  public int inFlight() {
    return inFlight.get();
  }

  public int peakInFlight() {
    return peakInFlight.get();
  }

  public ResultAggregator aggregator() {
    return aggregator;
  }

  /** Wall-clock time of the first dispatch, or {@code null} before any work was claimed. */
  public Instant startedAt() {
    return startedAt;
  }

  /** Time from the first dispatch to the last completion, zero if nothing completed. */
  public Duration elapsed() {
    long start = firstDispatchNanos.get();
    long end = lastCompletionNanos.get();
    return start == 0 || end < start ? Duration.ZERO : Duration.ofNanos(end - start);
  }
}
