package com.mk.fx.qa.lode.core.dispatch;

import com.mk.fx.qa.lode.core.http.RequestExecutor;
import com.mk.fx.qa.lode.core.outcome.Outcome;
import com.mk.fx.qa.lode.core.outcome.OutcomeClassifier;
import com.mk.fx.qa.lode.core.outcome.RawResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the attempts of a load test under a concurrency ceiling.
 *
 * <p>Work is pulled, not partitioned: each slot claims one unit from the run's countdown right
 * before issuing it and keeps going until the countdown is exhausted, so a slow response on one
 * slot never starves overall throughput. Exactly {@code min(concurrency, requests)} slots are
 * started, which bounds the number of attempts in flight.
 *
 * <p>Threading: slots are continuation chains, not threads. After an attempt completes, the next
 * claim is scheduled on the supplied executor, so a small pool can drive any number of slots and no
 * thread waits on the network. Only the caller of {@link #dispatch} blocks, until every slot has
 * drained.
 */
@Slf4j
public final class LoadDispatcher {

  private final Executor continuationExecutor;

  public LoadDispatcher(Executor continuationExecutor) {
    this.continuationExecutor =
        Objects.requireNonNull(continuationExecutor, "continuationExecutor");
  }

  /**
   * Executes every unit of work in {@code state} and waits for all of them to complete.
   *
   * @param state run state holding the countdown and aggregator
   * @param concurrency concurrency ceiling, at least 1
   * @param executor performs one attempt per claimed unit
   * @return dispatch summary
   * @throws InterruptedException if the calling thread is interrupted; the run is aborted first
   */
  public DispatchResult dispatch(RunState state, int concurrency, RequestExecutor executor)
      throws InterruptedException {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(executor, "executor");
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1");
    }

    int slots = Math.min(concurrency, state.totalRequests());
    log.info(
        "Run {} dispatching {} requests over {} slots",
        state.runId(),
        state.totalRequests(),
        slots);

    List<CompletableFuture<Void>> futures = new ArrayList<>(slots);
    for (int slot = 0; slot < slots; slot++) {
      var slotDone = new CompletableFuture<Void>();
      futures.add(slotDone);
      continuationExecutor.execute(() -> runSlot(state, executor, slotDone));
    }

    try {
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
    } catch (InterruptedException interrupted) {
      log.warn(
          "Run {} interrupted, aborting {} in-flight attempts", state.runId(), state.inFlight());
      state.abort();
      futures.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw interrupted;
    } catch (ExecutionException e) {
      state.abort();
      throw new IllegalStateException(
          "Run " + state.runId() + " dispatch failed: " + e.getCause().getMessage(), e.getCause());
    }

    var result =
        new DispatchResult(
            slots, state.aggregator().completed(), state.peakInFlight(), state.elapsed());
    log.info(
        "Run {} dispatch complete: started={} completed={} peakInFlight={} elapsed={}",
        state.runId(),
        state.startedAt(),
        result.completed(),
        result.peakInFlight(),
        result.elapsed());
    return result;
  }

  /**
   * Claims the next unit, runs it, folds the outcome and reschedules itself, completing {@code
   * slotDone} once the countdown is exhausted.
   */
  private void runSlot(RunState state, RequestExecutor executor, CompletableFuture<Void> slotDone) {
    int attempt = state.claim();
    if (attempt < 0) {
      slotDone.complete(null);
      return;
    }

    long startTime = System.nanoTime();
    CompletableFuture<Outcome> inFlight;
    try {
      inFlight = Objects.requireNonNull(executor.execute(attempt), "executor returned null");
    } catch (RuntimeException ex) {
      inFlight = CompletableFuture.failedFuture(ex);
    }
    state.track(inFlight);

    inFlight
        .handle(
            (outcome, error) ->
                outcome != null ? outcome : recover(state, attempt, error, startTime))
        .thenAccept(state::complete)
        .whenCompleteAsync(
            (ignored, error) -> {
              if (error != null) {
                slotDone.completeExceptionally(error);
              } else {
                runSlot(state, executor, slotDone);
              }
            },
            continuationExecutor);
  }

  /** An executor that fails instead of returning an outcome still yields exactly one outcome. */
  private static Outcome recover(RunState state, int attempt, Throwable error, long startTime) {
    var elapsed = Duration.ofNanos(System.nanoTime() - startTime);
    if (!state.isAborted()) {
      log.warn(
          "Run {} attempt {} completed exceptionally: {}",
          state.runId(),
          attempt,
          error != null ? error.toString() : "no outcome");
    }
    return OutcomeClassifier.classify(RawResult.failure(error, elapsed));
  }
}
