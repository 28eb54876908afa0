package com.mk.fx.qa.lode.core.http;

import com.mk.fx.qa.lode.core.outcome.Outcome;
import java.util.concurrent.CompletableFuture;

/**
 * Performs a single attempt of a load test. Used by the dispatcher for every work unit it claims.
 * Implementations should complete the returned future with an {@link Outcome} rather than
 * exceptionally; per-attempt failures are data, not errors.
 */
@FunctionalInterface
public interface RequestExecutor {

  /**
   * Starts one attempt.
   *
   * @param attempt zero-based index of the claimed work unit, for logging
   * @return future completed with the classified outcome of the attempt
   */
  CompletableFuture<Outcome> execute(int attempt);
}
