package com.mk.fx.qa.lode.core.metrics;

/**
 * Receives a notification each time an attempt has been folded into the run's statistics. Called
 * from worker threads; implementations must be thread-safe and must not block.
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (completed, total) -> {};

  /**
   * @param completed attempts folded so far, including this one
   * @param total attempts the run will execute
   */
  void onProgress(long completed, long total);
}
