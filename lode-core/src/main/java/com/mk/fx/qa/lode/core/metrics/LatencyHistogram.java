package com.mk.fx.qa.lode.core.metrics;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.HdrHistogram.Histogram;
import org.HdrHistogram.HistogramIterationValue;

/**
 * Thread-safe latency distribution with bounded relative error.
 *
 * <p>Backed by an HdrHistogram recording microseconds at 3 significant digits, so memory and query
 * cost are independent of the number of samples. Durations above one hour are clamped. Percentiles
 * use nearest-rank semantics on bucket boundaries: the p-th percentile is the smallest bucket value
 * {@code v} such that at least {@code ceil(p/100 * count)} samples are {@code <= v}.
 */
public final class LatencyHistogram {

  static final long HIGHEST_TRACKABLE_MICROS = TimeUnit.HOURS.toMicros(1);
  static final int SIGNIFICANT_DIGITS = 3;

  private final Histogram histogram;

  public LatencyHistogram() {
    this(new Histogram(1, HIGHEST_TRACKABLE_MICROS, SIGNIFICANT_DIGITS));
  }

  private LatencyHistogram(Histogram histogram) {
    this.histogram = histogram;
  }

  public synchronized void record(Duration duration) {
    long micros = Math.max(0, TimeUnit.NANOSECONDS.toMicros(duration.toNanos()));
    histogram.recordValue(Math.min(micros, HIGHEST_TRACKABLE_MICROS));
  }

  /** Adds every sample of {@code other} into this histogram. */
  public void merge(LatencyHistogram other) {
    if (other == this) {
      throw new IllegalArgumentException("Cannot merge a histogram into itself");
    }
    Histogram source = other.copyOfDelegate();
    synchronized (this) {
      histogram.add(source);
    }
  }

  public synchronized LatencyHistogram copy() {
    return new LatencyHistogram(histogram.copy());
  }

  public synchronized long count() {
    return histogram.getTotalCount();
  }

  public synchronized boolean isEmpty() {
    return histogram.getTotalCount() == 0;
  }

  /** Smallest recorded value in milliseconds, 0 when empty. */
  public synchronized double minMillis() {
    return isEmpty() ? 0.0 : toMillis(histogram.getMinValue());
  }

  /** Largest recorded value in milliseconds (bucket upper bound), 0 when empty. */
  public synchronized double maxMillis() {
    return isEmpty() ? 0.0 : toMillis(histogram.getMaxValue());
  }

  /**
   * Value at the given percentile in milliseconds, 0 when empty.
   *
   * @param percentile in the range (0, 100]
   */
  public synchronized double percentileMillis(double percentile) {
    if (percentile <= 0.0 || percentile > 100.0) {
      throw new IllegalArgumentException("Percentile must be in (0, 100]: " + percentile);
    }
    long total = histogram.getTotalCount();
    if (total == 0) {
      return 0.0;
    }
    long rank = Math.max(1, (long) Math.ceil(percentile / 100.0 * total));
    for (HistogramIterationValue value : histogram.recordedValues()) {
      if (value.getTotalCountToThisValue() >= rank) {
        return toMillis(value.getValueIteratedTo());
      }
    }
    return toMillis(histogram.getMaxValue());
  }

  private synchronized Histogram copyOfDelegate() {
    return histogram.copy();
  }

  private static double toMillis(long micros) {
    return micros / 1000.0;
  }
}
