package com.mk.fx.qa.lode.core.dispatch;

import java.time.Duration;

/**
 * Summary of a finished dispatch.
 *
 * @param slots number of slots that were started
 * @param completed attempts folded into the aggregator
 * @param peakInFlight highest number of attempts observed in flight at once
 * @param elapsed time from the first dispatch to the last completion
 */
public record DispatchResult(int slots, long completed, int peakInFlight, Duration elapsed) {}
