package com.mk.fx.qa.lode.cli;

import com.mk.fx.qa.lode.core.metrics.ProgressListener;
import java.io.PrintStream;
import java.util.concurrent.TimeUnit;

/**
 * Single-line progress bar redrawn in place on a terminal stream. Redraws are throttled; the final
 * completion is always drawn.
 */
final class ConsoleProgress implements ProgressListener {

  static final int BAR_WIDTH = 40;
  private static final long REDRAW_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

  private final PrintStream out;
  private final long startNanos = System.nanoTime();
  private long lastDrawNanos = startNanos - REDRAW_INTERVAL_NANOS;
  private long lastDrawn = -1;

  ConsoleProgress(PrintStream out) {
    this.out = out;
  }

  @Override
  public synchronized void onProgress(long completed, long total) {
    long now = System.nanoTime();
    boolean finished = completed >= total;
    if (completed <= lastDrawn || (!finished && now - lastDrawNanos < REDRAW_INTERVAL_NANOS)) {
      return;
    }
    lastDrawNanos = now;
    lastDrawn = completed;
    out.print('\r');
    out.print(render(completed, total, now - startNanos));
    if (finished) {
      out.println();
    }
    out.flush();
  }

  static String render(long completed, long total, long elapsedNanos) {
    long clamped = Math.min(Math.max(completed, 0), total);
    int filled = total == 0 ? BAR_WIDTH : (int) (clamped * BAR_WIDTH / total);
    var bar = new StringBuilder(BAR_WIDTH + 2);
    bar.append('[');
    for (int i = 0; i < BAR_WIDTH; i++) {
      if (i < filled) {
        bar.append('#');
      } else if (i == filled) {
        bar.append('>');
      } else {
        bar.append('-');
      }
    }
    bar.append(']');
    long seconds = TimeUnit.NANOSECONDS.toSeconds(elapsedNanos);
    return String.format(
        "[%02d:%02d:%02d] %s %d/%d",
        seconds / 3600,
        (seconds / 60) % 60,
        seconds % 60,
        bar,
        clamped,
        total);
  }
}
