package org.minnen.forecast.util;

/** Monotonic clock used to measure elapsed fit / predict time. */
public interface TimeSource
{
  public static final TimeSource SYSTEM = System::nanoTime;

  /** @return current reading of a monotonic clock in nanoseconds */
  public long nanoTime();

  /** @return seconds elapsed since the given reading of this clock */
  public default double secondsSince(long startNanos)
  {
    return TimeLib.secondsBetween(startNanos, nanoTime());
  }
}
