package org.minnen.forecast.model;

/** Thrown by fit when the time budget is exhausted before training starts. */
public class TimeLimitExceededException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  private final double      timeLeft;

  public TimeLimitExceededException(String modelName, double timeLeft)
  {
    super(String.format("%s has no time left to train (time left = %.1fs)", modelName, timeLeft));
    this.timeLeft = timeLeft;
  }

  /** @return remaining budget in seconds (zero or negative) */
  public double getTimeLeft()
  {
    return timeLeft;
  }
}
