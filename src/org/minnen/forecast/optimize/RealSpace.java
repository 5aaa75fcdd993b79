package org.minnen.forecast.optimize;

/** Continuous range [lower, upper], optionally searched on a log scale. */
public class RealSpace extends Space<Double>
{
  public final double  lower;
  public final double  upper;
  public final boolean bLog;
  private final double defaultValue;

  public RealSpace(double lower, double upper, double defaultValue, boolean bLog)
  {
    if (lower > upper || defaultValue < lower || defaultValue > upper) {
      throw new IllegalArgumentException(String.format("Invalid range: %f <= %f <= %f", lower, defaultValue, upper));
    }
    if (bLog && lower <= 0) {
      throw new IllegalArgumentException("Log-scale range must be positive: " + lower);
    }
    this.lower = lower;
    this.upper = upper;
    this.defaultValue = defaultValue;
    this.bLog = bLog;
  }

  public RealSpace(double lower, double upper)
  {
    this(lower, upper, (lower + upper) / 2.0, false);
  }

  @Override
  public Double getDefault()
  {
    return defaultValue;
  }

  @Override
  public String toString()
  {
    return String.format("Real(%g, %g%s)", lower, upper, bLog ? ", log" : "");
  }
}
