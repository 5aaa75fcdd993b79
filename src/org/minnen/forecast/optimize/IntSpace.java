package org.minnen.forecast.optimize;

/** Integer range [lower, upper]. */
public class IntSpace extends Space<Integer>
{
  public final int  lower;
  public final int  upper;
  private final int defaultValue;

  public IntSpace(int lower, int upper, int defaultValue)
  {
    if (lower > upper || defaultValue < lower || defaultValue > upper) {
      throw new IllegalArgumentException(String.format("Invalid range: %d <= %d <= %d", lower, defaultValue, upper));
    }
    this.lower = lower;
    this.upper = upper;
    this.defaultValue = defaultValue;
  }

  public IntSpace(int lower, int upper)
  {
    this(lower, upper, lower);
  }

  @Override
  public Integer getDefault()
  {
    return defaultValue;
  }

  @Override
  public String toString()
  {
    return String.format("Int(%d, %d)", lower, upper);
  }
}
