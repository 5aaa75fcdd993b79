package org.minnen.forecast.transform;

import org.apache.commons.math3.stat.StatUtils;

/** Map each item into [0, 1]: loc = min, scale = max - min. */
public class LocalMinMaxScaler extends LocalTargetScaler
{
  public static final String NAME = "min_max";

  public LocalMinMaxScaler(String target)
  {
    super(target);
  }

  @Override
  public String getName()
  {
    return NAME;
  }

  @Override
  protected double[] computeLocScale(double[] values)
  {
    if (values.length == 0) return new double[] { Double.NaN, Double.NaN };
    double min = StatUtils.min(values);
    return new double[] { min, StatUtils.max(values) - min };
  }
}
