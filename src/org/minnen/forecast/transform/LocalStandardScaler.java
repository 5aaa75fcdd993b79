package org.minnen.forecast.transform;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/** Per-item standardization: loc = mean, scale = sample standard deviation. */
public class LocalStandardScaler extends LocalTargetScaler
{
  public static final String NAME = "standard";

  public LocalStandardScaler(String target)
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
    double mean = new Mean().evaluate(values);
    double std = values.length > 1 ? new StandardDeviation(true).evaluate(values, mean) : Double.NaN;
    return new double[] { mean, std };
  }
}
