package org.minnen.forecast.transform;

import org.apache.commons.math3.stat.descriptive.moment.Mean;

/** Scale each item by its mean absolute value; no shift. */
public class LocalMeanAbsScaler extends LocalTargetScaler
{
  public static final String NAME = "mean_abs";

  public LocalMeanAbsScaler(String target)
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
    if (values.length == 0) return new double[] { 0.0, Double.NaN };
    double[] abs = new double[values.length];
    for (int i = 0; i < abs.length; ++i) {
      abs[i] = Math.abs(values[i]);
    }
    return new double[] { 0.0, new Mean().evaluate(abs) };
  }
}
