package org.minnen.forecast.transform;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/** Outlier-resistant scaling: loc = median, scale = inter-quartile range. */
public class LocalRobustScaler extends LocalTargetScaler
{
  public static final String NAME = "robust";

  public LocalRobustScaler(String target)
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
    Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
    percentile.setData(values);
    double median = percentile.evaluate(50.0);
    double iqr = percentile.evaluate(75.0) - percentile.evaluate(25.0);
    return new double[] { median, iqr };
  }
}
