package org.minnen.forecast.metrics;

import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.util.ForecastLib;

/** Mean absolute error of the point forecast. */
public class MAE extends AbstractMetric
{
  public static final String NAME = "MAE";

  @Override
  public String getName()
  {
    return NAME;
  }

  @Override
  public boolean isOptimizedByMedian()
  {
    return true;
  }

  @Override
  protected double error(double[] y, TimeSeriesData predictions)
  {
    double[] f = predictions.extractColumn(ForecastLib.MEAN_COLUMN);
    double sum = 0.0;
    int n = 0;
    for (int i = 0; i < y.length; ++i) {
      if (!Double.isFinite(y[i])) continue;
      sum += Math.abs(y[i] - f[i]);
      ++n;
    }
    return sum / n;
  }
}
