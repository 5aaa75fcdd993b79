package org.minnen.forecast.metrics;

import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.util.ForecastLib;

/** Root mean squared error of the point forecast. */
public class RMSE extends AbstractMetric
{
  public static final String NAME = "RMSE";

  @Override
  public String getName()
  {
    return NAME;
  }

  @Override
  protected double error(double[] y, TimeSeriesData predictions)
  {
    double[] f = predictions.extractColumn(ForecastLib.MEAN_COLUMN);
    double sum = 0.0;
    int n = 0;
    for (int i = 0; i < y.length; ++i) {
      if (!Double.isFinite(y[i])) continue;
      double diff = y[i] - f[i];
      sum += diff * diff;
      ++n;
    }
    return Math.sqrt(sum / n);
  }
}
