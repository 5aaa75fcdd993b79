package org.minnen.forecast.metrics;

import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.util.ForecastLib;

/** Weighted absolute percentage error: sum(|y - f|) / sum(|y|). */
public class WAPE extends AbstractMetric
{
  public static final String NAME = "WAPE";

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
    double err = 0.0;
    double abs = 0.0;
    for (int i = 0; i < y.length; ++i) {
      if (!Double.isFinite(y[i])) continue;
      err += Math.abs(y[i] - f[i]);
      abs += Math.abs(y[i]);
    }
    return err / abs;
  }
}
