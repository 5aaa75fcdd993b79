package org.minnen.forecast.local;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.minnen.forecast.model.ForecastingStrategy;
import org.minnen.forecast.model.ModelContext;
import org.minnen.forecast.util.Library;

/** Forecasts the historical mean; quantiles are the empirical quantiles of the history. */
public class AverageStrategy extends LocalStrategy
{
  @Override
  public List<String> getAllowedHyperparameters()
  {
    return Collections.singletonList(MAX_TS_LENGTH);
  }

  @Override
  protected double[][] forecast(double[] y, int horizon, List<Double> quantileLevels, ModelContext context)
  {
    double[] values = Library.finite(y);
    double[] row = new double[1 + quantileLevels.size()];
    if (values.length == 0) {
      Arrays.fill(row, Double.NaN);
    } else {
      row[0] = new Mean().evaluate(values);
      Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
      percentile.setData(values);
      for (int k = 0; k < quantileLevels.size(); ++k) {
        row[k + 1] = percentile.evaluate(100.0 * quantileLevels.get(k));
      }
    }

    double[][] rows = new double[horizon][];
    for (int h = 0; h < horizon; ++h) {
      rows[h] = row.clone();
    }
    return rows;
  }

  @Override
  public ForecastingStrategy newInstance()
  {
    return new AverageStrategy();
  }
}
