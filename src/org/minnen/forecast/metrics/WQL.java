package org.minnen.forecast.metrics;

import java.util.ArrayList;
import java.util.List;

import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.util.ForecastLib;

/**
 * Weighted quantile loss: mean over quantile levels of 2 * sum(pinball loss) / sum(|y|).
 *
 * If the predictions have no quantile columns the mean forecast is scored as the 0.5 quantile.
 */
public class WQL extends AbstractMetric
{
  public static final String NAME = "WQL";

  @Override
  public String getName()
  {
    return NAME;
  }

  @Override
  protected double error(double[] y, TimeSeriesData predictions)
  {
    List<String> columns = new ArrayList<>();
    List<Double> levels = new ArrayList<>();
    for (String column : predictions.getColumns()) {
      if (column.equals(ForecastLib.MEAN_COLUMN)) continue;
      columns.add(column);
      levels.add(Double.parseDouble(column));
    }
    if (columns.isEmpty()) {
      columns.add(ForecastLib.MEAN_COLUMN);
      levels.add(0.5);
    }

    double absTotal = 0.0;
    for (double v : y) {
      if (Double.isFinite(v)) absTotal += Math.abs(v);
    }

    double total = 0.0;
    for (int k = 0; k < columns.size(); ++k) {
      double q = levels.get(k);
      double[] f = predictions.extractColumn(columns.get(k));
      double loss = 0.0;
      for (int i = 0; i < y.length; ++i) {
        if (!Double.isFinite(y[i])) continue;
        double diff = y[i] - f[i];
        loss += Math.max(q * diff, (q - 1.0) * diff);
      }
      total += 2.0 * loss / absTotal;
    }
    return total / columns.size();
  }
}
