package org.minnen.forecast.local;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.minnen.forecast.model.ForecastingStrategy;
import org.minnen.forecast.model.Hyperparameters;
import org.minnen.forecast.model.ModelContext;
import org.minnen.forecast.util.Frequency;
import org.minnen.forecast.util.Library;

/**
 * Repeats the values of the last observed season.
 *
 * Quantiles come from a Gaussian around the point forecast whose standard deviation is estimated from the seasonal
 * differences and grows with the number of seasons into the future. Items shorter than one season fall back to the
 * naive forecast.
 */
public class SeasonalNaiveStrategy extends LocalStrategy
{
  public static final String SEASONAL_PERIOD = "seasonal_period";

  private static final NormalDistribution normal = new NormalDistribution(0.0, 1.0);

  @Override
  public List<String> getAllowedHyperparameters()
  {
    return Arrays.asList(SEASONAL_PERIOD, MAX_TS_LENGTH);
  }

  /** @return seasonal period from the hyperparameters, else from the frequency, else 1 */
  protected int getSeasonalPeriod(ModelContext context)
  {
    int period = Hyperparameters.getInt(context.hyperparameters, SEASONAL_PERIOD, -1);
    if (period > 0) return period;
    Frequency freq = context.getFrequency();
    return freq == null ? 1 : freq.getSeasonality();
  }

  @Override
  protected double[][] forecast(double[] y, int horizon, List<Double> quantileLevels, ModelContext context)
  {
    final int n = y.length;
    final int nq = quantileLevels.size();
    double[][] rows = new double[horizon][1 + nq];
    if (n == 0) {
      for (double[] row : rows) {
        Arrays.fill(row, Double.NaN);
      }
      return rows;
    }

    int season = getSeasonalPeriod(context);
    if (n < season) season = 1;

    double[] diffs = new double[Math.max(0, n - season)];
    for (int t = season; t < n; ++t) {
      diffs[t - season] = y[t] - y[t - season];
    }
    diffs = Library.finite(diffs);
    double sigma = diffs.length > 1 ? new StandardDeviation(true).evaluate(diffs) : 0.0;

    double fallback = lastFinite(y);
    for (int h = 0; h < horizon; ++h) {
      double mean = y[n - season + (h % season)];
      if (!Double.isFinite(mean)) mean = fallback;
      double sigmaH = sigma * Math.sqrt(h / season + 1);
      rows[h][0] = mean;
      for (int k = 0; k < nq; ++k) {
        rows[h][k + 1] = mean + sigmaH * normal.inverseCumulativeProbability(quantileLevels.get(k));
      }
    }
    return rows;
  }

  @Override
  public ForecastingStrategy newInstance()
  {
    return new SeasonalNaiveStrategy();
  }
}
