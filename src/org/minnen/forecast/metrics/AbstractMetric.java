package org.minnen.forecast.metrics;

import org.minnen.forecast.data.Sequence;
import org.minnen.forecast.data.TimeSeriesData;

/**
 * Base class for metrics defined as an error over (observed, forecast) pairs.
 *
 * Subclasses return the raw error; {@link #score} negates it.
 */
public abstract class AbstractMetric implements ForecastMetric
{
  @Override
  public boolean isOptimizedByMedian()
  {
    return false;
  }

  /**
   * Compute the error of the predictions.
   *
   * @param y observed values, aligned with the rows of `predictions` (NaN where missing)
   * @param predictions forecast table
   */
  protected abstract double error(double[] y, TimeSeriesData predictions);

  @Override
  public double score(TimeSeriesData data, TimeSeriesData predictions, String target)
  {
    return -error(groundTruth(data, predictions, target), predictions);
  }

  /** @return observed target values aligned with the prediction rows (item order of `predictions`) */
  protected static double[] groundTruth(TimeSeriesData data, TimeSeriesData predictions, String target)
  {
    int iTarget = data.requireColumn(target);
    double[] y = new double[predictions.getNumRows()];
    int i = 0;
    for (Sequence pred : predictions) {
      Sequence seq = data.getItem(pred.getName());
      if (seq == null || seq.length() < pred.length()) {
        throw new IllegalArgumentException(
            String.format("No ground truth for %d steps of item [%s]", pred.length(), pred.getName()));
      }
      int offset = seq.length() - pred.length();
      for (int t = 0; t < pred.length(); ++t) {
        y[i++] = seq.get(offset + t, iTarget);
      }
    }
    return y;
  }

  @Override
  public String toString()
  {
    return getName();
  }
}
