package org.minnen.forecast.metrics;

import org.minnen.forecast.data.TimeSeriesData;

/** Evaluation metric for probabilistic forecasts. Scores are always "higher is better". */
public interface ForecastMetric
{
  public String getName();

  /** @return true if the point forecast that minimizes this metric is the median rather than the mean */
  public boolean isOptimizedByMedian();

  /**
   * Score predictions against the last rows of `data`.
   *
   * @param data observed data; the last N rows of each item hold the ground truth for an N-step forecast
   * @param predictions forecast table ("mean" plus quantile columns)
   * @param target name of the target column in `data`
   * @return score where higher is better
   */
  public double score(TimeSeriesData data, TimeSeriesData predictions, String target);
}
