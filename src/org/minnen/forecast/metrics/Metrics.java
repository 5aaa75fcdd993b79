package org.minnen.forecast.metrics;

import java.util.Locale;

/** Lookup of evaluation metrics by name. */
public class Metrics
{
  public static final String DEFAULT = WQL.NAME;

  /**
   * Resolve a metric.
   *
   * @param metric metric instance, case-insensitive name, or null for the default metric
   * @return metric instance
   * @throws IllegalArgumentException for an unknown metric
   */
  public static ForecastMetric get(Object metric)
  {
    if (metric == null) return get(DEFAULT);
    if (metric instanceof ForecastMetric) return (ForecastMetric) metric;
    switch (metric.toString().toUpperCase(Locale.ROOT)) {
    case WQL.NAME:
      return new WQL();
    case MAE.NAME:
      return new MAE();
    case WAPE.NAME:
      return new WAPE();
    case RMSE.NAME:
      return new RMSE();
    default:
      throw new IllegalArgumentException(String.format("Unknown eval_metric: [%s]", metric));
    }
  }
}
