package org.minnen.forecast.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.minnen.forecast.data.CovariateMetadata;
import org.minnen.forecast.metrics.ForecastMetric;
import org.minnen.forecast.util.Frequency;

/** Read-only view of a model's configuration, handed to its strategy. */
public class ModelContext
{
  public final String              name;
  public final String              freq;
  public final int                 predictionLength;
  public final String              target;

  /** Working quantile levels (sorted, always include 0.5). */
  public final List<Double>        quantileLevels;
  public final CovariateMetadata   covariateMetadata;

  /** Strategy defaults overlaid with user hyperparameters. */
  public final Map<String, Object> hyperparameters;
  public final ForecastMetric      evalMetric;

  public ModelContext(String name, String freq, int predictionLength, String target, List<Double> quantileLevels,
      CovariateMetadata covariateMetadata, Map<String, Object> hyperparameters, ForecastMetric evalMetric)
  {
    this.name = name;
    this.freq = freq;
    this.predictionLength = predictionLength;
    this.target = target;
    this.quantileLevels = Collections.unmodifiableList(quantileLevels);
    this.covariateMetadata = covariateMetadata;
    this.hyperparameters = Collections.unmodifiableMap(hyperparameters);
    this.evalMetric = evalMetric;
  }

  /** @return parsed frequency or null if none is configured */
  public Frequency getFrequency()
  {
    return freq == null ? null : Frequency.parse(freq);
  }
}
