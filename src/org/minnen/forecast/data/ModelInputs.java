package org.minnen.forecast.data;

/** Historical context plus (optional) known covariates over the forecast horizon. */
public class ModelInputs
{
  public final TimeSeriesData data;

  /** May be null when no known covariates are available. */
  public final TimeSeriesData knownCovariates;

  public ModelInputs(TimeSeriesData data, TimeSeriesData knownCovariates)
  {
    this.data = data;
    this.knownCovariates = knownCovariates;
  }
}
