package org.minnen.forecast.transform;

import org.json.JSONObject;
import org.minnen.forecast.data.TimeSeriesData;

/** Normalization of covariate columns and static features. */
public interface CovariateScaler
{
  public String getName();

  public TimeSeriesData fitTransform(TimeSeriesData data);

  public TimeSeriesData transform(TimeSeriesData data);

  /**
   * Scale a table that holds only known covariates over the forecast horizon.
   *
   * @param knownCovariates table to scale (may be null)
   * @return scaled table or null if `knownCovariates` is null
   */
  public TimeSeriesData transformKnownCovariates(TimeSeriesData knownCovariates);

  public JSONObject toJson();
}
