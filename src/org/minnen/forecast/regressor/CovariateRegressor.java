package org.minnen.forecast.regressor;

import org.json.JSONObject;
import org.minnen.forecast.data.StaticFeatures;
import org.minnen.forecast.data.TimeSeriesData;

/**
 * Auxiliary model that explains part of the target with covariates.
 *
 * During training the target is replaced by the residual of this model; after forecasting, the covariate component is
 * added back to every prediction column.
 */
public interface CovariateRegressor
{
  public String getName();

  public boolean isFit();

  /**
   * Fit the regressor.
   *
   * @param data training data (target plus covariates)
   * @param timeLimit seconds available for fitting; null means unbounded
   */
  public void fit(TimeSeriesData data, Double timeLimit);

  /** @return copy of `data` with the covariate component removed from the target */
  public TimeSeriesData transform(TimeSeriesData data);

  /** Fit if required (or configured to refit) and then transform. */
  public TimeSeriesData fitTransform(TimeSeriesData data);

  /**
   * Add the covariate component back to the predictions.
   *
   * @param predictions forecasts of the residual, one column per output
   * @param knownCovariates known covariates over the forecast horizon
   * @param staticFeatures static features of the items (may be null)
   * @return copy of `predictions` in target units
   */
  public TimeSeriesData inverseTransform(TimeSeriesData predictions, TimeSeriesData knownCovariates,
      StaticFeatures staticFeatures);

  public JSONObject toJson();
}
