package org.minnen.forecast.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;
import org.minnen.forecast.data.ModelInputs;
import org.minnen.forecast.data.TimeSeriesData;

/**
 * Model-specific training and prediction logic. {@link ForecastModel} handles scaling, time budgets, quantile
 * bookkeeping and persistence around it.
 */
public interface ForecastingStrategy
{
  /** @return registry name of this strategy; also the default model name */
  public default String getType()
  {
    return getClass().getSimpleName().replaceAll("Strategy$", "");
  }

  public ModelCapabilities getCapabilities();

  public default Map<String, Object> getDefaultHyperparameters()
  {
    return Collections.emptyMap();
  }

  /** @return hyperparameters understood by this strategy (in addition to the transform keys) */
  public default List<String> getAllowedHyperparameters()
  {
    return Collections.emptyList();
  }

  /** Model-specific preprocessing applied after all transforms. */
  public default ModelInputs preprocess(TimeSeriesData data, TimeSeriesData knownCovariates, boolean isTrain)
  {
    return new ModelInputs(data, knownCovariates);
  }

  public void train(TrainRequest request);

  /**
   * Forecast the next `context.predictionLength` steps of every item.
   *
   * @return table with "mean" and one column per working quantile level (other columns are dropped, missing ones
   *         become NaN)
   */
  public TimeSeriesData infer(ModelContext context, TimeSeriesData data, TimeSeriesData knownCovariates,
      Map<String, Object> options);

  /** @return new, untrained strategy of the same type */
  public ForecastingStrategy newInstance();

  /** @return trained state as JSON */
  public JSONObject saveState();

  public void loadState(JSONObject state);

  /** Load lazily held assets into memory. */
  public default void persist()
  {}

  public default boolean isGpuAvailable()
  {
    return false;
  }
}
