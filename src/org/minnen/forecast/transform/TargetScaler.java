package org.minnen.forecast.transform;

import org.json.JSONObject;
import org.minnen.forecast.data.TimeSeriesData;

/**
 * Invertible per-item normalization of the target column.
 *
 * Transforms never modify their input; they return a new table.
 */
public interface TargetScaler
{
  /** @return name used to select this scaler ("standard", "robust", ...) */
  public String getName();

  /** Learn per-item statistics from `data` and return the scaled table. */
  public TimeSeriesData fitTransform(TimeSeriesData data);

  /** Scale `data` with previously learned statistics. */
  public TimeSeriesData transform(TimeSeriesData data);

  /** Map a prediction table (every column is in target units) back to the original scale. */
  public TimeSeriesData inverseTransform(TimeSeriesData predictions);

  public JSONObject toJson();
}
