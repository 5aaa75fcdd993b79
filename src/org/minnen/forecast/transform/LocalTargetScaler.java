package org.minnen.forecast.transform;

import java.util.LinkedHashMap;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;
import org.minnen.forecast.data.DataIO;
import org.minnen.forecast.data.FeatureVec;
import org.minnen.forecast.data.Sequence;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.util.Library;

/**
 * Base class for target scalers that learn one (loc, scale) pair per item: y' = (y - loc) / scale.
 *
 * Statistics are computed from the finite target values of each item. Missing statistics fall back to loc=0 and
 * scale=1, and the scale never drops below {@link #MIN_SCALE}.
 */
public abstract class LocalTargetScaler implements TargetScaler
{
  public static final double           MIN_SCALE = 1e-2;

  protected final String               target;

  /** item id -> {loc, scale} */
  private final Map<String, double[]> stats     = new LinkedHashMap<>();

  protected LocalTargetScaler(String target)
  {
    this.target = target;
  }

  /**
   * Compute location and scale for one item.
   *
   * @param values finite target values of the item (may be empty)
   * @return {loc, scale}; either may be NaN if undefined
   */
  protected abstract double[] computeLocScale(double[] values);

  public String getTarget()
  {
    return target;
  }

  /** @return {loc, scale} for the given item or null if the item is unknown */
  public double[] getStats(String itemId)
  {
    double[] s = stats.get(itemId);
    return s == null ? null : s.clone();
  }

  public boolean isFit()
  {
    return !stats.isEmpty();
  }

  @Override
  public TimeSeriesData fitTransform(TimeSeriesData data)
  {
    int iTarget = data.requireColumn(target);
    stats.clear();
    for (Sequence seq : data) {
      double[] locScale = computeLocScale(Library.finite(seq.extractDim(iTarget)));
      double loc = locScale[0];
      double scale = locScale[1];
      if (!Double.isFinite(loc)) loc = 0.0;
      scale = Double.isFinite(scale) ? Math.max(scale, MIN_SCALE) : 1.0;
      stats.put(seq.getName(), new double[] { loc, scale });
    }
    return transform(data);
  }

  @Override
  public TimeSeriesData transform(TimeSeriesData data)
  {
    int iTarget = data.requireColumn(target);
    TimeSeriesData scaled = data.dup();
    for (Sequence seq : scaled) {
      double[] s = requireStats(seq.getName());
      for (FeatureVec fv : seq) {
        fv.set(iTarget, (fv.get(iTarget) - s[0]) / s[1]);
      }
    }
    return scaled;
  }

  @Override
  public TimeSeriesData inverseTransform(TimeSeriesData predictions)
  {
    TimeSeriesData unscaled = predictions.dup();
    for (Sequence seq : unscaled) {
      double[] s = requireStats(seq.getName());
      for (FeatureVec fv : seq) {
        fv._mul(s[1])._add(s[0]);
      }
    }
    return unscaled;
  }

  private double[] requireStats(String itemId)
  {
    double[] s = stats.get(itemId);
    if (s == null) {
      throw new IllegalArgumentException(String.format("%s scaler has no statistics for item [%s]", getName(), itemId));
    }
    return s;
  }

  @Override
  public JSONObject toJson()
  {
    JSONObject obj = new JSONObject();
    obj.put("type", getName());
    obj.put("target", target);
    JSONObject jstats = new JSONObject();
    for (Map.Entry<String, double[]> entry : stats.entrySet()) {
      jstats.put(entry.getKey(), DataIO.encodeArray(entry.getValue()));
    }
    obj.put("stats", jstats);
    return obj;
  }

  /** Restore statistics written by {@link #toJson()}. */
  void loadStats(JSONObject obj)
  {
    stats.clear();
    JSONObject jstats = obj.getJSONObject("stats");
    for (String itemId : jstats.keySet()) {
      JSONArray pair = jstats.getJSONArray(itemId);
      stats.put(itemId, DataIO.decodeArray(pair));
    }
  }

  @Override
  public String toString()
  {
    return String.format("[%s scaler: %s, %d items]", getName(), target, stats.size());
  }
}
