package org.minnen.forecast.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.json.JSONObject;
import org.minnen.forecast.data.CovariateMetadata;
import org.minnen.forecast.data.DataIO;
import org.minnen.forecast.data.FeatureVec;
import org.minnen.forecast.data.Sequence;
import org.minnen.forecast.data.StaticFeatures;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.util.Library;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scales each selected covariate column with one (loc, scale) pair shared by all items.
 *
 * Binary columns are left as is. Strongly skewed columns are scaled by median and IQR, all others by mean and standard
 * deviation. Static features are handled the same way, column by column across items.
 */
public class GlobalCovariateScaler implements CovariateScaler
{
  private static final Logger         log           = LoggerFactory.getLogger(GlobalCovariateScaler.class);

  public static final String          NAME          = "global";

  /** Columns with |skewness| above this value use robust statistics. */
  public static final double          SKEW_THRESHOLD = 0.99;

  private final CovariateMetadata     metadata;
  private final boolean               useKnown;
  private final boolean               usePast;
  private final boolean               useStatic;

  private final Map<String, double[]> columnStats   = new LinkedHashMap<>();
  private final Map<String, double[]> staticStats   = new LinkedHashMap<>();

  public GlobalCovariateScaler(CovariateMetadata metadata, boolean useKnown, boolean usePast, boolean useStatic)
  {
    this.metadata = metadata;
    this.useKnown = useKnown;
    this.usePast = usePast;
    this.useStatic = useStatic;
  }

  @Override
  public String getName()
  {
    return NAME;
  }

  /** @return {loc, scale} for the given covariate column or null if it is not scaled */
  public double[] getColumnStats(String column)
  {
    double[] s = columnStats.get(column);
    return s == null ? null : s.clone();
  }

  /** @return {loc, scale} for the given static feature or null if it is not scaled */
  public double[] getStaticStats(String column)
  {
    double[] s = staticStats.get(column);
    return s == null ? null : s.clone();
  }

  private List<String> selectedColumns()
  {
    List<String> columns = new ArrayList<>();
    if (useKnown) columns.addAll(metadata.getKnownCovariates());
    if (usePast) columns.addAll(metadata.getPastCovariates());
    return columns;
  }

  /**
   * Compute scaling statistics for one column.
   *
   * @return {loc, scale} or null if the column should not be scaled
   */
  static double[] computeStats(double[] raw)
  {
    double[] values = Library.finite(raw);
    if (values.length == 0 || Library.isBinary(values)) return null;

    double loc, scale;
    double skew = values.length > 2 ? new Skewness().evaluate(values) : 0.0;
    if (Double.isFinite(skew) && Math.abs(skew) > SKEW_THRESHOLD) {
      Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
      percentile.setData(values);
      loc = percentile.evaluate(50.0);
      scale = percentile.evaluate(75.0) - percentile.evaluate(25.0);
    } else {
      loc = new Mean().evaluate(values);
      scale = new StandardDeviation(false).evaluate(values, loc);
    }
    if (!Double.isFinite(scale) || scale < Library.MINV_ABS) {
      scale = 1.0;
    }
    return new double[] { loc, scale };
  }

  @Override
  public TimeSeriesData fitTransform(TimeSeriesData data)
  {
    columnStats.clear();
    staticStats.clear();
    for (String column : selectedColumns()) {
      if (!data.hasColumn(column)) continue;
      double[] s = computeStats(data.extractColumn(column));
      if (s != null) {
        columnStats.put(column, s);
      }
    }

    StaticFeatures sf = data.getStaticFeatures();
    if (useStatic && sf != null) {
      for (String column : metadata.getStaticFeatures()) {
        int iCol = sf.getColumnIndex(column);
        if (iCol < 0) continue;
        double[] s = computeStats(sf.extractColumn(iCol));
        if (s != null) {
          staticStats.put(column, s);
        }
      }
    }
    log.debug("Covariate scaler fit: {} column(s), {} static feature(s)", columnStats.size(), staticStats.size());
    return transform(data);
  }

  @Override
  public TimeSeriesData transform(TimeSeriesData data)
  {
    TimeSeriesData scaled = scaleColumns(data);
    StaticFeatures sf = scaled.getStaticFeatures();
    if (sf != null) {
      for (Map.Entry<String, double[]> entry : staticStats.entrySet()) {
        int iCol = sf.getColumnIndex(entry.getKey());
        if (iCol < 0) continue;
        double[] s = entry.getValue();
        for (String itemId : sf.getItemIds()) {
          double[] row = sf.get(itemId);
          row[iCol] = (row[iCol] - s[0]) / s[1];
        }
      }
    }
    return scaled;
  }

  @Override
  public TimeSeriesData transformKnownCovariates(TimeSeriesData knownCovariates)
  {
    if (knownCovariates == null) return null;
    return scaleColumns(knownCovariates);
  }

  private TimeSeriesData scaleColumns(TimeSeriesData data)
  {
    TimeSeriesData scaled = data.dup();
    for (Map.Entry<String, double[]> entry : columnStats.entrySet()) {
      int iCol = scaled.getColumnIndex(entry.getKey());
      if (iCol < 0) continue;
      double[] s = entry.getValue();
      for (Sequence seq : scaled) {
        for (FeatureVec fv : seq) {
          fv.set(iCol, (fv.get(iCol) - s[0]) / s[1]);
        }
      }
    }
    return scaled;
  }

  @Override
  public JSONObject toJson()
  {
    JSONObject obj = new JSONObject();
    obj.put("type", NAME);
    obj.put("covariate_metadata", metadata.toJson());
    obj.put("use_known", useKnown);
    obj.put("use_past", usePast);
    obj.put("use_static", useStatic);
    obj.put("column_stats", statsToJson(columnStats));
    obj.put("static_stats", statsToJson(staticStats));
    return obj;
  }

  public static GlobalCovariateScaler fromJson(JSONObject obj)
  {
    GlobalCovariateScaler scaler = new GlobalCovariateScaler(
        CovariateMetadata.fromJson(obj.getJSONObject("covariate_metadata")), obj.getBoolean("use_known"),
        obj.getBoolean("use_past"), obj.getBoolean("use_static"));
    statsFromJson(obj.getJSONObject("column_stats"), scaler.columnStats, scaler.selectedColumns());
    statsFromJson(obj.getJSONObject("static_stats"), scaler.staticStats, scaler.metadata.getStaticFeatures());
    return scaler;
  }

  private static JSONObject statsToJson(Map<String, double[]> stats)
  {
    JSONObject obj = new JSONObject();
    for (Map.Entry<String, double[]> entry : stats.entrySet()) {
      obj.put(entry.getKey(), DataIO.encodeArray(entry.getValue()));
    }
    return obj;
  }

  /** Read stats back in metadata order so that transforms are applied in a stable order. */
  private static void statsFromJson(JSONObject obj, Map<String, double[]> stats, List<String> order)
  {
    for (String column : order) {
      if (obj.has(column)) {
        stats.put(column, DataIO.decodeArray(obj.getJSONArray(column)));
      }
    }
  }
}
