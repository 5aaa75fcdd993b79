package org.minnen.forecast.regressor;

import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.minnen.forecast.data.CovariateMetadata;
import org.minnen.forecast.data.DataIO;
import org.minnen.forecast.data.FeatureVec;
import org.minnen.forecast.data.Sequence;
import org.minnen.forecast.data.StaticFeatures;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.model.diag.Diagnostic;
import org.minnen.forecast.model.diag.DiagnosticListener;
import org.minnen.forecast.util.Library;
import org.minnen.forecast.util.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ridge regression from known covariates and static features to the target, shared by all items.
 *
 * Constant feature columns are dropped and missing feature values are replaced by the training mean of the column.
 * The regressor disables itself (and becomes the identity) when there is nothing to learn from or no time to learn.
 */
public class GlobalCovariateRegressor implements CovariateRegressor
{
  private static final Logger      log                     = LoggerFactory.getLogger(GlobalCovariateRegressor.class);

  public static final String       NAME                    = "ridge";
  public static final double       DEFAULT_LAMBDA          = 1.0;
  public static final int          DEFAULT_MAX_NUM_SAMPLES = 500000;

  private final String             target;
  private final CovariateMetadata  metadata;
  private final double             lambda;
  private final boolean            refitDuringPredict;
  private final int                maxNumSamples;
  private final DiagnosticListener listener;
  private final String             source;

  private boolean                  bFit;
  private boolean                  bDisabled;
  private List<String>             knownColumns            = new ArrayList<>();
  private List<String>             staticColumns           = new ArrayList<>();
  private double[]                 featureMeans;
  private LinearRegression         model;

  public GlobalCovariateRegressor(String target, CovariateMetadata metadata, double lambda, boolean refitDuringPredict,
      int maxNumSamples, DiagnosticListener listener, String source)
  {
    if (lambda < 0) {
      throw new IllegalArgumentException("Ridge lambda must be non-negative: " + lambda);
    }
    if (maxNumSamples <= 0) {
      throw new IllegalArgumentException("max_num_samples must be positive: " + maxNumSamples);
    }
    this.target = target;
    this.metadata = metadata;
    this.lambda = lambda;
    this.refitDuringPredict = refitDuringPredict;
    this.maxNumSamples = maxNumSamples;
    this.listener = listener;
    this.source = source;
  }

  @Override
  public String getName()
  {
    return NAME;
  }

  @Override
  public boolean isFit()
  {
    return bFit;
  }

  public boolean isDisabled()
  {
    return bDisabled;
  }

  public boolean isRefitDuringPredict()
  {
    return refitDuringPredict;
  }

  /** @return names of the known covariates and static features used as regression inputs */
  public List<String> getFeatureNames()
  {
    List<String> names = new ArrayList<>(knownColumns);
    names.addAll(staticColumns);
    return names;
  }

  public LinearRegression getModel()
  {
    return model;
  }

  private void disable(String reason)
  {
    bFit = true;
    bDisabled = true;
    model = null;
    listener.onDiagnostic(new Diagnostic(Diagnostic.Kind.REGRESSOR_DISABLED, source,
        "Covariate regressor disabled: " + reason));
  }

  @Override
  public void fit(TimeSeriesData data, Double timeLimit)
  {
    bFit = false;
    bDisabled = false;
    model = null;
    if (timeLimit != null && timeLimit <= 0) {
      disable(String.format("no time left (%.2fs)", timeLimit));
      return;
    }
    long startNanos = TimeSource.SYSTEM.nanoTime();

    int iTarget = data.requireColumn(target);
    List<String> known = new ArrayList<>();
    for (String name : metadata.getKnownCovariates()) {
      if (data.hasColumn(name)) known.add(name);
    }
    List<String> statics = new ArrayList<>();
    StaticFeatures sf = data.getStaticFeatures();
    if (sf != null) {
      for (String name : metadata.getStaticFeatures()) {
        if (sf.hasColumn(name)) statics.add(name);
      }
    }

    // Collect (features, target) pairs for all rows with an observed target.
    List<double[]> xs = new ArrayList<>();
    List<Double> ys = new ArrayList<>();
    for (Sequence seq : data) {
      for (FeatureVec fv : seq) {
        double y = fv.get(iTarget);
        if (!Double.isFinite(y)) continue;
        xs.add(buildFeatures(fv, data, known, sf, seq.getName(), statics));
        ys.add(y);
      }
    }

    // Subsample with a fixed stride if there are too many rows.
    int stride = Math.max(1, (int) Math.ceil(xs.size() / (double) maxNumSamples));
    List<double[]> xsub = new ArrayList<>();
    List<Double> ysub = new ArrayList<>();
    for (int i = 0; i < xs.size(); i += stride) {
      xsub.add(xs.get(i));
      ysub.add(ys.get(i));
    }

    // Keep non-constant columns only.
    List<String> names = new ArrayList<>(known);
    names.addAll(statics);
    List<Integer> keep = new ArrayList<>();
    for (int d = 0; d < names.size(); ++d) {
      double[] column = new double[xsub.size()];
      for (int i = 0; i < column.length; ++i) {
        column[i] = xsub.get(i)[d];
      }
      if (!Library.isConstant(column)) keep.add(d);
    }
    if (keep.isEmpty()) {
      disable("no informative covariates or static features");
      return;
    }
    final int N = xsub.size();
    final int D = keep.size();
    if (N <= D + 1) {
      disable(String.format("too few observations (%d) for %d features", N, D));
      return;
    }

    double[][] x = new double[N][D];
    double[] y = new double[N];
    double[] means = new double[D];
    for (int j = 0; j < D; ++j) {
      int d = keep.get(j);
      double sum = 0.0;
      int n = 0;
      for (double[] row : xsub) {
        if (Double.isFinite(row[d])) {
          sum += row[d];
          ++n;
        }
      }
      means[j] = sum / n;
    }
    for (int i = 0; i < N; ++i) {
      double[] row = xsub.get(i);
      for (int j = 0; j < D; ++j) {
        double v = row[keep.get(j)];
        x[i][j] = Double.isFinite(v) ? v : means[j];
      }
      y[i] = ysub.get(i);
    }

    knownColumns = new ArrayList<>();
    staticColumns = new ArrayList<>();
    for (int d : keep) {
      if (d < known.size()) {
        knownColumns.add(names.get(d));
      } else {
        staticColumns.add(names.get(d));
      }
    }
    featureMeans = means;
    model = LinearRegression.learnRidge(x, y, lambda);
    bFit = true;
    log.debug("Covariate regressor fit on {} rows, features={} ({})", N, getFeatureNames(),
        Library.formatSeconds(TimeSource.SYSTEM.secondsSince(startNanos)));
  }

  private static double[] buildFeatures(FeatureVec fv, TimeSeriesData data, List<String> known, StaticFeatures sf,
      String itemId, List<String> statics)
  {
    double[] row = new double[known.size() + statics.size()];
    for (int i = 0; i < known.size(); ++i) {
      row[i] = fv.get(data.getColumnIndex(known.get(i)));
    }
    for (int i = 0; i < statics.size(); ++i) {
      row[known.size() + i] = sf.get(itemId, sf.getColumnIndex(statics.get(i)));
    }
    return row;
  }

  /** @return regression output for one row, given its known covariate values and its item's static features */
  private double predictRow(FeatureVec fv, int[] knownDims, StaticFeatures sf, String itemId, int[] staticDims)
  {
    double[] x = new double[featureMeans.length];
    for (int i = 0; i < knownDims.length; ++i) {
      x[i] = fv.get(knownDims[i]);
    }
    for (int i = 0; i < staticDims.length; ++i) {
      x[knownDims.length + i] = (sf == null || staticDims[i] < 0) ? Double.NaN : sf.get(itemId, staticDims[i]);
    }
    for (int i = 0; i < x.length; ++i) {
      if (!Double.isFinite(x[i])) x[i] = featureMeans[i];
    }
    return model.predict(x);
  }

  private int[] knownDims(TimeSeriesData data)
  {
    int[] dims = new int[knownColumns.size()];
    for (int i = 0; i < dims.length; ++i) {
      dims[i] = data.requireColumn(knownColumns.get(i));
    }
    return dims;
  }

  private int[] staticDims(StaticFeatures sf)
  {
    int[] dims = new int[staticColumns.size()];
    for (int i = 0; i < dims.length; ++i) {
      dims[i] = (sf == null ? -1 : sf.getColumnIndex(staticColumns.get(i)));
    }
    return dims;
  }

  @Override
  public TimeSeriesData transform(TimeSeriesData data)
  {
    if (!bFit || bDisabled) return data;
    int iTarget = data.requireColumn(target);
    int[] kdims = knownDims(data);
    StaticFeatures sf = data.getStaticFeatures();
    int[] sdims = staticDims(sf);
    TimeSeriesData residual = data.dup();
    for (Sequence seq : residual) {
      for (FeatureVec fv : seq) {
        fv.set(iTarget, fv.get(iTarget) - predictRow(fv, kdims, sf, seq.getName(), sdims));
      }
    }
    return residual;
  }

  @Override
  public TimeSeriesData fitTransform(TimeSeriesData data)
  {
    if (!bFit || refitDuringPredict) {
      fit(data, null);
    }
    return transform(data);
  }

  @Override
  public TimeSeriesData inverseTransform(TimeSeriesData predictions, TimeSeriesData knownCovariates,
      StaticFeatures staticFeatures)
  {
    if (!bFit || bDisabled) return predictions;
    if (knownCovariates == null) {
      throw new IllegalArgumentException("Covariate regressor needs known covariates over the forecast horizon");
    }
    int[] kdims = knownDims(knownCovariates);
    int[] sdims = staticDims(staticFeatures);
    TimeSeriesData ret = predictions.dup();
    for (Sequence seq : ret) {
      Sequence known = knownCovariates.getItem(seq.getName());
      if (known == null || known.length() != seq.length()) {
        throw new IllegalArgumentException(
            String.format("Known covariates don't cover the forecast horizon of item [%s]", seq.getName()));
      }
      for (int t = 0; t < seq.length(); ++t) {
        double offset = predictRow(known.get(t), kdims, staticFeatures, seq.getName(), sdims);
        seq.get(t)._add(offset);
      }
    }
    return ret;
  }

  @Override
  public JSONObject toJson()
  {
    JSONObject obj = new JSONObject();
    obj.put("type", NAME);
    obj.put("target", target);
    obj.put("covariate_metadata", metadata.toJson());
    obj.put("lambda", lambda);
    obj.put("refit_during_predict", refitDuringPredict);
    obj.put("max_num_samples", maxNumSamples);
    obj.put("is_fit", bFit);
    obj.put("disabled", bDisabled);
    obj.put("known_columns", new JSONArray(knownColumns));
    obj.put("static_columns", new JSONArray(staticColumns));
    if (featureMeans != null) obj.put("feature_means", DataIO.encodeArray(featureMeans));
    if (model != null) obj.put("model", model.toJson());
    return obj;
  }

  public static GlobalCovariateRegressor fromJson(JSONObject obj, DiagnosticListener listener, String source)
  {
    GlobalCovariateRegressor reg = new GlobalCovariateRegressor(obj.getString("target"),
        CovariateMetadata.fromJson(obj.getJSONObject("covariate_metadata")), obj.getDouble("lambda"),
        obj.getBoolean("refit_during_predict"), obj.getInt("max_num_samples"), listener, source);
    reg.bFit = obj.getBoolean("is_fit");
    reg.bDisabled = obj.getBoolean("disabled");
    reg.knownColumns = DataIO.strings(obj.getJSONArray("known_columns"));
    reg.staticColumns = DataIO.strings(obj.getJSONArray("static_columns"));
    if (obj.has("feature_means")) reg.featureMeans = DataIO.decodeArray(obj.getJSONArray("feature_means"));
    if (obj.has("model")) reg.model = LinearRegression.fromJson(obj.getJSONObject("model"));
    return reg;
  }
}
