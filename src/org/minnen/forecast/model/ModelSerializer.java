package org.minnen.forecast.model;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.minnen.forecast.data.CovariateMetadata;
import org.minnen.forecast.model.diag.DiagnosticListener;
import org.minnen.forecast.regressor.CovariateRegressor;
import org.minnen.forecast.regressor.CovariateRegressors;
import org.minnen.forecast.transform.CovariateScaler;
import org.minnen.forecast.transform.TargetScaler;
import org.minnen.forecast.transform.Transforms;

/**
 * Versioned JSON schema for {@link ForecastModel}.
 *
 * The artifact holds identity, configuration, hyperparameters, timing stats, fitted transforms and the strategy state.
 * Out-of-fold predictions are never part of it.
 */
class ModelSerializer
{
  static final int SCHEMA_VERSION = 1;

  static JSONObject toJson(ForecastModel model)
  {
    ModelParams params = model.getParams();
    JSONObject obj = new JSONObject();
    obj.put("schema_version", SCHEMA_VERSION);
    obj.put("strategy_type", model.getStrategy().getType());
    obj.put("name", model.getName());
    obj.put("path", model.getPath().getPath());
    obj.put("path_root", model.getPathRoot().getPath());
    obj.put("freq", nullable(model.getFreq()));
    obj.put("prediction_length", model.getPredictionLength());
    obj.put("target", model.getTarget());
    obj.put("eval_metric", model.getEvalMetric().getName());
    obj.put("quantile_levels", new JSONArray(model.getQuantileLevels()));
    obj.put("must_drop_median", model.mustDropMedian());
    obj.put("covariate_metadata", model.getCovariateMetadata().toJson());
    obj.put("hyperparameters", Hyperparameters.toJson(params.getHyperparameters()));
    obj.put("is_fit", model.isFit());
    obj.put("fit_time", nullable(model.getFitTime()));
    obj.put("predict_time", nullable(model.getPredictTime()));
    obj.put("predict_1_time", nullable(model.getPredict1Time()));
    obj.put("val_score", nullable(model.getValScore()));
    if (model.getTargetScaler() != null) {
      obj.put("target_scaler", model.getTargetScaler().toJson());
    }
    if (model.getCovariateScaler() != null) {
      obj.put("covariate_scaler", model.getCovariateScaler().toJson());
    }
    if (model.getCovariateRegressor() != null) {
      obj.put("covariate_regressor", model.getCovariateRegressor().toJson());
    }
    obj.put("strategy_state", model.saveStrategyState());
    return obj;
  }

  private static Object nullable(Object value)
  {
    if (value == null) return JSONObject.NULL;
    if (value instanceof Double && !Double.isFinite((Double) value)) return JSONObject.NULL;
    return value;
  }

  private static Double optDouble(JSONObject obj, String key)
  {
    return obj.isNull(key) ? null : obj.getDouble(key);
  }

  /**
   * Rebuild a model from its JSON artifact.
   *
   * @throws IOException if the schema version is unsupported or the artifact is malformed
   */
  static ForecastModel fromJson(JSONObject obj, DiagnosticListener listener) throws IOException
  {
    int version = obj.optInt("schema_version", -1);
    if (version != SCHEMA_VERSION) {
      throw new IOException(String.format("Unsupported model schema version: %d (expected %d)", version,
          SCHEMA_VERSION));
    }
    try {
      ForecastingStrategy strategy = StrategyRegistry.create(obj.getString("strategy_type"));

      // The saved levels include 0.5; drop it again if it was added internally.
      List<Double> levels = new ArrayList<>();
      JSONArray jlevels = obj.getJSONArray("quantile_levels");
      for (int i = 0; i < jlevels.length(); ++i) {
        levels.add(jlevels.getDouble(i));
      }
      if (obj.getBoolean("must_drop_median")) {
        levels.remove(Double.valueOf(0.5));
      }

      ModelParams params = new ModelParams().setName(obj.getString("name"))
          .setPath(new File(obj.getString("path_root"))).setEvalMetric(obj.getString("eval_metric"))
          .setHyperparameters(Hyperparameters.fromJson(obj.getJSONObject("hyperparameters")))
          .setFreq(obj.isNull("freq") ? null : obj.getString("freq"))
          .setPredictionLength(obj.getInt("prediction_length")).setQuantileLevels(levels)
          .setCovariateMetadata(CovariateMetadata.fromJson(obj.getJSONObject("covariate_metadata")))
          .setTarget(obj.getString("target"));
      ForecastModel model = new ForecastModel(strategy, params, listener);
      model.setContexts(new File(obj.getString("path")));

      TargetScaler targetScaler = null;
      if (obj.has("target_scaler")) {
        targetScaler = Transforms.targetScalerFromJson(obj.getJSONObject("target_scaler"));
      }
      CovariateScaler covariateScaler = null;
      if (obj.has("covariate_scaler")) {
        covariateScaler = Transforms.covariateScalerFromJson(obj.getJSONObject("covariate_scaler"));
      }
      CovariateRegressor covariateRegressor = null;
      if (obj.has("covariate_regressor")) {
        covariateRegressor = CovariateRegressors.fromJson(obj.getJSONObject("covariate_regressor"), listener,
            model.getName());
      }
      model.restoreFitState(targetScaler, covariateScaler, covariateRegressor, obj.getBoolean("is_fit"));
      model.restoreStats(optDouble(obj, "fit_time"), optDouble(obj, "predict_time"),
          optDouble(obj, "predict_1_time"), optDouble(obj, "val_score"));
      strategy.loadState(obj.getJSONObject("strategy_state"));
      return model;
    } catch (JSONException | IllegalArgumentException e) {
      throw new IOException("Malformed model artifact: " + e.getMessage(), e);
    }
  }
}
