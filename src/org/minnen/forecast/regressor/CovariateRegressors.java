package org.minnen.forecast.regressor;

import java.util.Map;

import org.json.JSONObject;
import org.minnen.forecast.data.CovariateMetadata;
import org.minnen.forecast.model.diag.DiagnosticListener;

/** Builds covariate regressors from the "covariate_regressor" hyperparameter. */
public class CovariateRegressors
{
  /**
   * Build a covariate regressor.
   *
   * The hyperparameter is either a model name ("ridge") or a map with the keys "model", "lambda",
   * "refit_during_predict" and "max_num_samples".
   *
   * @return new regressor or null if `config` is null
   * @throws IllegalArgumentException if the value can't be interpreted
   */
  public static CovariateRegressor get(Object config, String target, CovariateMetadata metadata,
      DiagnosticListener listener, String source)
  {
    if (config == null) return null;

    String name;
    double lambda = GlobalCovariateRegressor.DEFAULT_LAMBDA;
    boolean refitDuringPredict = false;
    int maxNumSamples = GlobalCovariateRegressor.DEFAULT_MAX_NUM_SAMPLES;
    if (config instanceof String) {
      name = (String) config;
    } else if (config instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) config;
      Object model = map.get("model");
      name = (model == null ? GlobalCovariateRegressor.NAME : model.toString());
      lambda = number(map, "lambda", lambda).doubleValue();
      maxNumSamples = number(map, "max_num_samples", maxNumSamples).intValue();
      Object refit = map.get("refit_during_predict");
      if (refit != null) {
        if (!(refit instanceof Boolean)) {
          throw new IllegalArgumentException("refit_during_predict must be a boolean: " + refit);
        }
        refitDuringPredict = (Boolean) refit;
      }
    } else {
      throw new IllegalArgumentException("covariate_regressor must be a string or a map: " + config);
    }

    if (!GlobalCovariateRegressor.NAME.equals(name)) {
      throw new IllegalArgumentException(String.format("Unknown covariate_regressor: [%s]", name));
    }
    return new GlobalCovariateRegressor(target, metadata, lambda, refitDuringPredict, maxNumSamples, listener, source);
  }

  private static Number number(Map<?, ?> map, String key, Number defaultValue)
  {
    Object value = map.get(key);
    if (value == null) return defaultValue;
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(String.format("%s must be a number: %s", key, value));
    }
    return (Number) value;
  }

  public static CovariateRegressor fromJson(JSONObject obj, DiagnosticListener listener, String source)
  {
    String type = obj.getString("type");
    if (!GlobalCovariateRegressor.NAME.equals(type)) {
      throw new IllegalArgumentException(String.format("Unknown covariate_regressor: [%s]", type));
    }
    return GlobalCovariateRegressor.fromJson(obj, listener, source);
  }
}
