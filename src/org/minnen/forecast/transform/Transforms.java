package org.minnen.forecast.transform;

import org.json.JSONObject;
import org.minnen.forecast.data.CovariateMetadata;

/** Factory methods that build scalers from hyperparameter values or saved state. */
public class Transforms
{
  /**
   * Build a target scaler.
   *
   * @param name one of "standard", "mean_abs", "min_max", "robust"; null means no scaling
   * @param target name of the target column
   * @return new scaler or null if `name` is null
   * @throws IllegalArgumentException for an unknown scaler name
   */
  public static TargetScaler getTargetScaler(Object name, String target)
  {
    if (name == null) return null;
    if (!(name instanceof String)) {
      throw new IllegalArgumentException("target_scaler must be a string: " + name);
    }
    switch ((String) name) {
    case LocalStandardScaler.NAME:
      return new LocalStandardScaler(target);
    case LocalMeanAbsScaler.NAME:
      return new LocalMeanAbsScaler(target);
    case LocalMinMaxScaler.NAME:
      return new LocalMinMaxScaler(target);
    case LocalRobustScaler.NAME:
      return new LocalRobustScaler(target);
    default:
      throw new IllegalArgumentException(String.format("Unknown target_scaler: [%s]", name));
    }
  }

  /**
   * Build a covariate scaler.
   *
   * @param name "global"; null means no scaling
   * @param metadata roles of the covariate columns
   * @param useKnown scale known covariates
   * @param usePast scale past covariates
   * @param useStatic scale static features
   * @return new scaler or null if `name` is null
   */
  public static CovariateScaler getCovariateScaler(Object name, CovariateMetadata metadata, boolean useKnown,
      boolean usePast, boolean useStatic)
  {
    if (name == null) return null;
    if (GlobalCovariateScaler.NAME.equals(name)) {
      return new GlobalCovariateScaler(metadata, useKnown, usePast, useStatic);
    }
    throw new IllegalArgumentException(String.format("Unknown covariate_scaler: [%s]", name));
  }

  public static TargetScaler targetScalerFromJson(JSONObject obj)
  {
    LocalTargetScaler scaler = (LocalTargetScaler) getTargetScaler(obj.getString("type"), obj.getString("target"));
    scaler.loadStats(obj);
    return scaler;
  }

  public static CovariateScaler covariateScalerFromJson(JSONObject obj)
  {
    String type = obj.getString("type");
    if (!GlobalCovariateScaler.NAME.equals(type)) {
      throw new IllegalArgumentException(String.format("Unknown covariate_scaler: [%s]", type));
    }
    return GlobalCovariateScaler.fromJson(obj);
  }
}
