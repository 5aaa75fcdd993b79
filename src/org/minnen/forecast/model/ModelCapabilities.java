package org.minnen.forecast.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes what a forecasting strategy can consume. The orchestrator queries this descriptor to decide which
 * covariates to scale and which data to hand to training.
 */
public final class ModelCapabilities
{
  public static final ModelCapabilities DEFAULT = new ModelCapabilities(false, false, false, true, false, false, false);

  private final boolean                 supportsKnownCovariates;
  private final boolean                 supportsPastCovariates;
  private final boolean                 supportsStaticFeatures;
  private final boolean                 canUseTrainData;
  private final boolean                 canUseValData;
  private final boolean                 canRefitFull;
  private final boolean                 allowNan;

  private ModelCapabilities(boolean supportsKnownCovariates, boolean supportsPastCovariates,
      boolean supportsStaticFeatures, boolean canUseTrainData, boolean canUseValData, boolean canRefitFull,
      boolean allowNan)
  {
    this.supportsKnownCovariates = supportsKnownCovariates;
    this.supportsPastCovariates = supportsPastCovariates;
    this.supportsStaticFeatures = supportsStaticFeatures;
    this.canUseTrainData = canUseTrainData;
    this.canUseValData = canUseValData;
    this.canRefitFull = canRefitFull;
    this.allowNan = allowNan;
  }

  public boolean supportsKnownCovariates()
  {
    return supportsKnownCovariates;
  }

  public boolean supportsPastCovariates()
  {
    return supportsPastCovariates;
  }

  public boolean supportsStaticFeatures()
  {
    return supportsStaticFeatures;
  }

  public boolean canUseTrainData()
  {
    return canUseTrainData;
  }

  public boolean canUseValData()
  {
    return canUseValData;
  }

  public boolean canRefitFull()
  {
    return canRefitFull;
  }

  public boolean allowNan()
  {
    return allowNan;
  }

  public ModelCapabilities withKnownCovariates(boolean b)
  {
    return new ModelCapabilities(b, supportsPastCovariates, supportsStaticFeatures, canUseTrainData, canUseValData,
        canRefitFull, allowNan);
  }

  public ModelCapabilities withPastCovariates(boolean b)
  {
    return new ModelCapabilities(supportsKnownCovariates, b, supportsStaticFeatures, canUseTrainData, canUseValData,
        canRefitFull, allowNan);
  }

  public ModelCapabilities withStaticFeatures(boolean b)
  {
    return new ModelCapabilities(supportsKnownCovariates, supportsPastCovariates, b, canUseTrainData, canUseValData,
        canRefitFull, allowNan);
  }

  public ModelCapabilities withTrainData(boolean b)
  {
    return new ModelCapabilities(supportsKnownCovariates, supportsPastCovariates, supportsStaticFeatures, b,
        canUseValData, canRefitFull, allowNan);
  }

  public ModelCapabilities withValData(boolean b)
  {
    return new ModelCapabilities(supportsKnownCovariates, supportsPastCovariates, supportsStaticFeatures,
        canUseTrainData, b, canRefitFull, allowNan);
  }

  public ModelCapabilities withRefitFull(boolean b)
  {
    return new ModelCapabilities(supportsKnownCovariates, supportsPastCovariates, supportsStaticFeatures,
        canUseTrainData, canUseValData, b, allowNan);
  }

  public ModelCapabilities withAllowNan(boolean b)
  {
    return new ModelCapabilities(supportsKnownCovariates, supportsPastCovariates, supportsStaticFeatures,
        canUseTrainData, canUseValData, canRefitFull, b);
  }

  public Map<String, Object> toMap()
  {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("supports_known_covariates", supportsKnownCovariates);
    map.put("supports_past_covariates", supportsPastCovariates);
    map.put("supports_static_features", supportsStaticFeatures);
    map.put("can_use_train_data", canUseTrainData);
    map.put("can_use_val_data", canUseValData);
    map.put("can_refit_full", canRefitFull);
    map.put("allow_nan", allowNan);
    return map;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof ModelCapabilities)) return false;
    return toMap().equals(((ModelCapabilities) o).toMap());
  }

  @Override
  public int hashCode()
  {
    return toMap().hashCode();
  }

  @Override
  public String toString()
  {
    return toMap().toString();
  }
}
