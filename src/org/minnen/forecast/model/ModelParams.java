package org.minnen.forecast.model;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.minnen.forecast.data.CovariateMetadata;

/**
 * Constructor parameters of a {@link ForecastModel}. Everything needed to rebuild an equivalent unfitted model.
 *
 * Setters return `this` so that parameters can be chained.
 */
public class ModelParams
{
  /** Root directory; the model lives in {@code <path>/<name>}. Null means "create a default directory". */
  private File                path;
  private String              name;
  private String              evalMetric;
  private Map<String, Object> hyperparameters;
  private String              freq;
  private int                 predictionLength  = 1;
  private List<Double>        quantileLevels    = new ArrayList<>(ModelDefaults.getQuantileLevels());
  private CovariateMetadata   covariateMetadata = CovariateMetadata.empty();
  private String              target            = "target";

  /**
   * Verify that all quantile levels are strictly between zero and one.
   *
   * @throws IllegalArgumentException otherwise
   */
  public static void checkQuantileLevels(List<Double> levels)
  {
    for (Double q : levels) {
      if (q == null || !(q > 0.0 && q < 1.0)) {
        throw new IllegalArgumentException(
            "Invalid quantile_levels: quantiles must be between 0 and 1 (exclusive), got " + levels);
      }
    }
  }

  public File getPath()
  {
    return path;
  }

  public ModelParams setPath(File path)
  {
    this.path = path;
    return this;
  }

  public String getName()
  {
    return name;
  }

  public ModelParams setName(String name)
  {
    this.name = name;
    return this;
  }

  public String getEvalMetric()
  {
    return evalMetric;
  }

  public ModelParams setEvalMetric(String evalMetric)
  {
    this.evalMetric = evalMetric;
    return this;
  }

  /** @return hyperparameters with auxiliary arguments under {@link Hyperparameters#AUX_ARGS_KEY} (may be null) */
  public Map<String, Object> getHyperparameters()
  {
    return hyperparameters;
  }

  public ModelParams setHyperparameters(Map<String, Object> hyperparameters)
  {
    this.hyperparameters = hyperparameters;
    return this;
  }

  public String getFreq()
  {
    return freq;
  }

  public ModelParams setFreq(String freq)
  {
    this.freq = freq;
    return this;
  }

  public int getPredictionLength()
  {
    return predictionLength;
  }

  public ModelParams setPredictionLength(int predictionLength)
  {
    if (predictionLength <= 0) {
      throw new IllegalArgumentException("prediction_length must be positive: " + predictionLength);
    }
    this.predictionLength = predictionLength;
    return this;
  }

  public List<Double> getQuantileLevels()
  {
    return quantileLevels;
  }

  public ModelParams setQuantileLevels(List<Double> quantileLevels)
  {
    this.quantileLevels = new ArrayList<>(quantileLevels);
    return this;
  }

  public ModelParams setQuantileLevels(double... levels)
  {
    quantileLevels = new ArrayList<>();
    for (double q : levels) {
      quantileLevels.add(q);
    }
    return this;
  }

  public CovariateMetadata getCovariateMetadata()
  {
    return covariateMetadata;
  }

  public ModelParams setCovariateMetadata(CovariateMetadata covariateMetadata)
  {
    this.covariateMetadata = (covariateMetadata == null ? CovariateMetadata.empty() : covariateMetadata);
    return this;
  }

  public String getTarget()
  {
    return target;
  }

  public ModelParams setTarget(String target)
  {
    this.target = target;
    return this;
  }

  /** @return deep copy of these parameters */
  public ModelParams copy()
  {
    ModelParams params = new ModelParams();
    params.path = path;
    params.name = name;
    params.evalMetric = evalMetric;
    params.hyperparameters = (hyperparameters == null ? null : Hyperparameters.deepCopy(hyperparameters));
    params.freq = freq;
    params.predictionLength = predictionLength;
    params.quantileLevels = new ArrayList<>(quantileLevels);
    params.covariateMetadata = covariateMetadata;
    params.target = target;
    return params;
  }

  @Override
  public String toString()
  {
    return String.format("[%s: path=%s, metric=%s, freq=%s, h=%d, q=%s, target=%s, hp=%s]", name, path, evalMetric,
        freq, predictionLength, quantileLevels, target, hyperparameters);
  }
}
