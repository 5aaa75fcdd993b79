package org.minnen.forecast.model;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.minnen.forecast.metrics.Metrics;

/** Process-wide defaults for new models. */
public class ModelDefaults
{
  public static final String        DEFAULT_RESOURCE                = "forecast.properties";

  private static final File         defaultPath                     = new File("forecast-models");
  private static final List<Double> defaultQuantileLevels           = Collections
      .unmodifiableList(Arrays.asList(0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9));

  private static File               path;
  private static String             evalMetric                      = Metrics.DEFAULT;
  private static double             maxTimeLimitRatio               = 0.9;
  private static double             covariateRegressorFitTimeFraction = 0.5;
  private static List<Double>       quantileLevels                  = defaultQuantileLevels;

  /** Configure defaults from the given `config`. Missing keys leave the current value unchanged. */
  public static void configure(Configuration config)
  {
    if (config.containsKey("model.path")) {
      setPath(new File(config.getString("model.path")));
    }
    if (config.containsKey("model.eval_metric")) {
      setEvalMetric(config.getString("model.eval_metric"));
    }
    if (config.containsKey("model.max_time_limit_ratio")) {
      setMaxTimeLimitRatio(config.getDouble("model.max_time_limit_ratio"));
    }
    if (config.containsKey("model.covariate_regressor_fit_time_fraction")) {
      setCovariateRegressorFitTimeFraction(config.getDouble("model.covariate_regressor_fit_time_fraction"));
    }
    if (config.containsKey("model.quantile_levels")) {
      List<Double> levels = new ArrayList<>();
      for (String s : config.getStringArray("model.quantile_levels")) {
        for (String tok : s.split(",")) {
          if (!tok.isBlank()) levels.add(Double.parseDouble(tok.trim()));
        }
      }
      setQuantileLevels(levels);
    }
  }

  /**
   * Load defaults from a properties file on the classpath.
   *
   * @param resource name of the resource (e.g. "forecast.properties")
   * @throws IOException if the resource doesn't exist or can't be parsed
   */
  public static void load(String resource) throws IOException
  {
    InputStream in = ModelDefaults.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new IOException(String.format("Can't find configuration resource (%s)", resource));
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      PropertiesConfiguration config = new PropertiesConfiguration();
      config.read(reader);
      configure(config);
    } catch (ConfigurationException e) {
      throw new IOException(String.format("Malformed configuration resource (%s)", resource), e);
    }
  }

  /** Restore built-in defaults. */
  public static void reset()
  {
    path = null;
    evalMetric = Metrics.DEFAULT;
    maxTimeLimitRatio = 0.9;
    covariateRegressorFitTimeFraction = 0.5;
    quantileLevels = defaultQuantileLevels;
  }

  /** @return root directory for models created without an explicit path */
  public static File getPath()
  {
    return path == null ? defaultPath : path;
  }

  public static void setPath(File path)
  {
    ModelDefaults.path = path;
  }

  public static String getEvalMetric()
  {
    return evalMetric;
  }

  public static void setEvalMetric(String evalMetric)
  {
    Metrics.get(evalMetric); // validate
    ModelDefaults.evalMetric = evalMetric;
  }

  public static double getMaxTimeLimitRatio()
  {
    return maxTimeLimitRatio;
  }

  public static void setMaxTimeLimitRatio(double ratio)
  {
    if (ratio <= 0 || ratio > 1) {
      throw new IllegalArgumentException("max_time_limit_ratio must be in (0, 1]: " + ratio);
    }
    maxTimeLimitRatio = ratio;
  }

  public static double getCovariateRegressorFitTimeFraction()
  {
    return covariateRegressorFitTimeFraction;
  }

  public static void setCovariateRegressorFitTimeFraction(double fraction)
  {
    if (fraction < 0 || fraction > 1) {
      throw new IllegalArgumentException("covariate_regressor_fit_time_fraction must be in [0, 1]: " + fraction);
    }
    covariateRegressorFitTimeFraction = fraction;
  }

  public static List<Double> getQuantileLevels()
  {
    return quantileLevels;
  }

  public static void setQuantileLevels(List<Double> levels)
  {
    ModelParams.checkQuantileLevels(levels);
    quantileLevels = Collections.unmodifiableList(new ArrayList<>(levels));
  }
}
