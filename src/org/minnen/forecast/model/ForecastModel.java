package org.minnen.forecast.model;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;
import org.json.JSONObject;
import org.minnen.forecast.data.CovariateMetadata;
import org.minnen.forecast.data.DataIO;
import org.minnen.forecast.data.ModelInputs;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.metrics.ForecastMetric;
import org.minnen.forecast.metrics.Metrics;
import org.minnen.forecast.model.diag.Diagnostic;
import org.minnen.forecast.model.diag.DiagnosticListener;
import org.minnen.forecast.model.diag.LoggingDiagnosticListener;
import org.minnen.forecast.regressor.CovariateRegressor;
import org.minnen.forecast.regressor.CovariateRegressors;
import org.minnen.forecast.transform.CovariateScaler;
import org.minnen.forecast.transform.TargetScaler;
import org.minnen.forecast.transform.Transforms;
import org.minnen.forecast.util.ForecastLib;
import org.minnen.forecast.util.Frequency;
import org.minnen.forecast.util.Library;
import org.minnen.forecast.util.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A forecasting model: fixed orchestration of fitting, prediction, scoring and persistence around an injected
 * {@link ForecastingStrategy}.
 *
 * Fitting scales the target and covariates, optionally residualizes the target with a covariate regressor, computes
 * the time budget and then hands the transformed data to the strategy. Prediction applies the same transforms, lets
 * the strategy forecast, reconciles the quantile columns and maps the forecast back to the original scale.
 *
 * The working quantile levels always contain 0.5. If the user didn't ask for the median it is dropped from the output.
 *
 * A model is used by one caller at a time; no method is thread-safe.
 */
public final class ForecastModel
{
  private static final Logger       log               = LoggerFactory.getLogger(ForecastModel.class);

  public static final String        REFIT_FULL_SUFFIX = "_FULL";
  public static final String        MODEL_FILE        = "model.json";
  public static final String        INFO_FILE         = "info.json";
  public static final String        UTILS_DIR         = "utils";
  public static final String        OOF_FILE          = "oof.json";

  private static final String       MEDIAN            = ForecastLib.quantileColumnName(0.5);

  private final ForecastingStrategy strategy;
  private final DiagnosticListener  listener;
  private ResourceManager           resourceManager   = SystemResourceManager.INSTANCE;
  private TimeSource                timeSource        = TimeSource.SYSTEM;

  private String                    name;
  private File                      pathRoot;
  private File                      path;

  private final String              freq;
  private final int                 predictionLength;
  private final String              target;
  private final CovariateMetadata   covariateMetadata;
  private final ForecastMetric      evalMetric;
  private final List<Double>        quantileLevels;
  private final boolean             mustDropMedian;
  private final Map<String, Object> hyperparameters;
  private final Map<String, Object> auxArgs;

  private TargetScaler              targetScaler;
  private CovariateScaler           covariateScaler;
  private CovariateRegressor        covariateRegressor;

  private boolean                   bFit;
  private Double                    fitTime;
  private Double                    predictTime;
  private Double                    predict1Time;
  private Double                    valScore;
  private List<TimeSeriesData>      oofPredictions;

  public ForecastModel(ForecastingStrategy strategy, ModelParams params)
  {
    this(strategy, params, LoggingDiagnosticListener.INSTANCE);
  }

  /**
   * Create an unfitted model.
   *
   * @param strategy model-specific training / prediction logic
   * @param params configuration
   * @param listener receives diagnostics
   * @throws IllegalArgumentException for invalid quantile levels, auxiliary arguments or metric
   * @throws UncheckedIOException if no path is given and the default directory can't be created
   */
  public ForecastModel(ForecastingStrategy strategy, ModelParams params, DiagnosticListener listener)
  {
    this.strategy = strategy;
    this.listener = listener;
    this.name = StringUtils.isEmpty(params.getName()) ? strategy.getType() : params.getName();

    if (params.getPath() == null) {
      try {
        File dir = ForecastLib.setupOutputDir(ModelDefaults.getPath(), name);
        pathRoot = dir.getParentFile();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("path", pathRoot.getPath());
      listener.onDiagnostic(new Diagnostic(Diagnostic.Kind.DEFAULT_PATH, name,
          "No path was specified for model, defaulting to: " + pathRoot, details));
    } else {
      pathRoot = params.getPath();
    }
    path = new File(pathRoot, name);

    String metric = params.getEvalMetric() == null ? ModelDefaults.getEvalMetric() : params.getEvalMetric();
    this.evalMetric = Metrics.get(metric);
    this.target = params.getTarget();
    this.covariateMetadata = params.getCovariateMetadata();
    this.freq = params.getFreq();
    this.predictionLength = params.getPredictionLength();

    List<Double> levels = params.getQuantileLevels();
    ModelParams.checkQuantileLevels(levels);
    TreeSet<Double> working = new TreeSet<>(levels);
    this.mustDropMedian = !working.contains(0.5);
    working.add(0.5);
    this.quantileLevels = Collections.unmodifiableList(new ArrayList<>(working));

    Hyperparameters.Split split = Hyperparameters.split(params.getHyperparameters(), listener, name);
    this.hyperparameters = split.hyperparameters;
    this.auxArgs = split.auxArgs;
  }

  public ForecastModel setResourceManager(ResourceManager resourceManager)
  {
    this.resourceManager = resourceManager;
    return this;
  }

  public ForecastModel setTimeSource(TimeSource timeSource)
  {
    this.timeSource = timeSource;
    return this;
  }

  public ForecastingStrategy getStrategy()
  {
    return strategy;
  }

  public DiagnosticListener getDiagnosticListener()
  {
    return listener;
  }

  public String getName()
  {
    return name;
  }

  /** @return directory holding this model's artifacts */
  public File getPath()
  {
    return path;
  }

  public File getPathRoot()
  {
    return pathRoot;
  }

  public String getFreq()
  {
    return freq;
  }

  public int getPredictionLength()
  {
    return predictionLength;
  }

  public String getTarget()
  {
    return target;
  }

  public CovariateMetadata getCovariateMetadata()
  {
    return covariateMetadata;
  }

  public ForecastMetric getEvalMetric()
  {
    return evalMetric;
  }

  /** @return sorted working quantile levels; always contains 0.5 */
  public List<Double> getQuantileLevels()
  {
    return quantileLevels;
  }

  /** @return true if 0.5 was added internally and is removed from the predictions */
  public boolean mustDropMedian()
  {
    return mustDropMedian;
  }

  /** @return copy of the auxiliary arguments */
  public Map<String, Object> getAuxArgs()
  {
    return Hyperparameters.deepCopy(auxArgs);
  }

  /** @return strategy defaults overlaid with the user hyperparameters */
  public Map<String, Object> getHyperparameters()
  {
    Map<String, Object> merged = new LinkedHashMap<>(strategy.getDefaultHyperparameters());
    merged.putAll(hyperparameters);
    return merged;
  }

  /** @return copy of the user hyperparameters, which may hold search spaces */
  public Map<String, Object> getSearchSpace()
  {
    return Hyperparameters.deepCopy(hyperparameters);
  }

  public List<String> getAllowedHyperparameters()
  {
    List<String> allowed = new ArrayList<>();
    allowed.add(Hyperparameters.TARGET_SCALER);
    allowed.add(Hyperparameters.COVARIATE_SCALER);
    allowed.add(Hyperparameters.COVARIATE_REGRESSOR);
    allowed.addAll(strategy.getAllowedHyperparameters());
    return allowed;
  }

  /** @return strategy capabilities; a configured covariate regressor adds known covariates and static features */
  public ModelCapabilities getCapabilities()
  {
    ModelCapabilities caps = strategy.getCapabilities();
    if (getHyperparameters().get(Hyperparameters.COVARIATE_REGRESSOR) != null) {
      caps = caps.withKnownCovariates(true).withStaticFeatures(true);
    }
    return caps;
  }

  public TargetScaler getTargetScaler()
  {
    return targetScaler;
  }

  public CovariateScaler getCovariateScaler()
  {
    return covariateScaler;
  }

  public CovariateRegressor getCovariateRegressor()
  {
    return covariateRegressor;
  }

  public boolean isFit()
  {
    return bFit;
  }

  /** @return seconds spent in the last call to fit (null if not fit) */
  public Double getFitTime()
  {
    return fitTime;
  }

  public Double getPredictTime()
  {
    return predictTime;
  }

  /** @return prediction time per forecast item (null unless measured) */
  public Double getPredict1Time()
  {
    return predict1Time;
  }

  public Double getValScore()
  {
    return valScore;
  }

  public void setValScore(Double valScore)
  {
    this.valScore = valScore;
  }

  /** @return snapshot of the configuration handed to the strategy */
  public ModelContext getContext()
  {
    return new ModelContext(name, freq, predictionLength, target, quantileLevels, covariateMetadata,
        getHyperparameters(), evalMetric);
  }

  public void rename(String newName)
  {
    path = new File(path.getParentFile(), newName);
    name = newName;
  }

  /** Point this model at a new directory; the root becomes the directory's parent. */
  public void setContexts(File pathContext)
  {
    path = pathContext;
    pathRoot = pathContext.getAbsoluteFile().getParentFile();
  }

  /** Ask the strategy to load lazily held assets into memory. */
  public ForecastModel persist()
  {
    strategy.persist();
    return this;
  }

  public boolean isGpuAvailable()
  {
    return strategy.isGpuAvailable();
  }

  /**
   * Fail if any hyperparameter is still a search space.
   *
   * @throws IllegalArgumentException if a search space is found
   */
  public void checkFitParams()
  {
    if (Hyperparameters.containsSpace(getHyperparameters())) {
      throw new IllegalArgumentException("Hyperparameter spaces provided to fit. Please provide concrete values as "
          + "hyperparameters when creating the model or tune the hyperparameters first.");
    }
  }

  /** Raise a diagnostic listing hyperparameters that neither the model nor its strategy use. */
  public void logUnusedHyperparameters()
  {
    List<String> allowed = getAllowedHyperparameters();
    List<String> unused = new ArrayList<>();
    for (String key : getHyperparameters().keySet()) {
      if (!allowed.contains(key)) unused.add(key);
    }
    if (!unused.isEmpty()) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("unused", unused);
      listener.onDiagnostic(new Diagnostic(Diagnostic.Kind.UNUSED_HYPERPARAMETERS, name,
          String.format("%s ignores following hyperparameters: %s. See the documentation for %s for the list of "
              + "supported hyperparameters.", name, unused, name),
          details));
    }
  }

  private void initializeTransforms()
  {
    Map<String, Object> hp = getHyperparameters();
    ModelCapabilities caps = getCapabilities();
    targetScaler = Transforms.getTargetScaler(hp.get(Hyperparameters.TARGET_SCALER), target);
    covariateScaler = Transforms.getCovariateScaler(hp.get(Hyperparameters.COVARIATE_SCALER), covariateMetadata,
        caps.supportsKnownCovariates(), caps.supportsPastCovariates(), caps.supportsStaticFeatures());
    covariateRegressor = CovariateRegressors.get(hp.get(Hyperparameters.COVARIATE_REGRESSOR), target,
        covariateMetadata, listener, name);
  }

  /**
   * Apply the ratio and cap from the auxiliary arguments to a time limit.
   *
   * @param timeLimit remaining seconds
   * @return min(timeLimit * ratio, cap)
   */
  public double adjustTimeLimit(double timeLimit)
  {
    double ratio = Hyperparameters.getDouble(auxArgs, Hyperparameters.MAX_TIME_LIMIT_RATIO,
        ModelDefaults.getMaxTimeLimitRatio());
    Double cap = Hyperparameters.getDouble(auxArgs, Hyperparameters.MAX_TIME_LIMIT);
    double adjusted = timeLimit * ratio;
    if (cap != null) {
      adjusted = Math.min(adjusted, cap);
    }
    if (adjusted != timeLimit) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("original", timeLimit);
      details.put("adjusted", adjusted);
      details.put(Hyperparameters.MAX_TIME_LIMIT, cap);
      details.put(Hyperparameters.MAX_TIME_LIMIT_RATIO, ratio);
      listener.onDiagnostic(new Diagnostic(Diagnostic.Kind.TIME_LIMIT_ADJUSTED, name,
          String.format("Time limit adjusted due to model hyperparameters: %s -> %s (max_time_limit=%s, "
              + "max_time_limit_ratio=%s)", Library.formatSeconds(timeLimit), Library.formatSeconds(adjusted), cap,
              ratio),
          details));
    }
    return adjusted;
  }

  public ForecastModel fit(TimeSeriesData train)
  {
    return fit(train, null, null);
  }

  public ForecastModel fit(TimeSeriesData train, TimeSeriesData val, Double timeLimit)
  {
    return fit(train, val, timeLimit, 2, null);
  }

  /**
   * Fit the model in place.
   *
   * @param train training data
   * @param val validation data (may be null; only used if the strategy can use it)
   * @param timeLimit seconds available for fitting, or null for no limit
   * @param verbosity detail level passed to the strategy
   * @param kwargs extra arguments; "num_cpus" and "num_gpus" override the discovered resources, the rest is passed to
   *          the strategy
   * @return this model
   * @throws IllegalArgumentException if a hyperparameter is still a search space or a transform is misconfigured
   * @throws TimeLimitExceededException if no time is left for training
   */
  public ForecastModel fit(TimeSeriesData train, TimeSeriesData val, Double timeLimit, int verbosity,
      Map<String, Object> kwargs)
  {
    final long startNanos = timeSource.nanoTime();
    checkFitParams();
    logUnusedHyperparameters();
    // Unfit until training completes.
    bFit = false;
    initializeTransforms();

    if (targetScaler != null) {
      train = targetScaler.fitTransform(train);
    }
    if (covariateScaler != null) {
      train = covariateScaler.fitTransform(train);
    }
    if (covariateRegressor != null) {
      Double regressorTimeLimit = null;
      if (timeLimit != null) {
        double fraction = Hyperparameters.getDouble(auxArgs, Hyperparameters.COVARIATE_REGRESSOR_FIT_TIME_FRACTION,
            ModelDefaults.getCovariateRegressorFitTimeFraction());
        regressorTimeLimit = fraction * timeLimit;
      }
      covariateRegressor.fit(train, regressorTimeLimit);
    }

    ModelCapabilities caps = getCapabilities();
    if (caps.canUseTrainData()) {
      if (covariateRegressor != null) {
        train = covariateRegressor.transform(train);
      }
      train = strategy.preprocess(train, null, true).data;
    }

    TimeSeriesData valData = null;
    if (caps.canUseValData() && val != null) {
      valData = val;
      if (targetScaler != null) {
        valData = targetScaler.transform(valData);
      }
      if (covariateScaler != null) {
        valData = covariateScaler.transform(valData);
      }
      if (covariateRegressor != null) {
        valData = covariateRegressor.transform(valData);
      }
      valData = strategy.preprocess(valData, null, false).data;
    }

    Double adjustedTimeLimit = null;
    if (timeLimit != null) {
      double remaining = timeLimit - timeSource.secondsSince(startNanos);
      adjustedTimeLimit = adjustTimeLimit(remaining);
      if (adjustedTimeLimit <= 0) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("time_left", adjustedTimeLimit);
        listener.onDiagnostic(new Diagnostic(Diagnostic.Kind.NO_TIME_LEFT, name, String
            .format("Model has no time left to train, skipping model... (Time Left = %.1fs)", adjustedTimeLimit),
            details));
        throw new TimeLimitExceededException(name, adjustedTimeLimit);
      }
    }

    Resources resources = resourceManager.getResources().merge(kwargs);
    Map<String, Object> extraArgs = new LinkedHashMap<>();
    if (kwargs != null) {
      extraArgs.putAll(kwargs);
      extraArgs.remove(Resources.NUM_CPUS);
      extraArgs.remove(Resources.NUM_GPUS);
    }

    strategy.train(new TrainRequest(getContext(), train, valData, adjustedTimeLimit, resources, verbosity, extraArgs));
    bFit = true;
    fitTime = timeSource.secondsSince(startNanos);
    log.debug("{} fit in {}", name, Library.formatSeconds(fitTime));
    return this;
  }

  public TimeSeriesData predict(TimeSeriesData data)
  {
    return predict(data, null, null);
  }

  /**
   * Forecast the next `predictionLength` steps of every item in `data`.
   *
   * @param data historical context
   * @param knownCovariates known covariates over the forecast horizon (may be null)
   * @param options extra arguments for the strategy (may be null)
   * @return table with columns "mean" followed by the requested quantile levels, in the original target scale
   * @throws IllegalStateException if the model is not fit
   */
  public TimeSeriesData predict(TimeSeriesData data, TimeSeriesData knownCovariates, Map<String, Object> options)
  {
    if (!bFit) {
      throw new IllegalStateException(String.format("Model %s must be fit before predicting", name));
    }
    if (targetScaler != null) {
      data = targetScaler.fitTransform(data);
    }
    if (covariateScaler != null) {
      data = covariateScaler.fitTransform(data);
      knownCovariates = covariateScaler.transformKnownCovariates(knownCovariates);
    }
    if (covariateRegressor != null) {
      data = covariateRegressor.fitTransform(data);
    }

    ModelInputs inputs = strategy.preprocess(data, knownCovariates, false);
    data = inputs.data;
    knownCovariates = inputs.knownCovariates;

    // The strategy only sees the context; the regressor stays with the orchestrator.
    TimeSeriesData predictions = strategy.infer(getContext(), data, knownCovariates,
        options == null ? Collections.emptyMap() : options);
    predictions = reconcileQuantiles(predictions);

    if (covariateRegressor != null) {
      if (knownCovariates == null) {
        knownCovariates = getForecastHorizonIndex(data);
      }
      predictions = covariateRegressor.inverseTransform(predictions, knownCovariates, data.getStaticFeatures());
    }
    if (targetScaler != null) {
      predictions = targetScaler.inverseTransform(predictions);
    }
    return predictions;
  }

  /**
   * Bring raw strategy output into the canonical column layout.
   *
   * Columns are reindexed to "mean" plus the working quantile levels (missing columns become NaN). If the metric is
   * optimized by the median, "mean" is replaced by the 0.5 column; a median that wasn't requested is dropped.
   */
  public TimeSeriesData reconcileQuantiles(TimeSeriesData predictions)
  {
    List<String> order = ForecastLib.predictionColumns(quantileLevels);
    if (predictions.getColumns().equals(order)) {
      predictions = predictions.dup();
    } else {
      predictions = predictions.reindexColumns(order);
    }
    if (predictions.hasColumn(MEDIAN)) {
      if (evalMetric.isOptimizedByMedian()) {
        predictions.copyColumn(MEDIAN, ForecastLib.MEAN_COLUMN);
      }
      if (mustDropMedian) {
        predictions = predictions.dropColumn(MEDIAN);
      }
    }
    return predictions;
  }

  /** @return zero-column table holding the next `predictionLength` timestamps of every item */
  public TimeSeriesData getForecastHorizonIndex(TimeSeriesData data)
  {
    return ForecastLib.makeFutureData(data, predictionLength, freq == null ? null : Frequency.parse(freq));
  }

  /**
   * Score the model on the last `predictionLength` steps of every item. Higher is better.
   */
  public double score(TimeSeriesData data)
  {
    ModelInputs inputs = data.getModelInputsForScoring(predictionLength, covariateMetadata.getKnownCovariates());
    TimeSeriesData predictions = predict(inputs.data, inputs.knownCovariates, null);
    return evalMetric.score(data, predictions, target);
  }

  /**
   * Predict the held-out tail of `valData` and cache the forecast as the out-of-fold predictions.
   *
   * @param valData validation data
   * @param storeValScore also compute and store the validation score
   * @param storePredictTime also store the prediction time
   * @param predictOptions extra arguments for the strategy (may be null)
   */
  public void scoreAndCacheOof(TimeSeriesData valData, boolean storeValScore, boolean storePredictTime,
      Map<String, Object> predictOptions)
  {
    ModelInputs inputs = valData.getModelInputsForScoring(predictionLength, covariateMetadata.getKnownCovariates());
    long startNanos = timeSource.nanoTime();
    TimeSeriesData predictions = predict(inputs.data, inputs.knownCovariates, predictOptions);
    oofPredictions = new ArrayList<>(Collections.singletonList(predictions));
    if (storePredictTime) {
      predictTime = timeSource.secondsSince(startNanos);
      predict1Time = predictTime / Math.max(1, predictions.getNumItems());
    }
    if (storeValScore) {
      valScore = evalMetric.score(valData, predictions, target);
    }
  }

  /**
   * @return cached out-of-fold predictions, loaded from disk if they are not in memory
   * @throws IOException if they have to be loaded and can't be
   */
  public List<TimeSeriesData> getOofPredictions() throws IOException
  {
    if (oofPredictions == null) {
      oofPredictions = loadOofPredictions(path);
    }
    return oofPredictions;
  }

  public static List<TimeSeriesData> loadOofPredictions(File path) throws IOException
  {
    return DataIO.loadPredictionList(new File(new File(path, UTILS_DIR), OOF_FILE));
  }

  public File save() throws IOException
  {
    return save(null);
  }

  /**
   * Save this model. Out-of-fold predictions go to a separate artifact and never into the model file.
   *
   * @param dir target directory or null for the model's own path
   * @return directory that was written
   */
  public File save(File dir) throws IOException
  {
    if (dir == null) dir = path;
    if (oofPredictions != null) {
      DataIO.savePredictionList(oofPredictions, new File(new File(dir, UTILS_DIR), OOF_FILE));
    }
    DataIO.writeJson(ModelSerializer.toJson(this), new File(dir, MODEL_FILE));
    log.debug("Saved model {}: {}", name, dir);
    return dir;
  }

  public static ForecastModel load(File dir) throws IOException
  {
    return load(dir, true, false);
  }

  public static ForecastModel load(File dir, boolean resetPaths, boolean loadOof) throws IOException
  {
    return load(dir, resetPaths, loadOof, LoggingDiagnosticListener.INSTANCE);
  }

  /**
   * Load a saved model.
   *
   * @param dir directory written by {@link #save}
   * @param resetPaths point the model at `dir` instead of the saved location
   * @param loadOof also load the out-of-fold predictions
   * @param listener receives diagnostics of the loaded model
   * @throws IOException if the artifact is missing, malformed or has an unsupported schema
   */
  public static ForecastModel load(File dir, boolean resetPaths, boolean loadOof, DiagnosticListener listener)
      throws IOException
  {
    ForecastModel model = ModelSerializer.fromJson(DataIO.readJson(new File(dir, MODEL_FILE)), listener);
    if (resetPaths) {
      model.setContexts(dir);
    }
    if (loadOof && model.oofPredictions == null) {
      model.oofPredictions = loadOofPredictions(dir);
    }
    log.debug("Loaded model {}: {}", model.name, dir);
    return model;
  }

  /** @return summary of this model */
  public Map<String, Object> getInfo()
  {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("name", name);
    info.put("model_type", strategy.getType());
    info.put("eval_metric", evalMetric.getName());
    info.put("fit_time", fitTime);
    info.put("predict_time", predictTime);
    info.put("freq", freq);
    info.put("prediction_length", predictionLength);
    info.put("quantile_levels", new ArrayList<>(quantileLevels));
    info.put("val_score", valScore);
    info.put("hyperparameters", getHyperparameters());
    info.put("covariate_metadata", covariateMetadata.toMap());
    return info;
  }

  /** Cache {@link #getInfo()} next to the model. */
  public Map<String, Object> saveInfo() throws IOException
  {
    Map<String, Object> info = getInfo();
    DataIO.writeJson(Hyperparameters.toJson(info), new File(path, INFO_FILE));
    return info;
  }

  /**
   * Load cached model info.
   *
   * @param dir model directory
   * @param loadModelIfRequired if the cached info can't be read, load the model and compute it
   * @throws IOException if the info can't be read and the fallback is disabled (or fails too)
   */
  public static Map<String, Object> loadInfo(File dir, boolean loadModelIfRequired) throws IOException
  {
    try {
      return Hyperparameters.fromJson(DataIO.readJson(new File(dir, INFO_FILE)));
    } catch (IOException e) {
      if (!loadModelIfRequired) throw e;
      LoggingDiagnosticListener.INSTANCE.onDiagnostic(new Diagnostic(Diagnostic.Kind.INFO_FALLBACK, dir.getName(),
          "Cached info unavailable (" + e.getMessage() + "), loading model"));
      return load(dir, true, false).getInfo();
    }
  }

  /** @return parameters that rebuild an equivalent unfitted model */
  public ModelParams getParams()
  {
    Map<String, Object> hp = Hyperparameters.deepCopy(hyperparameters);
    if (!auxArgs.isEmpty()) {
      hp.put(Hyperparameters.AUX_ARGS_KEY, Hyperparameters.deepCopy(auxArgs));
    }
    return new ModelParams().setPath(pathRoot).setName(name).setEvalMetric(evalMetric.getName())
        .setHyperparameters(hp).setFreq(freq).setPredictionLength(predictionLength)
        .setQuantileLevels(new ArrayList<>(quantileLevels)).setCovariateMetadata(covariateMetadata)
        .setTarget(target);
  }

  /**
   * Duplicate this fitted model under the name {@code <name>_FULL} by saving and reloading it. The copy has no
   * validation score or prediction time.
   */
  public ForecastModel convertToRefitFullViaCopy() throws IOException
  {
    String previousName = name;
    rename(name + REFIT_FULL_SUFFIX);
    File refitPath = path;
    try {
      save(refitPath);
    } finally {
      rename(previousName);
    }

    ForecastModel refit = load(refitPath, true, false, listener);
    refit.valScore = null;
    refit.predictTime = null;
    refit.predict1Time = null;
    refit.resourceManager = resourceManager;
    refit.timeSource = timeSource;
    return refit;
  }

  /** @return new unfitted model named {@code <name>_FULL} with the same configuration */
  public ForecastModel convertToRefitFullTemplate()
  {
    ModelParams params = getParams().copy();

    // Remove the synthetic median so that the template computes mustDropMedian the same way.
    if (mustDropMedian) {
      params.getQuantileLevels().remove(Double.valueOf(0.5));
    }
    Map<String, Object> hp = params.getHyperparameters();
    if (hp == null) {
      hp = new LinkedHashMap<>();
      params.setHyperparameters(hp);
    }
    hp.putIfAbsent(Hyperparameters.AUX_ARGS_KEY, new LinkedHashMap<String, Object>());
    params.setName(name + REFIT_FULL_SUFFIX);

    ForecastModel template = new ForecastModel(strategy.newInstance(), params, listener);
    template.resourceManager = resourceManager;
    template.timeSource = timeSource;
    return template;
  }

  // Package-private access for ModelSerializer.

  void restoreFitState(TargetScaler targetScaler, CovariateScaler covariateScaler,
      CovariateRegressor covariateRegressor, boolean bFit)
  {
    this.targetScaler = targetScaler;
    this.covariateScaler = covariateScaler;
    this.covariateRegressor = covariateRegressor;
    this.bFit = bFit;
  }

  void restoreStats(Double fitTime, Double predictTime, Double predict1Time, Double valScore)
  {
    this.fitTime = fitTime;
    this.predictTime = predictTime;
    this.predict1Time = predict1Time;
    this.valScore = valScore;
  }

  JSONObject saveStrategyState()
  {
    return strategy.saveState();
  }

  @Override
  public String toString()
  {
    return name;
  }
}
