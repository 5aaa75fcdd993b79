package org.minnen.forecast.tests;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;
import org.minnen.forecast.data.FeatureVec;
import org.minnen.forecast.data.ModelInputs;
import org.minnen.forecast.data.Sequence;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.model.ForecastingStrategy;
import org.minnen.forecast.model.ModelCapabilities;
import org.minnen.forecast.model.ModelContext;
import org.minnen.forecast.model.StrategyRegistry;
import org.minnen.forecast.model.TrainRequest;
import org.minnen.forecast.util.ForecastLib;

/**
 * Strategy with predictable output used to observe the orchestration in ForecastModel.
 *
 * The forecast for quantile column q is 100 * q plus the last observed target value; "mean" is -1 plus the last target.
 */
public class StubStrategy implements ForecastingStrategy
{
  static {
    StrategyRegistry.register("Stub", StubStrategy::new);
  }

  public ModelCapabilities capabilities   = ModelCapabilities.DEFAULT;

  /** Output columns of infer(); null means the working prediction columns. */
  public List<String>      outputColumns;

  /** Clock advanced during training preprocessing and inference. */
  public FakeTimeSource    clock;
  public double            preprocessSeconds;
  public double            inferSeconds;

  public TrainRequest      lastRequest;
  public TimeSeriesData    lastInferData;
  public int               trainCount;

  @Override
  public ModelCapabilities getCapabilities()
  {
    return capabilities;
  }

  @Override
  public List<String> getAllowedHyperparameters()
  {
    return Arrays.asList("alpha");
  }

  @Override
  public ModelInputs preprocess(TimeSeriesData data, TimeSeriesData knownCovariates, boolean isTrain)
  {
    if (isTrain && clock != null) {
      clock.advance(preprocessSeconds);
    }
    return new ModelInputs(data, knownCovariates);
  }

  @Override
  public void train(TrainRequest request)
  {
    lastRequest = request;
    ++trainCount;
  }

  @Override
  public TimeSeriesData infer(ModelContext context, TimeSeriesData data, TimeSeriesData knownCovariates,
      Map<String, Object> options)
  {
    lastInferData = data;
    if (clock != null) {
      clock.advance(inferSeconds);
    }
    List<String> columns = outputColumns != null ? outputColumns : ForecastLib.predictionColumns(context.quantileLevels);
    int iTarget = data.requireColumn(context.target);
    TimeSeriesData future = ForecastLib.makeFutureData(data, context.predictionLength, context.getFrequency());
    TimeSeriesData predictions = new TimeSeriesData(new ArrayList<>(columns));
    for (Sequence seq : data) {
      double last = seq.getLast().get(iTarget);
      Sequence horizon = future.getItem(seq.getName());
      Sequence out = new Sequence(seq.getName());
      for (int h = 0; h < context.predictionLength; ++h) {
        double[] row = new double[columns.size()];
        for (int i = 0; i < row.length; ++i) {
          String column = columns.get(i);
          row[i] = last + (column.equals(ForecastLib.MEAN_COLUMN) ? -1.0 : 100.0 * Double.parseDouble(column));
        }
        out.addData(new FeatureVec(row), horizon.getTimeMS(h));
      }
      predictions.addItem(out);
    }
    return predictions;
  }

  @Override
  public ForecastingStrategy newInstance()
  {
    StubStrategy stub = new StubStrategy();
    stub.capabilities = capabilities;
    stub.outputColumns = outputColumns;
    return stub;
  }

  @Override
  public JSONObject saveState()
  {
    JSONObject state = new JSONObject();
    state.put("train_count", trainCount);
    return state;
  }

  @Override
  public void loadState(JSONObject state)
  {
    trainCount = state.getInt("train_count");
  }
}
