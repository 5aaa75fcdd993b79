package org.minnen.forecast.local;

import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.ArrayUtils;
import org.json.JSONObject;
import org.minnen.forecast.data.FeatureVec;
import org.minnen.forecast.data.Sequence;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.model.ForecastingStrategy;
import org.minnen.forecast.model.Hyperparameters;
import org.minnen.forecast.model.ModelCapabilities;
import org.minnen.forecast.model.ModelContext;
import org.minnen.forecast.model.TrainRequest;
import org.minnen.forecast.util.ForecastLib;

/**
 * Abstract parent class for strategies that forecast each item independently from its own history.
 *
 * Local strategies learn nothing global during training; every forecast is computed from the context passed to
 * {@link #infer}.
 */
public abstract class LocalStrategy implements ForecastingStrategy
{
  /** Only the last `max_ts_length` observations of each item are used (all if missing). */
  public static final String MAX_TS_LENGTH  = "max_ts_length";

  /** Number of items seen in training. */
  protected int              numTrainItems = 0;

  @Override
  public ModelCapabilities getCapabilities()
  {
    return ModelCapabilities.DEFAULT.withAllowNan(true);
  }

  @Override
  public void train(TrainRequest request)
  {
    request.train.requireColumn(request.context.target);
    numTrainItems = request.train.getNumItems();
  }

  /**
   * Forecast one item.
   *
   * @param y observed target values (oldest first, may contain NaN)
   * @param horizon number of steps to forecast
   * @param quantileLevels quantile levels to produce
   * @param context model configuration
   * @return one row per step: mean followed by one value per quantile level
   */
  protected abstract double[][] forecast(double[] y, int horizon, List<Double> quantileLevels, ModelContext context);

  @Override
  public TimeSeriesData infer(ModelContext context, TimeSeriesData data, TimeSeriesData knownCovariates,
      Map<String, Object> options)
  {
    int iTarget = data.requireColumn(context.target);
    int maxLength = Hyperparameters.getInt(context.hyperparameters, MAX_TS_LENGTH, Integer.MAX_VALUE);
    TimeSeriesData future = ForecastLib.makeFutureData(data, context.predictionLength, context.getFrequency());

    TimeSeriesData predictions = new TimeSeriesData(ForecastLib.predictionColumns(context.quantileLevels));
    for (Sequence seq : data) {
      double[] y = seq.extractDim(iTarget);
      if (y.length > maxLength) {
        y = ArrayUtils.subarray(y, y.length - maxLength, y.length);
      }
      double[][] rows = forecast(y, context.predictionLength, context.quantileLevels, context);
      Sequence horizon = future.getItem(seq.getName());
      Sequence out = new Sequence(seq.getName());
      for (int h = 0; h < rows.length; ++h) {
        out.addData(new FeatureVec(rows[h]), horizon.getTimeMS(h));
      }
      predictions.addItem(out);
    }
    return predictions;
  }

  @Override
  public JSONObject saveState()
  {
    JSONObject state = new JSONObject();
    state.put("num_train_items", numTrainItems);
    return state;
  }

  @Override
  public void loadState(JSONObject state)
  {
    numTrainItems = state.optInt("num_train_items", 0);
  }

  public int getNumTrainItems()
  {
    return numTrainItems;
  }

  /** @return last finite value of `y` or NaN if there is none */
  protected static double lastFinite(double[] y)
  {
    for (int i = y.length - 1; i >= 0; --i) {
      if (Double.isFinite(y[i])) return y[i];
    }
    return Double.NaN;
  }
}
