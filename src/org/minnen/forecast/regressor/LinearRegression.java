package org.minnen.forecast.regressor;

import org.json.JSONObject;
import org.minnen.forecast.data.DataIO;
import org.minnen.forecast.data.FeatureVec;

import smile.regression.RidgeRegression;

/** Linear model y = intercept + weights . x */
public class LinearRegression
{
  public final double     intercept;
  public final FeatureVec weights;

  public LinearRegression(FeatureVec weights, double intercept)
  {
    this.weights = weights;
    this.intercept = intercept;
  }

  public int getNumDims()
  {
    return weights.getNumDims();
  }

  public double predict(double[] x)
  {
    return predict(new FeatureVec(x));
  }

  public double predict(FeatureVec x)
  {
    return intercept + weights.dot(x);
  }

  /**
   * Learn model parameters using ridge regression.
   *
   * @param x one row per example; no column may be constant
   * @param y target value per example
   * @param lambda shrinkage parameter
   * @return learned model
   */
  public static LinearRegression learnRidge(double[][] x, double[] y, double lambda)
  {
    RidgeRegression model = new RidgeRegression(x, y, lambda);

    // Transfer learned parameters to internal representation.
    FeatureVec weights = new FeatureVec(model.coefficients());
    return new LinearRegression(weights, model.intercept());
  }

  public JSONObject toJson()
  {
    JSONObject obj = new JSONObject();
    obj.put("intercept", DataIO.encodeDouble(intercept));
    obj.put("weights", DataIO.encodeArray(weights.get()));
    return obj;
  }

  public static LinearRegression fromJson(JSONObject obj)
  {
    double intercept = obj.isNull("intercept") ? Double.NaN : obj.getDouble("intercept");
    return new LinearRegression(new FeatureVec(DataIO.decodeArray(obj.getJSONArray("weights"))), intercept);
  }

  @Override
  public String toString()
  {
    return String.format("[LinearRegression: %.4f + %s]", intercept, weights);
  }
}
