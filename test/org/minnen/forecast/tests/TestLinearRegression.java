package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import org.junit.Test;
import org.minnen.forecast.regressor.LinearRegression;

public class TestLinearRegression
{
  private static double[][] x;
  private static double[]   y;

  static {
    final int n = 50;
    x = new double[n][2];
    y = new double[n];
    for (int i = 0; i < n; ++i) {
      x[i][0] = i % 7;
      x[i][1] = (i * 3) % 11 - 5;
      y[i] = 1.0 + 2.0 * x[i][0] - 3.0 * x[i][1];
    }
  }

  @Test
  public void testRecoversLinearModel()
  {
    LinearRegression model = LinearRegression.learnRidge(x, y, 1e-8);
    assertEquals(2, model.getNumDims());
    assertEquals(1.0, model.intercept, 1e-4);
    assertEquals(2.0, model.weights.get(0), 1e-4);
    assertEquals(-3.0, model.weights.get(1), 1e-4);
    assertEquals(1.0 + 2.0 * 4 - 3.0 * 2, model.predict(new double[] { 4, 2 }), 1e-3);
  }

  @Test
  public void testShrinkage()
  {
    LinearRegression weak = LinearRegression.learnRidge(x, y, 1e-8);
    LinearRegression strong = LinearRegression.learnRidge(x, y, 1000.0);
    assertTrue(Math.abs(strong.weights.get(1)) < Math.abs(weak.weights.get(1)));
  }

  @Test
  public void testJson()
  {
    LinearRegression model = LinearRegression.learnRidge(x, y, 0.1);
    LinearRegression copy = LinearRegression.fromJson(model.toJson());
    assertEquals(model.intercept, copy.intercept, 1e-12);
    assertArrayEquals(model.weights.get(), copy.weights.get(), 1e-12);
  }
}
