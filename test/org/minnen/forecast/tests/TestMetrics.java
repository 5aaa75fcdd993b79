package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import org.junit.Test;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.metrics.ForecastMetric;
import org.minnen.forecast.metrics.MAE;
import org.minnen.forecast.metrics.Metrics;
import org.minnen.forecast.metrics.WQL;
import org.minnen.forecast.util.TimeLib;

public class TestMetrics
{
  private static long day(int t)
  {
    return AllTests.START_MS + t * TimeLib.MS_IN_DAY;
  }

  private static TimeSeriesData truth(double... lastTwo)
  {
    TimeSeriesData data = new TimeSeriesData("target");
    data.add("a", day(0), 100.0);
    data.add("a", day(1), lastTwo[0]);
    data.add("a", day(2), lastTwo[1]);
    return data;
  }

  private static TimeSeriesData predictions()
  {
    TimeSeriesData preds = new TimeSeriesData("mean", "0.1", "0.9");
    preds.add("a", day(1), 11.0, 8.0, 12.0);
    preds.add("a", day(2), 19.0, 18.0, 22.0);
    return preds;
  }

  @Test
  public void testWQL()
  {
    ForecastMetric wql = Metrics.get("WQL");
    // Each quantile loses 0.2 per step; 2 * 0.4 / 30 for both levels.
    assertEquals(-0.8 / 30.0, wql.score(truth(10, 20), predictions(), "target"), 1e-12);
    assertFalse(wql.isOptimizedByMedian());
  }

  @Test
  public void testPointMetrics()
  {
    assertEquals(-1.0, Metrics.get("MAE").score(truth(10, 20), predictions(), "target"), 1e-12);
    assertEquals(-1.0, Metrics.get("RMSE").score(truth(10, 20), predictions(), "target"), 1e-12);
    assertEquals(-2.0 / 30.0, Metrics.get("WAPE").score(truth(10, 20), predictions(), "target"), 1e-12);
    assertTrue(Metrics.get("MAE").isOptimizedByMedian());
    assertTrue(Metrics.get("WAPE").isOptimizedByMedian());
    assertFalse(Metrics.get("RMSE").isOptimizedByMedian());
  }

  @Test
  public void testMissingTruthIgnored()
  {
    assertEquals(-1.0, Metrics.get("MAE").score(truth(Double.NaN, 20), predictions(), "target"), 1e-12);
  }

  @Test
  public void testLookup()
  {
    assertTrue(Metrics.get(null) instanceof WQL);
    assertTrue(Metrics.get("mae") instanceof MAE);
    ForecastMetric metric = new MAE();
    assertSame(metric, Metrics.get(metric));
    try {
      Metrics.get("MASE2");
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("MASE2"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingGroundTruth()
  {
    TimeSeriesData preds = predictions();
    preds.add("b", day(1), 1.0, 1.0, 1.0);
    Metrics.get("MAE").score(truth(10, 20), preds, "target");
  }
}
