package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import java.io.IOException;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.model.ForecastModel;

public class TestScoring
{
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  /** @return MAE of a forecast that repeats (last context value + 50) for the last 7 steps */
  private static double expectedMAE(TimeSeriesData data)
  {
    double sum = 0.0;
    int n = 0;
    for (String itemId : data.getItemIds()) {
      double[] y = data.extractColumn(itemId, "target");
      double forecast = y[y.length - 8] + 50.0;
      for (int t = y.length - 7; t < y.length; ++t) {
        sum += Math.abs(y[t] - forecast);
        ++n;
      }
    }
    return sum / n;
  }

  @Test
  public void testScoreHoldsOutLastWindow()
  {
    TimeSeriesData data = AllTests.buildDailyData(2, 30);
    ForecastModel model = new ForecastModel(new StubStrategy(),
        AllTests.dailyParams(tmp.getRoot()).setEvalMetric("mae").setQuantileLevels(0.5));
    model.fit(data);
    assertEquals(-expectedMAE(data), model.score(data), 1e-9);
  }

  @Test
  public void testScoreAndCacheOof() throws IOException
  {
    TimeSeriesData data = AllTests.buildDailyData(2, 30);
    StubStrategy stub = new StubStrategy();
    FakeTimeSource clock = new FakeTimeSource();
    stub.clock = clock;
    stub.inferSeconds = 4.0;
    ForecastModel model = new ForecastModel(stub,
        AllTests.dailyParams(tmp.getRoot()).setEvalMetric("MAE").setQuantileLevels(0.5));
    model.setTimeSource(clock);
    model.fit(data);

    model.scoreAndCacheOof(data, true, true, null);
    assertEquals(-expectedMAE(data), model.getValScore(), 1e-9);
    assertEquals(4.0, model.getPredictTime(), 1e-6);
    assertEquals(2.0, model.getPredict1Time(), 1e-6);

    List<TimeSeriesData> oof = model.getOofPredictions();
    assertEquals(1, oof.size());
    assertEquals(2, oof.get(0).getNumItems());
    assertEquals(7, oof.get(0).getItem("item0").length());
  }

  @Test
  public void testScoreWithoutStoringStats()
  {
    TimeSeriesData data = AllTests.buildDailyData(2, 30);
    ForecastModel model = new ForecastModel(new StubStrategy(), AllTests.dailyParams(tmp.getRoot()));
    model.fit(data);
    model.scoreAndCacheOof(data, false, false, null);
    assertNull(model.getValScore());
    assertNull(model.getPredictTime());
    assertNull(model.getPredict1Time());

    model.setValScore(-1.5);
    assertEquals(-1.5, model.getValScore(), 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testItemTooShort()
  {
    TimeSeriesData data = AllTests.buildDailyData(2, 30);
    ForecastModel model = new ForecastModel(new StubStrategy(), AllTests.dailyParams(tmp.getRoot()));
    model.fit(data);
    model.score(AllTests.buildDailyData(1, 7));
  }
}
