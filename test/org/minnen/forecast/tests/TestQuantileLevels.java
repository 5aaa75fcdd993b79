package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.model.ForecastModel;
import org.minnen.forecast.util.ForecastLib;

public class TestQuantileLevels
{
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testMedianAddedAndDropped()
  {
    ForecastModel model = new ForecastModel(new StubStrategy(),
        AllTests.dailyParams(tmp.getRoot()).setQuantileLevels(0.1, 0.9));
    assertEquals(Arrays.asList(0.1, 0.5, 0.9), model.getQuantileLevels());
    assertTrue(model.mustDropMedian());

    TimeSeriesData train = AllTests.buildDailyData(2, 30);
    model.fit(train);
    TimeSeriesData preds = model.predict(train);
    assertEquals(Arrays.asList("mean", "0.1", "0.9"), preds.getColumns());
  }

  @Test
  public void testSortedAndDeduplicated()
  {
    ForecastModel model = new ForecastModel(new StubStrategy(),
        AllTests.dailyParams(tmp.getRoot()).setQuantileLevels(0.9, 0.1, 0.9, 0.5));
    assertEquals(Arrays.asList(0.1, 0.5, 0.9), model.getQuantileLevels());
    assertFalse(model.mustDropMedian());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroRejected()
  {
    new ForecastModel(new StubStrategy(), AllTests.dailyParams(tmp.getRoot()).setQuantileLevels(0.0, 0.5));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOneRejected()
  {
    new ForecastModel(new StubStrategy(), AllTests.dailyParams(tmp.getRoot()).setQuantileLevels(0.5, 1.0));
  }

  @Test
  public void testColumnNames()
  {
    assertEquals("0.1", ForecastLib.quantileColumnName(0.1));
    assertEquals("0.25", ForecastLib.quantileColumnName(0.25));
    assertEquals("0.5", ForecastLib.quantileColumnName(0.5));
    assertEquals(Arrays.asList("mean", "0.1", "0.9"), ForecastLib.predictionColumns(Arrays.asList(0.1, 0.9)));
  }
}
