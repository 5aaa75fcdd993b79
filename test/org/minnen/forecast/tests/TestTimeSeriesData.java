package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;
import org.minnen.forecast.data.ModelInputs;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.util.ForecastLib;
import org.minnen.forecast.util.Frequency;

public class TestTimeSeriesData
{
  @Test
  public void testBasics()
  {
    TimeSeriesData data = AllTests.buildCovariateData(2, 10);
    assertEquals(Arrays.asList("target", "promo", "price"), data.getColumns());
    assertEquals(2, data.getNumItems());
    assertEquals(20, data.getNumRows());
    assertEquals(1, data.getColumnIndex("promo"));
    assertEquals(-1, data.getColumnIndex("missing"));
    assertTrue(data.hasItem("item1"));
    assertFalse(data.hasItem("item2"));
    assertEquals(Arrays.asList("item0", "item1"), Arrays.asList(data.getItemIds().toArray()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRequireColumn()
  {
    AllTests.buildDailyData(1, 3).requireColumn("sales");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongNumberOfValues()
  {
    new TimeSeriesData("a", "b").add("x", AllTests.START_MS, 1.0);
  }

  @Test
  public void testReindexAndCopy()
  {
    TimeSeriesData data = AllTests.buildCovariateData(1, 5);
    TimeSeriesData re = data.reindexColumns(Arrays.asList("price", "other"));
    assertEquals(Arrays.asList("price", "other"), re.getColumns());
    assertArrayEquals(data.extractColumn("price"), re.extractColumn("price"), 0.0);
    assertTrue(Double.isNaN(re.extractColumn("other")[0]));
    assertNotNull(re.getStaticFeatures());

    TimeSeriesData dropped = data.dropColumn("promo");
    assertEquals(Arrays.asList("target", "price"), dropped.getColumns());

    TimeSeriesData dup = data.dup();
    dup.copyColumn("price", "target");
    assertArrayEquals(dup.extractColumn("price"), dup.extractColumn("target"), 0.0);
    assertNotEquals(data, dup);
  }

  @Test
  public void testScoringSplit()
  {
    TimeSeriesData data = AllTests.buildCovariateData(2, 10);
    ModelInputs inputs = data.getModelInputsForScoring(3, Arrays.asList("promo", "price"));
    assertEquals(14, inputs.data.getNumRows());
    assertEquals(data.getColumns(), inputs.data.getColumns());
    assertEquals(Arrays.asList("promo", "price"), inputs.knownCovariates.getColumns());
    assertEquals(3, inputs.knownCovariates.getItem("item1").length());
    assertEquals(data.getItem("item1").getEndMS(), inputs.knownCovariates.getItem("item1").getEndMS());

    ModelInputs noKnown = data.getModelInputsForScoring(3, null);
    assertNull(noKnown.knownCovariates);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testScoringSplitTooShort()
  {
    AllTests.buildDailyData(1, 3).getModelInputsForScoring(3, null);
  }

  @Test
  public void testFutureData()
  {
    TimeSeriesData data = AllTests.buildDailyData(2, 10);
    TimeSeriesData future = ForecastLib.makeFutureData(data, 4, Frequency.parse("D"));
    assertEquals(0, future.getNumColumns());
    assertEquals(8, future.getNumRows());
    long last = data.getItem("item0").getEndMS();
    assertEquals(Frequency.parse("D").advance(last, 4), future.getItem("item0").getEndMS());

    // Without a frequency, the step is inferred from the data.
    assertEquals(future, ForecastLib.makeFutureData(data, 4, null));
  }
}
