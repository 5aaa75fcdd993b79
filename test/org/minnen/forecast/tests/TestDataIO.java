package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.minnen.forecast.data.DataIO;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.util.TimeLib;

public class TestDataIO
{
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testLoadCSV() throws IOException
  {
    File file = tmp.newFile("data.csv");
    FileUtils.writeStringToFile(file,
        "item_id,timestamp,target,price\n" + "a,2024-01-01,1.5,10\n" + "a,2024-01-02,,11\n" + "b,2024-01-01 06:00:00,3,NaN\n",
        StandardCharsets.UTF_8);
    TimeSeriesData data = DataIO.loadCSV(file);
    assertEquals(Arrays.asList("target", "price"), data.getColumns());
    assertEquals(2, data.getNumItems());
    assertEquals(TimeLib.toMs(2024, 1, 2), data.getItem("a").getEndMS());
    assertTrue(Double.isNaN(data.getItem("a").get(1, 0)));
    assertTrue(Double.isNaN(data.getItem("b").get(0, 1)));
    assertEquals(TimeLib.toMs(2024, 1, 1) + 6 * TimeLib.MS_IN_HOUR, data.getItem("b").getStartMS());
  }

  @Test
  public void testSaveCSV() throws IOException
  {
    TimeSeriesData data = AllTests.buildCovariateData(2, 5);
    data.getItem("item1").set(2, 0, Double.NaN);
    File file = new File(tmp.getRoot(), "out/data.csv");
    DataIO.saveCSV(data, file);

    TimeSeriesData loaded = DataIO.loadCSV(file);
    assertNull(loaded.getStaticFeatures());
    data.setStaticFeatures(null);
    assertEquals(data, loaded);
  }

  @Test(expected = IOException.class)
  public void testBadHeader() throws IOException
  {
    File file = tmp.newFile("bad.csv");
    FileUtils.writeStringToFile(file, "id,time,target\na,2024-01-01,1\n", StandardCharsets.UTF_8);
    DataIO.loadCSV(file);
  }

  @Test
  public void testBadRow() throws IOException
  {
    File file = tmp.newFile("bad.csv");
    FileUtils.writeStringToFile(file, "item_id,timestamp,target\na,2024-01-01,1\na,yesterday,2\n",
        StandardCharsets.UTF_8);
    try {
      DataIO.loadCSV(file);
      fail("expected IOException");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("line 3"));
    }
  }

  @Test
  public void testSpecialValues()
  {
    double[] values = { 1.0, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, -2.5 };
    JSONArray array = new JSONArray(DataIO.encodeArray(values).toString());
    assertArrayEquals(values, DataIO.decodeArray(array), 0.0);
  }

  @Test
  public void testTableJson() throws IOException
  {
    TimeSeriesData data = AllTests.buildCovariateData(3, 6);
    data.getItem("item0").set(1, 1, Double.NaN);
    File file = new File(tmp.getRoot(), "table.json");
    DataIO.writeJson(DataIO.toJson(data), file);
    TimeSeriesData loaded = DataIO.fromJson(DataIO.readJson(file));
    assertEquals(data, loaded);
    assertEquals(data.getStaticFeatures(), loaded.getStaticFeatures());
  }

  @Test
  public void testPredictionList() throws IOException
  {
    File file = new File(tmp.getRoot(), "utils/preds.json");
    TimeSeriesData preds = new TimeSeriesData("mean", "0.5");
    preds.add("a", AllTests.START_MS, 1.25, 1.0);
    DataIO.savePredictionList(Arrays.asList(preds, preds.dup()), file);
    assertEquals(Arrays.asList(preds, preds), DataIO.loadPredictionList(file));
  }
}
