package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.minnen.forecast.data.DataIO;
import org.minnen.forecast.data.TimeSeriesData;
import org.minnen.forecast.model.ForecastModel;
import org.minnen.forecast.model.Hyperparameters;
import org.minnen.forecast.model.ModelDefaults;
import org.minnen.forecast.model.ModelParams;
import org.minnen.forecast.model.diag.Diagnostic;

public class TestPersistence
{
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private ForecastModel buildFitModel(TimeSeriesData data)
  {
    Map<String, Object> aux = new HashMap<>();
    aux.put(Hyperparameters.MAX_TIME_LIMIT, 60);
    Map<String, Object> hp = new HashMap<>();
    hp.put(Hyperparameters.TARGET_SCALER, "robust");
    hp.put("alpha", 0.3);
    hp.put(Hyperparameters.AUX_ARGS_KEY, aux);
    ForecastModel model = new ForecastModel(new StubStrategy(),
        AllTests.dailyParams(tmp.getRoot()).setName("stubby").setQuantileLevels(0.1, 0.9).setHyperparameters(hp));
    model.fit(data);
    return model;
  }

  @Test
  public void testSaveLoadPredictsTheSame() throws IOException
  {
    TimeSeriesData data = AllTests.buildDailyData(3, 30);
    ForecastModel model = buildFitModel(data);
    File dir = model.save();
    assertEquals(new File(tmp.getRoot(), "stubby"), dir);
    assertTrue(new File(dir, ForecastModel.MODEL_FILE).exists());

    ForecastModel loaded = ForecastModel.load(dir);
    assertEquals("stubby", loaded.getName());
    assertTrue(loaded.isFit());
    assertTrue(loaded.mustDropMedian());
    assertEquals(model.getQuantileLevels(), loaded.getQuantileLevels());
    assertEquals(model.getHyperparameters(), loaded.getHyperparameters());
    assertEquals(60, Hyperparameters.getInt(loaded.getAuxArgs(), Hyperparameters.MAX_TIME_LIMIT, 0));
    assertEquals(1, ((StubStrategy) loaded.getStrategy()).trainCount);

    TimeSeriesData expected = model.predict(data);
    TimeSeriesData actual = loaded.predict(data);
    assertEquals(expected.getColumns(), actual.getColumns());
    for (String column : expected.getColumns()) {
      assertArrayEquals(expected.extractColumn(column), actual.extractColumn(column), 1e-9);
    }
  }

  @Test
  public void testOofStoredSeparately() throws IOException
  {
    TimeSeriesData data = AllTests.buildDailyData(3, 30);
    ForecastModel model = buildFitModel(data);
    model.scoreAndCacheOof(data, true, true, null);
    List<TimeSeriesData> oof = model.getOofPredictions();
    File dir = model.save();

    JSONObject artifact = DataIO.readJson(new File(dir, ForecastModel.MODEL_FILE));
    assertFalse(artifact.toString().contains("oof"));
    assertTrue(new File(new File(dir, ForecastModel.UTILS_DIR), ForecastModel.OOF_FILE).exists());

    // The model still holds its predictions after saving.
    assertSame(oof, model.getOofPredictions());

    ForecastModel eager = ForecastModel.load(dir, true, true);
    assertEquals(oof, eager.getOofPredictions());

    ForecastModel lazy = ForecastModel.load(dir, true, false);
    assertEquals(oof, lazy.getOofPredictions());
    assertEquals(model.getValScore(), lazy.getValScore(), 1e-12);
    assertEquals(oof, ForecastModel.loadOofPredictions(dir));
  }

  @Test
  public void testResetPaths() throws IOException
  {
    TimeSeriesData data = AllTests.buildDailyData(1, 20);
    ForecastModel model = buildFitModel(data);
    File saved = model.save();
    File moved = new File(tmp.newFolder("moved"), "stubby");
    FileUtils.copyDirectory(saved, moved);

    ForecastModel loaded = ForecastModel.load(moved);
    assertEquals(moved, loaded.getPath());
    assertEquals(moved.getAbsoluteFile().getParentFile(), loaded.getPathRoot());

    ForecastModel kept = ForecastModel.load(moved, false, false);
    assertEquals(saved, kept.getPath());
  }

  @Test
  public void testUnsupportedSchema() throws IOException
  {
    ForecastModel model = buildFitModel(AllTests.buildDailyData(1, 20));
    File dir = model.save();
    File file = new File(dir, ForecastModel.MODEL_FILE);
    JSONObject artifact = DataIO.readJson(file);
    artifact.put("schema_version", 99);
    DataIO.writeJson(artifact, file);
    try {
      ForecastModel.load(dir);
      fail("expected IOException");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("99"));
    }
  }

  @Test(expected = IOException.class)
  public void testMissingArtifact() throws IOException
  {
    ForecastModel.load(tmp.newFolder("empty"));
  }

  @Test
  public void testInfo() throws IOException
  {
    ForecastModel model = buildFitModel(AllTests.buildDailyData(2, 20));
    model.save();
    Map<String, Object> info = model.saveInfo();
    assertEquals("stubby", info.get("name"));
    assertEquals("Stub", info.get("model_type"));

    Map<String, Object> cached = ForecastModel.loadInfo(model.getPath(), false);
    assertEquals("stubby", cached.get("name"));
    assertEquals(7, cached.get("prediction_length"));
  }

  @Test
  public void testInfoFallback() throws IOException
  {
    ForecastModel model = buildFitModel(AllTests.buildDailyData(2, 20));
    File dir = model.save();
    assertFalse(new File(dir, ForecastModel.INFO_FILE).exists());
    try {
      ForecastModel.loadInfo(dir, false);
      fail("expected IOException");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains(ForecastModel.INFO_FILE));
    }
    Map<String, Object> info = ForecastModel.loadInfo(dir, true);
    assertEquals("stubby", info.get("name"));
  }

  @Test
  public void testDefaultPath() throws IOException
  {
    File root = tmp.newFolder("defaults");
    ModelDefaults.setPath(root);
    try {
      CollectingDiagnosticListener diags = new CollectingDiagnosticListener();
      ForecastModel model = new ForecastModel(new StubStrategy(), new ModelParams(), diags);
      assertSame(diags, model.getDiagnosticListener());
      assertTrue(diags.has(Diagnostic.Kind.DEFAULT_PATH));
      assertEquals("Stub", model.getName());
      assertEquals(root.getAbsoluteFile(), model.getPathRoot().getAbsoluteFile().getParentFile());
      assertTrue(model.getPath().isDirectory());
    } finally {
      ModelDefaults.reset();
    }
  }
}
