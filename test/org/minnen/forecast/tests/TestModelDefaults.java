package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.junit.After;
import org.junit.Test;
import org.minnen.forecast.metrics.MAE;
import org.minnen.forecast.model.ForecastModel;
import org.minnen.forecast.model.ModelDefaults;
import org.minnen.forecast.model.ModelParams;

public class TestModelDefaults
{
  @After
  public void tearDown()
  {
    ModelDefaults.reset();
  }

  @Test
  public void testBuiltIn()
  {
    assertEquals("WQL", ModelDefaults.getEvalMetric());
    assertEquals(0.9, ModelDefaults.getMaxTimeLimitRatio(), 1e-12);
    assertEquals(0.5, ModelDefaults.getCovariateRegressorFitTimeFraction(), 1e-12);
    assertEquals(9, ModelDefaults.getQuantileLevels().size());
    assertEquals(new File("forecast-models"), ModelDefaults.getPath());
  }

  @Test
  public void testLoadResource() throws IOException
  {
    ModelDefaults.load(ModelDefaults.DEFAULT_RESOURCE);
    assertEquals("WQL", ModelDefaults.getEvalMetric());
    assertEquals(Arrays.asList(0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9), ModelDefaults.getQuantileLevels());

    ModelDefaults.load("forecast-test.properties");
    assertEquals("MAE", ModelDefaults.getEvalMetric());
    assertEquals(0.75, ModelDefaults.getMaxTimeLimitRatio(), 1e-12);
    assertEquals(Arrays.asList(0.25, 0.75), ModelDefaults.getQuantileLevels());
    // Keys missing from the file keep their value.
    assertEquals(0.5, ModelDefaults.getCovariateRegressorFitTimeFraction(), 1e-12);
  }

  @Test
  public void testDefaultsReachNewModels() throws IOException
  {
    ModelDefaults.load("forecast-test.properties");
    ForecastModel model = new ForecastModel(new StubStrategy(), new ModelParams().setPath(new File("unused")));
    assertTrue(model.getEvalMetric() instanceof MAE);
    assertEquals(Arrays.asList(0.25, 0.5, 0.75), model.getQuantileLevels());
    assertTrue(model.mustDropMedian());
  }

  @Test(expected = IOException.class)
  public void testMissingResource() throws IOException
  {
    ModelDefaults.load("no-such-file.properties");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidRatio()
  {
    ModelDefaults.setMaxTimeLimitRatio(0.0);
  }
}
