package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.minnen.forecast.local.NaiveStrategy;
import org.minnen.forecast.model.ForecastModel;
import org.minnen.forecast.model.ModelCapabilities;

public class TestModelCapabilities
{
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testDefaults()
  {
    ModelCapabilities caps = ModelCapabilities.DEFAULT;
    assertFalse(caps.supportsKnownCovariates());
    assertFalse(caps.supportsPastCovariates());
    assertFalse(caps.supportsStaticFeatures());
    assertTrue(caps.canUseTrainData());
    assertFalse(caps.canUseValData());
    assertFalse(caps.canRefitFull());
    assertFalse(caps.allowNan());
  }

  @Test
  public void testWithersCopy()
  {
    ModelCapabilities caps = ModelCapabilities.DEFAULT.withPastCovariates(true).withTrainData(false)
        .withRefitFull(true);
    assertTrue(caps.supportsPastCovariates());
    assertFalse(caps.canUseTrainData());
    assertTrue(caps.canRefitFull());
    assertNotEquals(ModelCapabilities.DEFAULT, caps);

    // DEFAULT is never modified.
    assertFalse(ModelCapabilities.DEFAULT.canRefitFull());

    Map<String, Object> map = caps.toMap();
    assertEquals(Boolean.TRUE, map.get("supports_past_covariates"));
    assertEquals(Boolean.FALSE, map.get("can_use_train_data"));
    assertEquals(caps, ModelCapabilities.DEFAULT.withRefitFull(true).withPastCovariates(true).withTrainData(false));
  }

  @Test
  public void testLocalStrategyAllowsNan()
  {
    ForecastModel plain = new ForecastModel(new NaiveStrategy(), AllTests.dailyParams(tmp.getRoot()));
    assertTrue(plain.getCapabilities().allowNan());
    assertFalse(plain.getCapabilities().supportsKnownCovariates());
  }
}
