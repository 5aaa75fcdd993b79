package org.minnen.forecast.tests;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.minnen.forecast.model.ForecastModel;
import org.minnen.forecast.model.Hyperparameters;
import org.minnen.forecast.model.diag.Diagnostic;
import org.minnen.forecast.optimize.CategoricalSpace;
import org.minnen.forecast.optimize.IntSpace;
import org.minnen.forecast.optimize.RealSpace;

public class TestHyperparameters
{
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testAuxArgsSplit()
  {
    Map<String, Object> aux = new HashMap<>();
    aux.put(Hyperparameters.MAX_TIME_LIMIT, 30);
    Map<String, Object> hp = new HashMap<>();
    hp.put("alpha", 0.5);
    hp.put(Hyperparameters.AUX_ARGS_KEY, aux);

    ForecastModel model = new ForecastModel(new StubStrategy(), AllTests.dailyParams(tmp.getRoot()).setHyperparameters(hp));
    assertEquals(0.5, model.getHyperparameters().get("alpha"));
    assertFalse(model.getHyperparameters().containsKey(Hyperparameters.AUX_ARGS_KEY));
    assertEquals(30, model.getAuxArgs().get(Hyperparameters.MAX_TIME_LIMIT));

    // Parameters fold the auxiliary arguments back in.
    @SuppressWarnings("unchecked")
    Map<String, Object> folded = (Map<String, Object>) model.getParams().getHyperparameters()
        .get(Hyperparameters.AUX_ARGS_KEY);
    assertEquals(30, folded.get(Hyperparameters.MAX_TIME_LIMIT));
  }

  @Test
  public void testUserMapCopied()
  {
    Map<String, Object> hp = new HashMap<>();
    hp.put("alpha", 0.5);
    ForecastModel model = new ForecastModel(new StubStrategy(), AllTests.dailyParams(tmp.getRoot()).setHyperparameters(hp));
    hp.put("alpha", 0.9);
    assertEquals(0.5, model.getHyperparameters().get("alpha"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAuxArgsMustBeMap()
  {
    Map<String, Object> hp = new HashMap<>();
    hp.put(Hyperparameters.AUX_ARGS_KEY, "oops");
    new ForecastModel(new StubStrategy(), AllTests.dailyParams(tmp.getRoot()).setHyperparameters(hp));
  }

  @Test
  public void testNonStringKey()
  {
    Map<Object, Object> raw = new LinkedHashMap<>();
    raw.put(7, "seven");
    raw.put("alpha", 1.0);
    CollectingDiagnosticListener diags = new CollectingDiagnosticListener();
    Hyperparameters.Split split = Hyperparameters.split(raw, diags, "test");

    assertEquals("seven", split.hyperparameters.get("7"));
    assertEquals(1.0, split.hyperparameters.get("alpha"));
    List<Diagnostic> events = diags.get(Diagnostic.Kind.NON_STRING_HYPERPARAMETER_KEY);
    assertEquals(1, events.size());
    assertEquals("Integer", events.get(0).details.get("type"));
  }

  @Test
  public void testUnusedHyperparameters()
  {
    Map<String, Object> hp = new HashMap<>();
    hp.put("alpha", 0.5);
    hp.put("beta", 2);
    hp.put(Hyperparameters.TARGET_SCALER, "standard");
    CollectingDiagnosticListener diags = new CollectingDiagnosticListener();
    ForecastModel model = new ForecastModel(new StubStrategy(),
        AllTests.dailyParams(tmp.getRoot()).setHyperparameters(hp), diags);
    model.fit(AllTests.buildDailyData(1, 20));

    List<Diagnostic> events = diags.get(Diagnostic.Kind.UNUSED_HYPERPARAMETERS);
    assertEquals(1, events.size());
    assertEquals(Arrays.asList("beta"), events.get(0).details.get("unused"));
  }

  @Test
  public void testSearchSpaceRejectedByFit()
  {
    Map<String, Object> hp = new HashMap<>();
    hp.put("alpha", new RealSpace(0.1, 1.0));
    ForecastModel model = new ForecastModel(new StubStrategy(), AllTests.dailyParams(tmp.getRoot()).setHyperparameters(hp));
    assertTrue(model.getSearchSpace().get("alpha") instanceof RealSpace);
    try {
      model.fit(AllTests.buildDailyData(1, 20));
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("spaces"));
    }
    assertFalse(model.isFit());
  }

  @Test
  public void testSpaceDefaults()
  {
    assertEquals(3, (int) new IntSpace(1, 10, 3).getDefault());
    RealSpace space = new RealSpace(1e-3, 1.0, 1e-2, true);
    assertEquals(1e-2, space.getDefault(), 1e-12);
    CategoricalSpace choice = new CategoricalSpace("mean", "median");
    assertEquals("mean", choice.getDefault());
    assertEquals(Arrays.asList("mean", "median"), choice.getChoices());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSpaceCantBeSaved()
  {
    Map<String, Object> hp = new HashMap<>();
    hp.put("alpha", new RealSpace(0.1, 1.0));
    Hyperparameters.toJson(hp);
  }

  @Test
  public void testJsonValuesNormalized()
  {
    JSONObject obj = new JSONObject("{\"a\": 1.5, \"b\": {\"c\": 2}, \"d\": [1, null], \"e\": null}");
    Map<String, Object> hp = Hyperparameters.fromJson(obj);
    assertEquals(1.5, Hyperparameters.getDouble(hp, "a", 0.0), 1e-12);
    assertTrue(hp.get("b") instanceof Map);
    assertEquals(Arrays.asList(1, null), hp.get("d"));
    assertTrue(hp.containsKey("e"));
    assertNull(hp.get("e"));
  }

  @Test
  public void testTypedGetters()
  {
    Map<String, Object> hp = new HashMap<>();
    hp.put("n", 4);
    hp.put("x", 2.5);
    hp.put("flag", true);
    assertEquals(4, Hyperparameters.getInt(hp, "n", 0));
    assertEquals(9, Hyperparameters.getInt(hp, "missing", 9));
    assertEquals(4.0, Hyperparameters.getDouble(hp, "n", 0.0), 1e-12);
    assertNull(Hyperparameters.getDouble(hp, "missing"));
    assertTrue(Hyperparameters.getBoolean(hp, "flag", false));
    try {
      Hyperparameters.getInt(hp, "x", 0);
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("x"));
    }
  }
}
