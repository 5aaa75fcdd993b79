package org.minnen.forecast.model;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

import org.minnen.forecast.local.AverageStrategy;
import org.minnen.forecast.local.NaiveStrategy;
import org.minnen.forecast.local.SeasonalNaiveStrategy;

/** Maps strategy type names to factories so that saved models can be restored. */
public class StrategyRegistry
{
  private static final Map<String, Supplier<ForecastingStrategy>> factories = new TreeMap<>();

  static {
    register(new NaiveStrategy().getType(), NaiveStrategy::new);
    register(new SeasonalNaiveStrategy().getType(), SeasonalNaiveStrategy::new);
    register(new AverageStrategy().getType(), AverageStrategy::new);
  }

  public static synchronized void register(String type, Supplier<ForecastingStrategy> factory)
  {
    factories.put(type, factory);
  }

  public static synchronized boolean isRegistered(String type)
  {
    return factories.containsKey(type);
  }

  public static synchronized Set<String> getTypes()
  {
    return new TreeMap<>(factories).keySet();
  }

  /**
   * @return new strategy of the given type
   * @throws IllegalArgumentException if the type is not registered
   */
  public static synchronized ForecastingStrategy create(String type)
  {
    Supplier<ForecastingStrategy> factory = factories.get(type);
    if (factory == null) {
      throw new IllegalArgumentException(String.format("Unknown strategy type: [%s] (known: %s)", type,
          factories.keySet()));
    }
    return factory.get();
  }
}
