package org.minnen.forecast.local;

import java.util.Collections;
import java.util.List;

import org.minnen.forecast.model.ForecastingStrategy;
import org.minnen.forecast.model.ModelContext;

/** Repeats the last observed value; a seasonal naive forecast with a period of one. */
public class NaiveStrategy extends SeasonalNaiveStrategy
{
  @Override
  public List<String> getAllowedHyperparameters()
  {
    return Collections.singletonList(MAX_TS_LENGTH);
  }

  @Override
  protected int getSeasonalPeriod(ModelContext context)
  {
    return 1;
  }

  @Override
  public ForecastingStrategy newInstance()
  {
    return new NaiveStrategy();
  }
}
