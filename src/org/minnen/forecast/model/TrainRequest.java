package org.minnen.forecast.model;

import java.util.Collections;
import java.util.Map;

import org.minnen.forecast.data.TimeSeriesData;

/** Everything a strategy receives for training. Data has already been scaled and preprocessed. */
public class TrainRequest
{
  public final ModelContext        context;
  public final TimeSeriesData      train;

  /** Validation data; null unless the strategy can use it and it was supplied. */
  public final TimeSeriesData      val;

  /** Seconds available for training (already adjusted) or null for no limit. */
  public final Double              timeLimit;
  public final Resources           resources;
  public final int                 verbosity;

  /** Caller arguments other than num_cpus / num_gpus. */
  public final Map<String, Object> extraArgs;

  public TrainRequest(ModelContext context, TimeSeriesData train, TimeSeriesData val, Double timeLimit,
      Resources resources, int verbosity, Map<String, Object> extraArgs)
  {
    this.context = context;
    this.train = train;
    this.val = val;
    this.timeLimit = timeLimit;
    this.resources = resources;
    this.verbosity = verbosity;
    this.extraArgs = Collections.unmodifiableMap(extraArgs);
  }
}
