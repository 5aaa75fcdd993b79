package org.minnen.forecast.optimize;

/**
 * Marker for a hyperparameter that is a search space rather than a concrete value.
 *
 * Spaces must be resolved by a tuner before a model is fit.
 */
public abstract class Space<T>
{
  /** @return value used when the space is not searched */
  public abstract T getDefault();
}
