package org.minnen.forecast.model;

/** Source of the {num_cpus, num_gpus} allowance used when fitting. */
public interface ResourceManager
{
  public Resources getResources();
}
