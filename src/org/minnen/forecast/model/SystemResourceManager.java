package org.minnen.forecast.model;

/** Reports the processors available to this JVM and no GPUs. */
public class SystemResourceManager implements ResourceManager
{
  public static final SystemResourceManager INSTANCE = new SystemResourceManager();

  @Override
  public Resources getResources()
  {
    return new Resources(Runtime.getRuntime().availableProcessors(), 0);
  }
}
