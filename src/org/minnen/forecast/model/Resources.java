package org.minnen.forecast.model;

import java.util.Map;

/** CPU / GPU allowance handed to training. The values are hints, not enforced limits. */
public final class Resources
{
  public static final String NUM_CPUS = "num_cpus";
  public static final String NUM_GPUS = "num_gpus";

  public final int           numCpus;
  public final int           numGpus;

  public Resources(int numCpus, int numGpus)
  {
    if (numCpus < 0 || numGpus < 0) {
      throw new IllegalArgumentException(String.format("Invalid resources: cpus=%d gpus=%d", numCpus, numGpus));
    }
    this.numCpus = numCpus;
    this.numGpus = numGpus;
  }

  /**
   * Combine discovered resources with caller arguments. A caller value wins whenever it is present and not null.
   *
   * @param callerArgs extra fit arguments (may be null)
   * @return resources to use
   * @throws IllegalArgumentException if a caller value is not an integer
   */
  public Resources merge(Map<String, Object> callerArgs)
  {
    if (callerArgs == null) return this;
    return new Resources(pick(callerArgs, NUM_CPUS, numCpus), pick(callerArgs, NUM_GPUS, numGpus));
  }

  private static int pick(Map<String, Object> args, String key, int discovered)
  {
    Object value = args.get(key);
    if (value == null) return discovered;
    if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
      throw new IllegalArgumentException(String.format("%s must be an integer: %s", key, value));
    }
    return ((Number) value).intValue();
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof Resources)) return false;
    Resources r = (Resources) o;
    return numCpus == r.numCpus && numGpus == r.numGpus;
  }

  @Override
  public int hashCode()
  {
    return 31 * numCpus + numGpus;
  }

  @Override
  public String toString()
  {
    return String.format("[cpus=%d, gpus=%d]", numCpus, numGpus);
  }
}
