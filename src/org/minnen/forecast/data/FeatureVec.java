package org.minnen.forecast.data;

import java.util.Arrays;

import org.minnen.forecast.util.TimeLib;

/** A single time-stamped row of values; dimension d holds the value of the d^th column of the owning table. */
public class FeatureVec
{
  /** actual data */
  private double[] vec;
  private long     timestamp = TimeLib.TIME_ERROR;

  /**
   * Create a feature vec from the double array
   *
   * @param vec data for feature vec (copied)
   */
  public FeatureVec(double vec[])
  {
    this.vec = vec.clone();
  }

  /**
   * Duplicate the given feature vec
   *
   * @param fv feature vec to duplicate
   */
  public FeatureVec(FeatureVec fv)
  {
    this.vec = fv.vec.clone();
    this.timestamp = fv.timestamp;
  }

  /**
   * Create a feature vector with 'nDims' using the supplied values (or zeros if no values are provided).
   */
  public FeatureVec(int nDims, double... x)
  {
    assert x.length == nDims || x.length == 0;
    if (x.length == 0) {
      vec = new double[nDims];
    } else {
      vec = Arrays.copyOf(x, nDims);
    }
  }

  /** set the time stamp of this point (ms) */
  public FeatureVec setTime(long ms)
  {
    timestamp = ms;
    return this;
  }

  /** @return time stamp for this point (ms) */
  public long getTime()
  {
    return timestamp;
  }

  /** @return dimensionality of this feature vector */
  public int getNumDims()
  {
    return vec.length;
  }

  /** @return vector data as a double array (actual reference, not a copy!) */
  public double[] get()
  {
    return vec;
  }

  /** @return value of d^{th} dimension */
  public double get(int d)
  {
    return vec[d];
  }

  /** set the value of the d^{th} dimension to v */
  public void set(int d, double v)
  {
    vec[d] = v;
  }

  public FeatureVec dup()
  {
    return new FeatureVec(this);
  }

  /**
   * Build a new vector from the given dimensions of this one. A negative index yields NaN in that position, which lets
   * callers reorder columns and introduce missing ones in a single pass.
   *
   * @param dims dimensions to select (in order)
   * @return new vector with the same timestamp
   */
  public FeatureVec selectDims(int... dims)
  {
    int nd = dims.length;
    FeatureVec ret = new FeatureVec(nd);
    ret.setTime(getTime());
    for (int i = 0; i < nd; i++)
      ret.set(i, dims[i] < 0 ? Double.NaN : get(dims[i]));
    return ret;
  }

  /** @return dot product of this vector and the given vector */
  public double dot(FeatureVec fv)
  {
    int n = getNumDims();
    assert n == fv.getNumDims();
    double ret = 0.0;
    for (int i = 0; i < n; i++)
      ret += vec[i] * fv.vec[i];
    return ret;
  }

  /** Add x to every dimension (in place). */
  public FeatureVec _add(double x)
  {
    for (int i = 0; i < vec.length; i++)
      vec[i] += x;
    return this;
  }

  /** Multiply every dimension by x (in place). */
  public FeatureVec _mul(double x)
  {
    for (int i = 0; i < vec.length; i++)
      vec[i] *= x;
    return this;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof FeatureVec)) return false;
    FeatureVec fv = (FeatureVec) o;
    return timestamp == fv.timestamp && Arrays.equals(vec, fv.vec);
  }

  @Override
  public int hashCode()
  {
    return 31 * Long.hashCode(timestamp) + Arrays.hashCode(vec);
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    sb.append(TimeLib.formatTime(timestamp)).append(" [");
    for (int i = 0; i < vec.length; i++) {
      if (i > 0) sb.append(",");
      sb.append(String.format("%.3f", vec[i]));
    }
    sb.append("]");
    return sb.toString();
  }
}
