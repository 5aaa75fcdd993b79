package org.minnen.forecast.data;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.minnen.forecast.util.TimeLib;

/**
 * A Sequence holds the observations of a single item (entity) as a list of time-stamped feature vectors.
 *
 * The name of the sequence is the item id. Timestamps must be strictly increasing.
 */
public class Sequence implements Iterable<FeatureVec>
{
  /** Data stored in this sequence. */
  private final List<FeatureVec> data = new ArrayList<>();

  /** Item id of this sequence. */
  private final String           name;

  /**
   * Create an empty sequence for the given item.
   *
   * @param name item id
   */
  public Sequence(String name)
  {
    if (name == null) {
      throw new IllegalArgumentException("Sequence requires an item id");
    }
    this.name = name;
  }

  /** @return item id of this sequence */
  public String getName()
  {
    return name;
  }

  @Override
  public String toString()
  {
    return String.format("[Seq %s: len=%d, %dD  [%s]->[%s]]", name, length(), getNumDims(),
        TimeLib.formatTime(getStartMS()), TimeLib.formatTime(getEndMS()));
  }

  /** @return dimensionality of this sequence (0 if it is empty) */
  public int getNumDims()
  {
    if (data.isEmpty()) return 0;
    return data.get(0).getNumDims();
  }

  /** @return length of this sequence */
  public int length()
  {
    return data.size();
  }

  /** @return true if this sequence has no data */
  public boolean isEmpty()
  {
    return data.isEmpty();
  }

  /** @return i^th feature vector; negative indices count back from the end */
  public FeatureVec get(int i)
  {
    if (i < 0) {
      i += length();
    }
    return data.get(i);
  }

  /** @return value of the d^th dimension in the i^th feature vector */
  public double get(int i, int d)
  {
    return get(i).get(d);
  }

  /** set the d^th dimension in the i^th feature vector */
  public void set(int i, int d, double x)
  {
    get(i).set(d, x);
  }

  /** @return last feature vector in this sequence. */
  public FeatureVec getLast()
  {
    return get(length() - 1);
  }

  /** @return start time (time of first sample in ms) of this sequence */
  public long getStartMS()
  {
    return isEmpty() ? TimeLib.TIME_ERROR : data.get(0).getTime();
  }

  /** @return end time (time of last sample in ms) of this sequence */
  public long getEndMS()
  {
    return isEmpty() ? TimeLib.TIME_ERROR : getLast().getTime();
  }

  /** @return time in ms of the given frame */
  public long getTimeMS(int i)
  {
    return get(i).getTime();
  }

  /**
   * Append a time-stamped feature vector to the end of this sequence.
   *
   * @param value feature vector to add (stored by reference)
   * @param ms timestamp for the new frame
   * @return index of the new frame
   * @throws IllegalArgumentException if the timestamp is not after the current end of the sequence or the
   *           dimensionality doesn't match
   */
  public int addData(FeatureVec value, long ms)
  {
    assert value != null;
    if (!isEmpty()) {
      if (ms <= getEndMS()) {
        throw new IllegalArgumentException(String.format("Timestamps must increase (%s): %s <= %s", name,
            TimeLib.formatTime(ms), TimeLib.formatTime(getEndMS())));
      }
      if (value.getNumDims() != getNumDims()) {
        throw new IllegalArgumentException(
            String.format("Dimension mismatch (%s): %d vs %d", name, value.getNumDims(), getNumDims()));
      }
    }
    value.setTime(ms);
    data.add(value);
    return data.size() - 1;
  }

  /** Append a time-stamped frame built from the given values. */
  public int addData(long ms, double... values)
  {
    return addData(new FeatureVec(values), ms);
  }

  /**
   * Extract the given dimension and return it in an array.
   *
   * @param iDim index of the dimension to retrieve
   * @return the given dimension as a double array
   */
  public double[] extractDim(int iDim)
  {
    double[] ret = new double[length()];
    for (int i = 0; i < ret.length; i++)
      ret[i] = data.get(i).get(iDim);
    return ret;
  }

  /** @return subsequence (deep copy) with numElements starting at index iStart. */
  public Sequence subseq(int iStart, int numElements)
  {
    assert iStart >= 0 && numElements >= 0 && iStart + numElements <= length();
    Sequence seq = new Sequence(name);
    for (int i = 0; i < numElements; ++i) {
      seq.data.add(data.get(iStart + i).dup());
    }
    return seq;
  }

  /**
   * Returns a new sequence with all time steps of this one but different dimensions. A negative entry in dims produces a
   * NaN-filled dimension.
   */
  public Sequence extractDims(int... dims)
  {
    Sequence ret = new Sequence(name);
    for (FeatureVec fv : data)
      ret.data.add(fv.selectDims(dims));
    return ret;
  }

  /**
   * Duplicate this sequence.
   *
   * @return a deep copy of this sequence.
   */
  public Sequence dup()
  {
    return subseq(0, length());
  }

  @Override
  public Iterator<FeatureVec> iterator()
  {
    return data.iterator();
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof Sequence)) return false;
    Sequence seq = (Sequence) o;
    return name.equals(seq.name) && data.equals(seq.data);
  }

  @Override
  public int hashCode()
  {
    return 31 * name.hashCode() + data.hashCode();
  }
}
