package org.minnen.forecast.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A table of observations indexed by (item id, timestamp).
 *
 * Each item is stored as a {@link Sequence} whose feature vectors hold one value per column. Items keep their
 * insertion order. Optional static features hold one row of time-invariant values per item.
 *
 * Operations that return a TimeSeriesData always return a new table; callers can treat tables as values.
 */
public class TimeSeriesData implements Iterable<Sequence>
{
  private final List<String>          columns;
  private final Map<String, Sequence> items = new LinkedHashMap<>();
  private StaticFeatures              staticFeatures;

  public TimeSeriesData(List<String> columns)
  {
    if (columns.size() != columns.stream().distinct().count()) {
      throw new IllegalArgumentException("Duplicate column names: " + columns);
    }
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
  }

  public TimeSeriesData(String... columns)
  {
    this(Arrays.asList(columns));
  }

  public List<String> getColumns()
  {
    return columns;
  }

  public int getNumColumns()
  {
    return columns.size();
  }

  public boolean hasColumn(String column)
  {
    return columns.contains(column);
  }

  /** @return index of the given column or -1 if it doesn't exist */
  public int getColumnIndex(String column)
  {
    return columns.indexOf(column);
  }

  /**
   * @return index of the given column
   * @throws IllegalArgumentException if the column doesn't exist
   */
  public int requireColumn(String column)
  {
    int index = columns.indexOf(column);
    if (index < 0) {
      throw new IllegalArgumentException(String.format("Column [%s] not found in %s", column, columns));
    }
    return index;
  }

  public StaticFeatures getStaticFeatures()
  {
    return staticFeatures;
  }

  public TimeSeriesData setStaticFeatures(StaticFeatures staticFeatures)
  {
    this.staticFeatures = staticFeatures;
    return this;
  }

  /**
   * Add (or replace) the given item sequence.
   *
   * @param seq sequence to add; its name is the item id
   * @return this table
   */
  public TimeSeriesData addItem(Sequence seq)
  {
    if (!seq.isEmpty() && seq.getNumDims() != columns.size()) {
      throw new IllegalArgumentException(String.format("Item %s has %d dims but table has %d columns", seq.getName(),
          seq.getNumDims(), columns.size()));
    }
    items.put(seq.getName(), seq);
    return this;
  }

  /**
   * Append one observation to the given item, creating the item if necessary.
   *
   * @param itemId item id
   * @param ms timestamp in ms
   * @param values one value per column
   * @return this table
   */
  public TimeSeriesData add(String itemId, long ms, double... values)
  {
    if (values.length != columns.size()) {
      throw new IllegalArgumentException(
          String.format("Expected %d values for %s, got %d", columns.size(), itemId, values.length));
    }
    items.computeIfAbsent(itemId, Sequence::new).addData(ms, values);
    return this;
  }

  public Set<String> getItemIds()
  {
    return Collections.unmodifiableSet(items.keySet());
  }

  public int getNumItems()
  {
    return items.size();
  }

  /** @return sequence for the given item or null if it doesn't exist */
  public Sequence getItem(String itemId)
  {
    return items.get(itemId);
  }

  public boolean hasItem(String itemId)
  {
    return items.containsKey(itemId);
  }

  /** @return total number of rows across all items */
  public int getNumRows()
  {
    int n = 0;
    for (Sequence seq : items.values()) {
      n += seq.length();
    }
    return n;
  }

  public boolean isEmpty()
  {
    return items.isEmpty();
  }

  /** @return values of one column for one item */
  public double[] extractColumn(String itemId, String column)
  {
    Sequence seq = items.get(itemId);
    if (seq == null) {
      throw new IllegalArgumentException("Unknown item: " + itemId);
    }
    return seq.extractDim(requireColumn(column));
  }

  /** @return values of one column across all items (in item order) */
  public double[] extractColumn(String column)
  {
    int iCol = requireColumn(column);
    double[] values = new double[getNumRows()];
    int i = 0;
    for (Sequence seq : items.values()) {
      for (FeatureVec fv : seq) {
        values[i++] = fv.get(iCol);
      }
    }
    return values;
  }

  /** @return deep copy of this table */
  public TimeSeriesData dup()
  {
    TimeSeriesData ret = new TimeSeriesData(columns);
    for (Sequence seq : items.values()) {
      ret.items.put(seq.getName(), seq.dup());
    }
    ret.staticFeatures = (staticFeatures == null ? null : staticFeatures.dup());
    return ret;
  }

  /**
   * Build a table with exactly the given columns, in the given order. Columns that don't exist in this table are filled
   * with NaN.
   *
   * @param newColumns columns of the new table
   * @return new table (static features are copied)
   */
  public TimeSeriesData reindexColumns(List<String> newColumns)
  {
    int[] dims = new int[newColumns.size()];
    for (int i = 0; i < dims.length; ++i) {
      dims[i] = getColumnIndex(newColumns.get(i));
    }
    TimeSeriesData ret = new TimeSeriesData(newColumns);
    for (Sequence seq : items.values()) {
      ret.items.put(seq.getName(), seq.extractDims(dims));
    }
    ret.staticFeatures = (staticFeatures == null ? null : staticFeatures.dup());
    return ret;
  }

  /** @return new table without the given column */
  public TimeSeriesData dropColumn(String column)
  {
    List<String> newColumns = new ArrayList<>(columns);
    newColumns.remove(column);
    return reindexColumns(newColumns);
  }

  /**
   * Overwrite column `to` with the values of column `from` (in place).
   *
   * @return this table
   */
  public TimeSeriesData copyColumn(String from, String to)
  {
    int iFrom = requireColumn(from);
    int iTo = requireColumn(to);
    for (Sequence seq : items.values()) {
      for (FeatureVec fv : seq) {
        fv.set(iTo, fv.get(iFrom));
      }
    }
    return this;
  }

  /** @return new table with the last `n` rows of every item removed */
  public TimeSeriesData dropLast(int n)
  {
    TimeSeriesData ret = new TimeSeriesData(columns);
    for (Sequence seq : items.values()) {
      ret.items.put(seq.getName(), seq.subseq(0, seq.length() - n));
    }
    ret.staticFeatures = (staticFeatures == null ? null : staticFeatures.dup());
    return ret;
  }

  /** @return new table with only the last `n` rows of every item (no static features) */
  public TimeSeriesData lastRows(int n)
  {
    TimeSeriesData ret = new TimeSeriesData(columns);
    for (Sequence seq : items.values()) {
      int len = Math.min(n, seq.length());
      ret.items.put(seq.getName(), seq.subseq(seq.length() - len, len));
    }
    return ret;
  }

  /**
   * Split this table for scoring: the last `predictionLength` steps of every item are held out.
   *
   * @param predictionLength number of held-out time steps per item
   * @param knownCovariateNames columns that are known over the forecast horizon
   * @return historical context (all columns, held-out rows removed) and the known covariates over the held-out rows
   *         (null when there are no known covariates)
   * @throws IllegalArgumentException if an item is not longer than `predictionLength` or a covariate column is missing
   */
  public ModelInputs getModelInputsForScoring(int predictionLength, List<String> knownCovariateNames)
  {
    for (Sequence seq : items.values()) {
      if (seq.length() <= predictionLength) {
        throw new IllegalArgumentException(String.format("Item %s has %d rows; scoring needs more than %d",
            seq.getName(), seq.length(), predictionLength));
      }
    }
    TimeSeriesData past = dropLast(predictionLength);
    TimeSeriesData known = null;
    if (knownCovariateNames != null && !knownCovariateNames.isEmpty()) {
      for (String name : knownCovariateNames) {
        requireColumn(name);
      }
      known = lastRows(predictionLength).reindexColumns(knownCovariateNames);
    }
    return new ModelInputs(past, known);
  }

  @Override
  public Iterator<Sequence> iterator()
  {
    return items.values().iterator();
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof TimeSeriesData)) return false;
    TimeSeriesData other = (TimeSeriesData) o;
    if (!columns.equals(other.columns)) return false;
    if (!new ArrayList<>(items.keySet()).equals(new ArrayList<>(other.items.keySet()))) return false;
    if (!items.equals(other.items)) return false;
    if (staticFeatures == null) return other.staticFeatures == null;
    return staticFeatures.equals(other.staticFeatures);
  }

  @Override
  public int hashCode()
  {
    return 31 * columns.hashCode() + items.hashCode();
  }

  @Override
  public String toString()
  {
    return String.format("[TimeSeriesData: %d items, %d rows, columns=%s]", getNumItems(), getNumRows(), columns);
  }
}
