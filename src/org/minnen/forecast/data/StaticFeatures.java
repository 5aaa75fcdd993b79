package org.minnen.forecast.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Per-item (time-invariant) real-valued features, one row per item id. */
public class StaticFeatures
{
  private final List<String>          columns;
  private final Map<String, double[]> rows = new LinkedHashMap<>();

  public StaticFeatures(List<String> columns)
  {
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
  }

  public StaticFeatures(String... columns)
  {
    this(Arrays.asList(columns));
  }

  public List<String> getColumns()
  {
    return columns;
  }

  /** @return index of the given column or -1 if it doesn't exist */
  public int getColumnIndex(String column)
  {
    return columns.indexOf(column);
  }

  public boolean hasColumn(String column)
  {
    return columns.contains(column);
  }

  public Set<String> getItemIds()
  {
    return Collections.unmodifiableSet(rows.keySet());
  }

  /** Set all static values for one item. */
  public StaticFeatures set(String itemId, double... values)
  {
    if (values.length != columns.size()) {
      throw new IllegalArgumentException(
          String.format("Static features for %s: expected %d values, got %d", itemId, columns.size(), values.length));
    }
    rows.put(itemId, values.clone());
    return this;
  }

  /** @return static values for the given item (actual reference) or null if the item is unknown */
  public double[] get(String itemId)
  {
    return rows.get(itemId);
  }

  /** @return static value of one column for one item (NaN if the item is unknown) */
  public double get(String itemId, int iColumn)
  {
    double[] row = rows.get(itemId);
    return row == null ? Double.NaN : row[iColumn];
  }

  /** @return values of one column across all items, in item order */
  public double[] extractColumn(int iColumn)
  {
    return rows.values().stream().mapToDouble(row -> row[iColumn]).toArray();
  }

  public StaticFeatures dup()
  {
    StaticFeatures sf = new StaticFeatures(columns);
    for (Map.Entry<String, double[]> entry : rows.entrySet()) {
      sf.rows.put(entry.getKey(), entry.getValue().clone());
    }
    return sf;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof StaticFeatures)) return false;
    StaticFeatures sf = (StaticFeatures) o;
    if (!columns.equals(sf.columns) || !rows.keySet().equals(sf.rows.keySet())) return false;
    for (Map.Entry<String, double[]> entry : rows.entrySet()) {
      if (!Arrays.equals(entry.getValue(), sf.rows.get(entry.getKey()))) return false;
    }
    return true;
  }

  @Override
  public int hashCode()
  {
    return 31 * columns.hashCode() + rows.keySet().hashCode();
  }
}
