package org.minnen.forecast.util;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.minnen.forecast.data.Sequence;
import org.minnen.forecast.data.TimeSeriesData;

public class ForecastLib
{
  public static final String            MEAN_COLUMN = "mean";

  private static final DateTimeFormatter dtfDirName = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  /** @return column name for a quantile level ("0.1", "0.5", "0.95", ...) */
  public static String quantileColumnName(double q)
  {
    return BigDecimal.valueOf(q).stripTrailingZeros().toPlainString();
  }

  /** @return column names for the given quantile levels, in order */
  public static List<String> quantileColumns(Collection<Double> levels)
  {
    List<String> names = new ArrayList<>();
    for (double q : levels) {
      names.add(quantileColumnName(q));
    }
    return names;
  }

  /** @return "mean" followed by one column per quantile level */
  public static List<String> predictionColumns(Collection<Double> levels)
  {
    List<String> names = new ArrayList<>();
    names.add(MEAN_COLUMN);
    names.addAll(quantileColumns(levels));
    return names;
  }

  /**
   * Infer the sampling step of a sequence from its last two timestamps.
   *
   * @return frequency or null if the sequence has fewer than two observations
   */
  public static Frequency inferFrequency(Sequence seq)
  {
    if (seq.length() < 2) return null;
    return Frequency.ofMillis(seq.getTimeMS(-1) - seq.getTimeMS(-2));
  }

  /**
   * Build an empty (zero-column) table that holds the forecast horizon of every item: the next `predictionLength`
   * timestamps after the item's last observation.
   *
   * @param data historical data
   * @param predictionLength number of future steps
   * @param freq sampling frequency; if null it is inferred per item from the last two observations
   * @return zero-column table indexed like the future predictions
   * @throws IllegalArgumentException if an item is empty or the frequency can't be inferred
   */
  public static TimeSeriesData makeFutureData(TimeSeriesData data, int predictionLength, Frequency freq)
  {
    TimeSeriesData future = new TimeSeriesData();
    for (Sequence seq : data) {
      if (seq.isEmpty()) {
        throw new IllegalArgumentException("Can't build forecast horizon for empty item: " + seq.getName());
      }
      Frequency itemFreq = (freq != null ? freq : inferFrequency(seq));
      if (itemFreq == null) {
        throw new IllegalArgumentException("Can't infer frequency for item: " + seq.getName());
      }
      Sequence horizon = new Sequence(seq.getName());
      long ms = seq.getEndMS();
      for (int i = 1; i <= predictionLength; ++i) {
        horizon.addData(itemFreq.advance(ms, i));
      }
      future.addItem(horizon);
    }
    return future;
  }

  /**
   * Create a fresh, uniquely named directory under `root` for a model without an explicit path.
   *
   * @return directory `<root>/fm-<timestamp>[-n]/<name>`
   */
  public static File setupOutputDir(File root, String name) throws IOException
  {
    String base = "fm-" + LocalDateTime.now().format(dtfDirName);
    File dir = new File(root, base);
    for (int i = 1; dir.exists(); ++i) {
      dir = new File(root, base + "-" + i);
    }
    File path = new File(dir, name);
    FileUtils.forceMkdir(path);
    return path;
  }
}
