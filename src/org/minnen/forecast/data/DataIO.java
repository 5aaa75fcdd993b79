package org.minnen.forecast.data;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.minnen.forecast.util.TimeLib;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reading and writing time series tables.
 *
 * Tables are stored as JSON for model artifacts and as CSV (item_id,timestamp,columns...) for exchange with other
 * tools. Missing values are written as JSON null (or an empty CSV field).
 */
public class DataIO
{
  private static final Logger log = LoggerFactory.getLogger(DataIO.class);

  public static final String  ITEM_ID_COLUMN   = "item_id";
  public static final String  TIMESTAMP_COLUMN = "timestamp";

  /** @return JSON value for a double (null for NaN, string for infinite values) */
  public static Object encodeDouble(double x)
  {
    if (Double.isNaN(x)) return JSONObject.NULL;
    if (Double.isInfinite(x)) return x > 0 ? "Infinity" : "-Infinity";
    return x;
  }

  /** @return double stored at index `i` of the array (NaN for null) */
  public static double decodeDouble(JSONArray array, int i)
  {
    if (array.isNull(i)) return Double.NaN;
    Object value = array.get(i);
    if (value instanceof String) return Double.parseDouble((String) value);
    return array.getDouble(i);
  }

  public static JSONArray encodeArray(double[] values)
  {
    JSONArray array = new JSONArray();
    for (double x : values) {
      array.put(encodeDouble(x));
    }
    return array;
  }

  public static double[] decodeArray(JSONArray array)
  {
    double[] values = new double[array.length()];
    for (int i = 0; i < values.length; ++i) {
      values[i] = decodeDouble(array, i);
    }
    return values;
  }

  public static JSONObject toJson(TimeSeriesData data)
  {
    JSONObject obj = new JSONObject();
    obj.put("columns", new JSONArray(data.getColumns()));
    JSONArray items = new JSONArray();
    for (Sequence seq : data) {
      JSONObject item = new JSONObject();
      item.put("item_id", seq.getName());
      JSONArray times = new JSONArray();
      JSONArray rows = new JSONArray();
      for (FeatureVec fv : seq) {
        times.put(fv.getTime());
        rows.put(encodeArray(fv.get()));
      }
      item.put("timestamps", times);
      item.put("values", rows);
      items.put(item);
    }
    obj.put("items", items);

    StaticFeatures sf = data.getStaticFeatures();
    if (sf != null) {
      JSONObject jsf = new JSONObject();
      jsf.put("columns", new JSONArray(sf.getColumns()));
      JSONObject rows = new JSONObject();
      for (String itemId : sf.getItemIds()) {
        rows.put(itemId, encodeArray(sf.get(itemId)));
      }
      jsf.put("rows", rows);
      obj.put("static_features", jsf);
    }
    return obj;
  }

  public static TimeSeriesData fromJson(JSONObject obj)
  {
    TimeSeriesData data = new TimeSeriesData(strings(obj.getJSONArray("columns")));
    JSONArray items = obj.getJSONArray("items");
    for (int i = 0; i < items.length(); ++i) {
      JSONObject item = items.getJSONObject(i);
      Sequence seq = new Sequence(item.getString("item_id"));
      JSONArray times = item.getJSONArray("timestamps");
      JSONArray rows = item.getJSONArray("values");
      for (int t = 0; t < times.length(); ++t) {
        seq.addData(times.getLong(t), decodeArray(rows.getJSONArray(t)));
      }
      data.addItem(seq);
    }

    JSONObject jsf = obj.optJSONObject("static_features");
    if (jsf != null) {
      StaticFeatures sf = new StaticFeatures(strings(jsf.getJSONArray("columns")));
      JSONObject rows = jsf.getJSONObject("rows");
      // Preserve the item order of the time series.
      for (Sequence seq : data) {
        if (rows.has(seq.getName())) {
          sf.set(seq.getName(), decodeArray(rows.getJSONArray(seq.getName())));
        }
      }
      for (String itemId : rows.keySet()) {
        if (sf.get(itemId) == null) {
          sf.set(itemId, decodeArray(rows.getJSONArray(itemId)));
        }
      }
      data.setStaticFeatures(sf);
    }
    return data;
  }

  public static List<String> strings(JSONArray array)
  {
    List<String> list = new ArrayList<>();
    for (int i = 0; i < array.length(); ++i) {
      list.add(array.getString(i));
    }
    return list;
  }

  /** Write a JSON object to the given file, creating parent directories as needed. */
  public static void writeJson(JSONObject obj, File file) throws IOException
  {
    FileUtils.writeStringToFile(file, obj.toString(2), StandardCharsets.UTF_8);
  }

  /**
   * Read a JSON object from the given file.
   *
   * @throws IOException if the file can't be read or doesn't hold a JSON object
   */
  public static JSONObject readJson(File file) throws IOException
  {
    if (!file.canRead()) {
      throw new IOException(String.format("Can't read JSON file (%s)", file.getPath()));
    }
    String text = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
    try {
      return new JSONObject(text);
    } catch (JSONException e) {
      throw new IOException(String.format("Malformed JSON file (%s)", file.getPath()), e);
    }
  }

  /** Save a list of prediction tables (e.g. out-of-fold predictions). */
  public static void savePredictionList(List<TimeSeriesData> tables, File file) throws IOException
  {
    JSONArray array = new JSONArray();
    for (TimeSeriesData table : tables) {
      array.put(toJson(table));
    }
    JSONObject obj = new JSONObject();
    obj.put("tables", array);
    writeJson(obj, file);
    log.debug("Saved {} prediction table(s): {}", tables.size(), file);
  }

  public static List<TimeSeriesData> loadPredictionList(File file) throws IOException
  {
    JSONObject obj = readJson(file);
    try {
      JSONArray array = obj.getJSONArray("tables");
      List<TimeSeriesData> tables = new ArrayList<>();
      for (int i = 0; i < array.length(); ++i) {
        tables.add(fromJson(array.getJSONObject(i)));
      }
      log.debug("Loaded {} prediction table(s): {}", tables.size(), file);
      return tables;
    } catch (JSONException | IllegalArgumentException e) {
      throw new IOException(String.format("Malformed prediction file (%s)", file.getPath()), e);
    }
  }

  /**
   * Load a table from a CSV file with header "item_id,timestamp,col1,col2,...". Rows of one item must appear in time
   * order. Empty fields and "NaN" are missing values.
   *
   * @param file CSV file to load
   * @return table with one sequence per item
   * @throws IOException if the file can't be read or is malformed
   */
  public static TimeSeriesData loadCSV(File file) throws IOException
  {
    if (!file.canRead()) {
      throw new IOException(String.format("Can't read CSV file (%s)", file.getPath()));
    }
    log.debug("Loading CSV data file: [{}]", file.getPath());

    try (BufferedReader in = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      String header = in.readLine();
      if (header == null) {
        throw new IOException(String.format("Empty CSV file (%s)", file.getPath()));
      }
      String[] names = header.trim().split(",", -1);
      if (names.length < 2 || !names[0].equals(ITEM_ID_COLUMN) || !names[1].equals(TIMESTAMP_COLUMN)) {
        throw new IOException(String.format("CSV header must start with %s,%s (%s)", ITEM_ID_COLUMN,
            TIMESTAMP_COLUMN, file.getPath()));
      }
      TimeSeriesData data = new TimeSeriesData(Arrays.asList(names).subList(2, names.length));

      String line;
      int nLine = 1;
      while ((line = in.readLine()) != null) {
        ++nLine;
        line = line.trim();
        if (line.isEmpty()) continue;
        String[] toks = line.split(",", -1);
        if (toks.length != names.length) {
          throw new IOException(String.format("Expected %d fields on line %d, found %d (%s)", names.length, nLine,
              toks.length, file.getPath()));
        }
        double[] values = new double[toks.length - 2];
        try {
          for (int i = 0; i < values.length; ++i) {
            String tok = toks[i + 2].trim();
            values[i] = tok.isEmpty() ? Double.NaN : Double.parseDouble(tok);
          }
          data.add(toks[0].trim(), TimeLib.parseTime(toks[1]), values);
        } catch (IllegalArgumentException e) {
          throw new IOException(String.format("Error parsing line %d: [%s]", nLine, line), e);
        }
      }
      return data;
    }
  }

  /** Save a table as CSV (see {@link #loadCSV}). Static features are not written. */
  public static void saveCSV(TimeSeriesData data, File file) throws IOException
  {
    File parent = file.getAbsoluteFile().getParentFile();
    if (parent != null) {
      FileUtils.forceMkdir(parent);
    }
    try (BufferedWriter out = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      out.write(ITEM_ID_COLUMN + "," + TIMESTAMP_COLUMN);
      for (String column : data.getColumns()) {
        out.write("," + column);
      }
      out.newLine();
      for (Sequence seq : data) {
        for (FeatureVec fv : seq) {
          out.write(seq.getName() + "," + TimeLib.formatTime(fv.getTime()));
          for (int i = 0; i < fv.getNumDims(); ++i) {
            double x = fv.get(i);
            out.write(",");
            if (!Double.isNaN(x)) {
              out.write(Double.toString(x));
            }
          }
          out.newLine();
        }
      }
    }
  }
}
