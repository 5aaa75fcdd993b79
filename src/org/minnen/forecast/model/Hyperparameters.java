package org.minnen.forecast.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;
import org.minnen.forecast.model.diag.Diagnostic;
import org.minnen.forecast.model.diag.DiagnosticListener;
import org.minnen.forecast.optimize.Space;

/**
 * Helpers for hyperparameter maps.
 *
 * A model receives one map from the user. The value under {@link #AUX_ARGS_KEY} holds auxiliary arguments that control
 * the fitting process (time limit ratio and cap, regressor time share) and is split out from the model
 * hyperparameters at construction.
 */
public class Hyperparameters
{
  public static final String AUX_ARGS_KEY                          = "aux_args_fit";

  public static final String MAX_TIME_LIMIT_RATIO                  = "max_time_limit_ratio";
  public static final String MAX_TIME_LIMIT                        = "max_time_limit";
  public static final String COVARIATE_REGRESSOR_FIT_TIME_FRACTION = "covariate_regressor_fit_time_fraction";

  public static final String TARGET_SCALER                         = "target_scaler";
  public static final String COVARIATE_SCALER                      = "covariate_scaler";
  public static final String COVARIATE_REGRESSOR                   = "covariate_regressor";

  /** Model hyperparameters and auxiliary arguments, each an independent deep copy of the user input. */
  public static final class Split
  {
    public final Map<String, Object> hyperparameters;
    public final Map<String, Object> auxArgs;

    private Split(Map<String, Object> hyperparameters, Map<String, Object> auxArgs)
    {
      this.hyperparameters = hyperparameters;
      this.auxArgs = auxArgs;
    }
  }

  /**
   * Split user hyperparameters into model hyperparameters and auxiliary arguments.
   *
   * Non-string keys raise a {@link Diagnostic.Kind#NON_STRING_HYPERPARAMETER_KEY} diagnostic and are converted to
   * strings.
   *
   * @param raw user hyperparameters (may be null)
   * @param listener receives diagnostics
   * @param modelName name used in diagnostics
   * @return split maps
   * @throws IllegalArgumentException if the auxiliary arguments are not a map
   */
  public static Split split(Map<?, ?> raw, DiagnosticListener listener, String modelName)
  {
    Map<String, Object> hyperparameters = new LinkedHashMap<>();
    if (raw != null) {
      for (Map.Entry<?, ?> entry : raw.entrySet()) {
        Object key = entry.getKey();
        if (!(key instanceof String)) {
          Map<String, Object> details = new LinkedHashMap<>();
          details.put("key", String.valueOf(key));
          details.put("type", key == null ? "null" : key.getClass().getSimpleName());
          listener.onDiagnostic(new Diagnostic(Diagnostic.Kind.NON_STRING_HYPERPARAMETER_KEY, modelName,
              String.format("Hyperparameter key is not a string: %s (type=%s). There might be a bug in your "
                  + "configuration.", key, details.get("type")),
              details));
        }
        hyperparameters.put(String.valueOf(key), deepCopyValue(entry.getValue()));
      }
    }

    Map<String, Object> auxArgs = new LinkedHashMap<>();
    if (hyperparameters.containsKey(AUX_ARGS_KEY)) {
      Object aux = hyperparameters.remove(AUX_ARGS_KEY);
      if (!(aux instanceof Map)) {
        throw new IllegalArgumentException(
            String.format("Invalid type for `%s`: expected a map, got %s", AUX_ARGS_KEY,
                aux == null ? "null" : aux.getClass().getSimpleName()));
      }
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) aux).entrySet()) {
        auxArgs.put(String.valueOf(entry.getKey()), entry.getValue());
      }
    }
    return new Split(hyperparameters, auxArgs);
  }

  /** @return deep copy of the given map (nested maps and lists are copied) */
  public static Map<String, Object> deepCopy(Map<String, Object> map)
  {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (map != null) {
      for (Map.Entry<String, Object> entry : map.entrySet()) {
        copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
      }
    }
    return copy;
  }

  private static Object deepCopyValue(Object value)
  {
    if (value instanceof Map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
      }
      return copy;
    } else if (value instanceof Collection) {
      List<Object> copy = new ArrayList<>();
      for (Object x : (Collection<?>) value) {
        copy.add(deepCopyValue(x));
      }
      return copy;
    } else if (value instanceof double[]) {
      return ((double[]) value).clone();
    } else if (value instanceof int[]) {
      return ((int[]) value).clone();
    }
    // Strings, boxed primitives and search spaces are immutable.
    return value;
  }

  /** @return true if any value (at the top level) is a search space */
  public static boolean containsSpace(Map<String, Object> map)
  {
    return map.values().stream().anyMatch(v -> v instanceof Space);
  }

  public static double getDouble(Map<String, Object> map, String key, double defaultValue)
  {
    Object value = map.get(key);
    if (value == null) return defaultValue;
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(String.format("%s must be a number: %s", key, value));
    }
    return ((Number) value).doubleValue();
  }

  /** @return value of the given key or null if it is missing */
  public static Double getDouble(Map<String, Object> map, String key)
  {
    if (map.get(key) == null) return null;
    return getDouble(map, key, Double.NaN);
  }

  public static int getInt(Map<String, Object> map, String key, int defaultValue)
  {
    Object value = map.get(key);
    if (value == null) return defaultValue;
    if (!(value instanceof Number) || ((Number) value).doubleValue() != ((Number) value).intValue()) {
      throw new IllegalArgumentException(String.format("%s must be an integer: %s", key, value));
    }
    return ((Number) value).intValue();
  }

  public static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue)
  {
    Object value = map.get(key);
    if (value == null) return defaultValue;
    if (!(value instanceof Boolean)) {
      throw new IllegalArgumentException(String.format("%s must be a boolean: %s", key, value));
    }
    return (Boolean) value;
  }

  public static String getString(Map<String, Object> map, String key, String defaultValue)
  {
    Object value = map.get(key);
    return value == null ? defaultValue : value.toString();
  }

  /**
   * Convert a hyperparameter map to JSON.
   *
   * @throws IllegalArgumentException if a value can't be represented in JSON (e.g. a search space)
   */
  public static JSONObject toJson(Map<String, Object> map)
  {
    JSONObject obj = new JSONObject();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      obj.put(entry.getKey(), toJsonValue(entry.getKey(), entry.getValue()));
    }
    return obj;
  }

  private static Object toJsonValue(String key, Object value)
  {
    if (value == null) return JSONObject.NULL;
    if (value instanceof String || value instanceof Boolean) return value;
    if (value instanceof Number) {
      double x = ((Number) value).doubleValue();
      return Double.isFinite(x) ? value : JSONObject.NULL;
    }
    if (value instanceof Map) {
      JSONObject obj = new JSONObject();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        obj.put(String.valueOf(entry.getKey()), toJsonValue(key, entry.getValue()));
      }
      return obj;
    }
    if (value instanceof Collection) {
      JSONArray array = new JSONArray();
      for (Object x : (Collection<?>) value) {
        array.put(toJsonValue(key, x));
      }
      return array;
    }
    if (value instanceof double[]) {
      JSONArray array = new JSONArray();
      for (double x : (double[]) value) {
        array.put(Double.isFinite(x) ? (Object) x : JSONObject.NULL);
      }
      return array;
    }
    throw new IllegalArgumentException(
        String.format("Hyperparameter [%s] can't be saved: %s (%s)", key, value, value.getClass().getSimpleName()));
  }

  /** Convert JSON written by {@link #toJson} back to a map of plain Java values. */
  public static Map<String, Object> fromJson(JSONObject obj)
  {
    Map<String, Object> map = new LinkedHashMap<>();
    for (String key : obj.keySet()) {
      map.put(key, fromJsonValue(obj.get(key)));
    }
    return map;
  }

  private static Object fromJsonValue(Object value)
  {
    if (value == null || JSONObject.NULL.equals(value)) return null;
    if (value instanceof JSONObject) return fromJson((JSONObject) value);
    if (value instanceof JSONArray) {
      List<Object> list = new ArrayList<>();
      for (Object x : (JSONArray) value) {
        list.add(fromJsonValue(x));
      }
      return list;
    }
    if (value instanceof BigDecimal) return ((BigDecimal) value).doubleValue();
    if (value instanceof BigInteger) return ((BigInteger) value).longValue();
    if (value instanceof Float) return ((Float) value).doubleValue();
    return value;
  }
}
