package org.minnen.forecast.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.json.JSONArray;
import org.json.JSONObject;

/** Roles of the non-target columns: known over the horizon, observed only in the past, or static per item. */
public final class CovariateMetadata
{
  private final List<String> knownCovariates;
  private final List<String> pastCovariates;
  private final List<String> staticFeatures;

  public CovariateMetadata(List<String> knownCovariates, List<String> pastCovariates, List<String> staticFeatures)
  {
    this.knownCovariates = copyOf(knownCovariates);
    this.pastCovariates = copyOf(pastCovariates);
    this.staticFeatures = copyOf(staticFeatures);
  }

  public static CovariateMetadata empty()
  {
    return new CovariateMetadata(null, null, null);
  }

  public static CovariateMetadata known(String... names)
  {
    return new CovariateMetadata(List.of(names), null, null);
  }

  private static List<String> copyOf(List<String> names)
  {
    if (names == null) return Collections.emptyList();
    return Collections.unmodifiableList(new ArrayList<>(names));
  }

  public List<String> getKnownCovariates()
  {
    return knownCovariates;
  }

  public List<String> getPastCovariates()
  {
    return pastCovariates;
  }

  public List<String> getStaticFeatures()
  {
    return staticFeatures;
  }

  /** @return all time-varying covariates (known, then past) */
  public List<String> getCovariates()
  {
    List<String> all = new ArrayList<>(knownCovariates);
    all.addAll(pastCovariates);
    return all;
  }

  public boolean isEmpty()
  {
    return knownCovariates.isEmpty() && pastCovariates.isEmpty() && staticFeatures.isEmpty();
  }

  public Map<String, Object> toMap()
  {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("known_covariates", new ArrayList<>(knownCovariates));
    map.put("past_covariates", new ArrayList<>(pastCovariates));
    map.put("static_features", new ArrayList<>(staticFeatures));
    return map;
  }

  public JSONObject toJson()
  {
    return new JSONObject(toMap());
  }

  public static CovariateMetadata fromJson(JSONObject obj)
  {
    return new CovariateMetadata(names(obj.optJSONArray("known_covariates")),
        names(obj.optJSONArray("past_covariates")), names(obj.optJSONArray("static_features")));
  }

  private static List<String> names(JSONArray array)
  {
    List<String> names = new ArrayList<>();
    if (array != null) {
      for (int i = 0; i < array.length(); ++i) {
        names.add(array.getString(i));
      }
    }
    return names;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) return true;
    if (!(o instanceof CovariateMetadata)) return false;
    CovariateMetadata md = (CovariateMetadata) o;
    return knownCovariates.equals(md.knownCovariates) && pastCovariates.equals(md.pastCovariates)
        && staticFeatures.equals(md.staticFeatures);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(knownCovariates, pastCovariates, staticFeatures);
  }

  @Override
  public String toString()
  {
    return String.format("[known=%s, past=%s, static=%s]", knownCovariates, pastCovariates, staticFeatures);
  }
}
