package org.minnen.forecast.optimize;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Choice among a fixed list of values; the first one is the default. */
public class CategoricalSpace extends Space<Object>
{
  private final List<Object> choices;

  public CategoricalSpace(Object... choices)
  {
    if (choices.length == 0) {
      throw new IllegalArgumentException("Categorical space needs at least one choice");
    }
    this.choices = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(choices)));
  }

  public List<Object> getChoices()
  {
    return choices;
  }

  @Override
  public Object getDefault()
  {
    return choices.get(0);
  }

  @Override
  public String toString()
  {
    return "Categorical" + choices;
  }
}
