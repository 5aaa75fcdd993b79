package org.minnen.forecast.model.diag;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A structured event raised while configuring, fitting or loading a model. */
public class Diagnostic
{
  public enum Kind {
    /** No path was given so a default output directory was created. */
    DEFAULT_PATH,
    /** A hyperparameter key is not a string. */
    NON_STRING_HYPERPARAMETER_KEY,
    /** Hyperparameters that the model doesn't recognize. */
    UNUSED_HYPERPARAMETERS,
    /** The time limit handed to training was reduced. */
    TIME_LIMIT_ADJUSTED,
    /** The time budget was exhausted before training started. */
    NO_TIME_LEFT,
    /** The covariate regressor turned itself off. */
    REGRESSOR_DISABLED,
    /** Cached model info was unavailable so the model was loaded instead. */
    INFO_FALLBACK
  }

  public final Kind                kind;

  /** Name of the model (or component) that raised the event. */
  public final String              source;
  public final String              message;
  public final Map<String, Object> details;

  public Diagnostic(Kind kind, String source, String message, Map<String, Object> details)
  {
    this.kind = kind;
    this.source = source;
    this.message = message;
    this.details = details == null ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public Diagnostic(Kind kind, String source, String message)
  {
    this(kind, source, message, null);
  }

  @Override
  public String toString()
  {
    return String.format("[%s] %s: %s", kind, source, message);
  }
}
