package org.minnen.forecast.model.diag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default listener: forwards every diagnostic to SLF4J at a level that depends on its kind. */
public class LoggingDiagnosticListener implements DiagnosticListener
{
  private static final Logger                   log      = LoggerFactory.getLogger(LoggingDiagnosticListener.class);

  public static final LoggingDiagnosticListener INSTANCE = new LoggingDiagnosticListener();

  @Override
  public void onDiagnostic(Diagnostic d)
  {
    switch (d.kind) {
    case NON_STRING_HYPERPARAMETER_KEY:
    case UNUSED_HYPERPARAMETERS:
    case NO_TIME_LEFT:
    case REGRESSOR_DISABLED:
      log.warn("{}: {}", d.source, d.message);
      break;
    case TIME_LIMIT_ADJUSTED:
      log.debug("{}: {}", d.source, d.message);
      break;
    default:
      log.info("{}: {}", d.source, d.message);
    }
  }
}
