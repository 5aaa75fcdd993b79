package org.minnen.forecast.model.diag;

/** Receives diagnostics from models and their components. */
@FunctionalInterface
public interface DiagnosticListener
{
  public void onDiagnostic(Diagnostic diagnostic);
}
