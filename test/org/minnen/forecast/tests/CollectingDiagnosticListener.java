package org.minnen.forecast.tests;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.minnen.forecast.model.diag.Diagnostic;
import org.minnen.forecast.model.diag.DiagnosticListener;

public class CollectingDiagnosticListener implements DiagnosticListener
{
  public final List<Diagnostic> events = new ArrayList<>();

  @Override
  public void onDiagnostic(Diagnostic diagnostic)
  {
    events.add(diagnostic);
  }

  public List<Diagnostic> get(Diagnostic.Kind kind)
  {
    return events.stream().filter(d -> d.kind == kind).collect(Collectors.toList());
  }

  public boolean has(Diagnostic.Kind kind)
  {
    return !get(kind).isEmpty();
  }
}
