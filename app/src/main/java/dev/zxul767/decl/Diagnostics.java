package dev.zxul767.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

// Keeps every reported diagnostic, in the order it was reported.
public class Diagnostics implements Reporter {
  private final List<Diagnostic> reported = new ArrayList<>();

  @Override
  public void report(Diagnostic diagnostic) {
    reported.add(diagnostic);
  }

  public List<Diagnostic> all() { return Collections.unmodifiableList(reported); }

  public List<Diagnostic> ofKind(Diagnostic.Kind kind) {
    return reported.stream()
        .filter(d -> d.kind == kind)
        .collect(Collectors.toList());
  }

  public boolean hadError() {
    return reported.stream().anyMatch(Diagnostic::isError);
  }

  public boolean isEmpty() { return reported.isEmpty(); }
}
