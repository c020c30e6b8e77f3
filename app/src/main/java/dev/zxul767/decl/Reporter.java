package dev.zxul767.decl;

import java.util.Arrays;

// Destination for the diagnostics produced by every stage of the pipeline.
public interface Reporter {
  Reporter SILENT = diagnostic -> {};

  void report(Diagnostic diagnostic);

  // fans out every diagnostic to all of `reporters`, in order
  static Reporter all(Reporter... reporters) {
    return diagnostic
        -> Arrays.stream(reporters).forEach(r -> r.report(diagnostic));
  }
}
