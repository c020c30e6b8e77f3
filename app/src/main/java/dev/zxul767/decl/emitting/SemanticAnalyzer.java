package dev.zxul767.decl.emitting;

import dev.zxul767.decl.Diagnostic;
import dev.zxul767.decl.Reporter;
import dev.zxul767.decl.lowering.Declaration;
import java.util.List;

// Flags declarations that are well formed but suspicious. Nothing reported
// here is fatal: the declarations are emitted all the same.
public class SemanticAnalyzer {
  public static final String SUPPORTED_TYPE = "string";

  private final Reporter reporter;

  public SemanticAnalyzer(Reporter reporter) { this.reporter = reporter; }

  public void analyze(List<Declaration> declarations) {
    for (Declaration declaration : declarations) {
      analyze(declaration);
    }
  }

  public void analyze(Declaration declaration) {
    if (!declaration.typeName.equals(SUPPORTED_TYPE)) {
      warn(
          Diagnostic.Kind.UNSUPPORTED_TYPE,
          String.format(
              "Unsupported type '%s' for '%s'.", declaration.typeName,
              declaration.name
          )
      );
    }
    if (declaration.value.isEmpty()) {
      warn(
          Diagnostic.Kind.EMPTY_VALUE,
          String.format("Empty string for '%s'.", declaration.name)
      );
    }
  }

  private void warn(Diagnostic.Kind kind, String message) {
    reporter.report(Diagnostic.warning(kind, Diagnostic.NO_OFFSET, message));
  }
}
