package dev.zxul767.decl.emitting;

import dev.zxul767.decl.Reporter;
import dev.zxul767.decl.lowering.Declaration;
import java.util.List;

// Renders declarations as a flat key/value object:
//
//   {
//     "x": "hi",
//   }
//
// Names and values are written verbatim (no escaping) and every entry ends
// with a comma, the last one included.
public class JsonEmitter {
  private static final String INDENT = "  ";

  private final SemanticAnalyzer analyzer;

  public JsonEmitter() { this(Reporter.SILENT); }

  public JsonEmitter(Reporter reporter) {
    this.analyzer = new SemanticAnalyzer(reporter);
  }

  public String emit(List<Declaration> declarations) {
    analyzer.analyze(declarations);

    StringBuilder builder = new StringBuilder("{\n");
    for (Declaration declaration : declarations) {
      builder.append(INDENT)
          .append(quote(declaration.name))
          .append(": ")
          .append(quote(declaration.value))
          .append(",\n");
    }
    builder.append("}");
    return builder.toString();
  }

  private static String quote(String text) { return "\"" + text + "\""; }
}
