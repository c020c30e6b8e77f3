package dev.zxul767.decl;

import dev.zxul767.decl.emitting.JsonEmitter;
import dev.zxul767.decl.lowering.Lowering;
import dev.zxul767.decl.lowering.LoweringResult;
import dev.zxul767.decl.parsing.Scanner;
import dev.zxul767.decl.parsing.SyntaxNode;
import dev.zxul767.decl.parsing.Token;
import dev.zxul767.decl.parsing.TreeBuilder;
import java.util.List;

// Runs the whole pipeline (text -> tokens -> tree -> declarations -> output)
// over one source, keeping every intermediate result.
public class DeclCompiler {
  public static class Result {
    public final List<Token> tokens;
    public final SyntaxNode tree;
    public final LoweringResult lowering;
    public final String output;
    public final List<Diagnostic> diagnostics;

    Result(
        List<Token> tokens, SyntaxNode tree, LoweringResult lowering,
        String output, List<Diagnostic> diagnostics
    ) {
      this.tokens = tokens;
      this.tree = tree;
      this.lowering = lowering;
      this.output = output;
      this.diagnostics = diagnostics;
    }

    public boolean hadError() {
      return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
  }

  // gets a copy of every diagnostic as soon as it is reported
  private final Reporter listener;

  public DeclCompiler() { this(Reporter.SILENT); }

  public DeclCompiler(Reporter listener) { this.listener = listener; }

  public Result compile(String source) {
    // a fresh collector per source: nothing is carried over between runs
    Diagnostics diagnostics = new Diagnostics();
    Reporter reporter = Reporter.all(diagnostics, listener);

    List<Token> tokens = new Scanner(source, reporter).scanTokens();
    SyntaxNode tree = new TreeBuilder(tokens).build();
    LoweringResult lowering = new Lowering(reporter).lower(tree);
    String output = new JsonEmitter(reporter).emit(lowering.declarations);

    return new Result(tokens, tree, lowering, output, diagnostics.all());
  }
}
