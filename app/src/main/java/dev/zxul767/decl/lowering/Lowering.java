package dev.zxul767.decl.lowering;

import static dev.zxul767.decl.parsing.TokenKind.*;

import dev.zxul767.decl.Diagnostic;
import dev.zxul767.decl.Reporter;
import dev.zxul767.decl.parsing.SyntaxNode;
import dev.zxul767.decl.parsing.Token;
import dev.zxul767.decl.parsing.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

// Turns the VAR_DECL nodes of a syntax tree into `Declaration`s.
public class Lowering {
  private final Reporter reporter;

  public Lowering() { this(Reporter.SILENT); }

  public Lowering(Reporter reporter) { this.reporter = reporter; }

  // Lowers every declaration under `root`. A declaration that can't be
  // lowered is reported and left out, but never stops the others.
  public LoweringResult lower(SyntaxNode root) {
    List<Declaration> declarations = new ArrayList<>();
    List<MissingFieldError> failures = new ArrayList<>();

    List<SyntaxNode> nodes = root.childNodes();
    for (int i = 0; i < nodes.size(); i++) {
      SyntaxNode node = nodes.get(i);
      if (node.kind != VAR_DECL)
        continue;
      try {
        declarations.add(lowerDeclaration(i, node));
      } catch (MissingFieldError error) {
        failures.add(error);
        reporter.report(Diagnostic.error(
            Diagnostic.Kind.MISSING_FIELD, error.offset(), error.getMessage()
        ));
      }
    }
    return new LoweringResult(declarations, failures);
  }

  // throws MissingFieldError if `node` lacks its name, type or value
  public static Declaration lowerDeclaration(int index, SyntaxNode node) {
    Optional<Token> name = node.firstToken(IDENTIFIER);
    Optional<Token> type = node.firstToken(TYPE);
    Optional<Token> value = node.firstToken(STRING_LITERAL);

    List<TokenKind> missing = new ArrayList<>();
    if (name.isEmpty())
      missing.add(IDENTIFIER);
    if (type.isEmpty())
      missing.add(TYPE);
    if (value.isEmpty())
      missing.add(STRING_LITERAL);
    if (!missing.isEmpty())
      throw new MissingFieldError(index, node, missing);

    return new Declaration(name.get().text, type.get().text, value.get().text);
  }
}
