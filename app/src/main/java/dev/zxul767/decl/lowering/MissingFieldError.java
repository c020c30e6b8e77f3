package dev.zxul767.decl.lowering;

import dev.zxul767.decl.parsing.SyntaxNode;
import dev.zxul767.decl.parsing.Token;
import dev.zxul767.decl.parsing.TokenKind;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

// Raised when a VAR_DECL node can't be lowered because it lacks its name,
// its type or its value.
public class MissingFieldError extends RuntimeException {
  // position of the declaration among its siblings under ROOT
  public final int index;
  public final SyntaxNode declaration;
  public final List<TokenKind> missing;

  public MissingFieldError(
      int index, SyntaxNode declaration, List<TokenKind> missing
  ) {
    super(describe(index, missing));
    this.index = index;
    this.declaration = declaration;
    this.missing = Collections.unmodifiableList(missing);
  }

  // offset of the `let` keyword that starts the declaration
  public int offset() {
    List<Token> tokens = declaration.tokens();
    return tokens.isEmpty() ? 0 : tokens.get(0).offset;
  }

  private static String describe(int index, List<TokenKind> missing) {
    String fields = missing.stream()
                        .map(MissingFieldError::fieldName)
                        .collect(Collectors.joining(", "));
    return String.format("Declaration #%d is missing: %s.", index + 1, fields);
  }

  static String fieldName(TokenKind kind) {
    switch (kind) {
    case IDENTIFIER:
      return "name";
    case TYPE:
      return "type";
    case STRING_LITERAL:
      return "value";
    default:
      throw new IllegalArgumentException(
          String.format("%s is not a declaration field", kind)
      );
    }
  }
}
