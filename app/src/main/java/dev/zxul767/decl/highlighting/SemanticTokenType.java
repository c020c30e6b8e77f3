package dev.zxul767.decl.highlighting;

import dev.zxul767.decl.parsing.TokenKind;
import java.util.Optional;

// The token types advertised to editors, in legend order.
public enum SemanticTokenType {
  KEYWORD("keyword"),
  VARIABLE("variable"),
  TYPE("type"),
  STRING("string");

  public final String legendName;

  SemanticTokenType(String legendName) { this.legendName = legendName; }

  // position in the legend, which is what gets sent over the wire
  public int index() { return ordinal(); }

  // empty for kinds that aren't highlighted (punctuation, trivia, errors)
  public static Optional<SemanticTokenType> of(TokenKind kind) {
    switch (kind) {
    case LET:
      return Optional.of(KEYWORD);
    case IDENTIFIER:
      return Optional.of(VARIABLE);
    case TYPE:
      return Optional.of(TYPE);
    case STRING_LITERAL:
      return Optional.of(STRING);
    default:
      return Optional.empty();
    }
  }
}
