package dev.zxul767.decl.parsing;

import java.util.Objects;

public class Token {
  // `Token` is just an immutable data structure with no behavior so it's
  // okay for its fields to be public
  public final TokenKind kind;
  // the exact slice of source code consumed by the scanner
  public final String lexeme;
  // the content of the token: same as `lexeme` except for string literals,
  // which don't include their delimiting quotes
  public final String text;
  // character offset of the first char of `lexeme` in the source code
  public final int offset;

  public Token(TokenKind kind, String lexeme, String text, int offset) {
    if (kind.isStructural()) {
      throw new IllegalArgumentException(
          String.format("%s is not a lexical token kind", kind)
      );
    }
    this.kind = kind;
    this.lexeme = Objects.requireNonNull(lexeme);
    this.text = Objects.requireNonNull(text);
    this.offset = offset;
  }

  public Token(TokenKind kind, String lexeme, int offset) {
    this(kind, lexeme, /* text: */ lexeme, offset);
  }

  // returns a new token of a different kind over the same source slice
  public Token withKind(TokenKind newKind) {
    return new Token(newKind, lexeme, text, offset);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Token))
      return false;
    Token that = (Token)other;
    return kind == that.kind && offset == that.offset &&
        lexeme.equals(that.lexeme) && text.equals(that.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, lexeme, text, offset);
  }

  @Override
  public String toString() {
    return String.format("%s: \"%s\"", kind.displayName(), text);
  }
}
