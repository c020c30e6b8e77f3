package dev.zxul767.decl.parsing;

public enum TokenKind {
  // lexical kinds
  LET,
  IDENTIFIER,
  COLON,
  TYPE,
  EQUAL,
  STRING_LITERAL,
  SEMICOLON,
  WHITESPACE,
  NEWLINE,
  ERROR,

  // structural kinds: only ever found in syntax nodes, never in the
  // token stream produced by the scanner
  ROOT,
  VAR_DECL;

  public boolean isStructural() { return this == ROOT || this == VAR_DECL; }

  public boolean isTrivia() { return this == WHITESPACE || this == NEWLINE; }

  // e.g., STRING_LITERAL -> STRINGLITERAL
  public String displayName() { return name().replace("_", ""); }
}
