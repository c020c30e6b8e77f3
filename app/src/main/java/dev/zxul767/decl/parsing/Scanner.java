package dev.zxul767.decl.parsing;

import static dev.zxul767.decl.parsing.TokenKind.*;

import dev.zxul767.decl.Diagnostic;
import dev.zxul767.decl.Reporter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class Scanner {
  public static final Map<String, TokenKind> keywords;
  static {
    keywords = new HashMap<>();
    keywords.put("let", LET);
    keywords.put("string", TYPE);
  }

  public static final Trie<TokenKind> operators = new Trie<TokenKind>()
                                                      .insert(":", COLON)
                                                      .insert("=", EQUAL)
                                                      .insert(";", SEMICOLON);

  // A sub-lexer either consumes at least one char starting at `start` and
  // adds a token, or returns false leaving the scanner state untouched.
  private interface SubLexer {
    boolean lex();
  }

  private final String sourceCode;
  private final Reporter reporter;
  private final List<Token> tokens = new ArrayList<>();
  // tried in this exact order: the operator trie has to be consulted before
  // anything else so punctuation is never misclassified
  private final List<SubLexer> subLexers = List.of(
      this::operator, this::whitespace, this::newline, this::identifier,
      this::string
  );
  // `start` & `current` index `sourceCode` and represent the bounds of the
  // token currently under examination.
  private int start = 0;
  private int current = 0;

  public Scanner(String sourceCode) { this(sourceCode, Reporter.SILENT); }

  public Scanner(String sourceCode, Reporter reporter) {
    this.sourceCode = sourceCode;
    this.reporter = reporter;
  }

  public List<Token> scanTokens() {
    while (!isAtEnd()) {
      start = current;
      scanToken();
    }
    return Collections.unmodifiableList(tokens);
  }

  private void scanToken() {
    for (SubLexer subLexer : subLexers) {
      if (subLexer.lex())
        return;
    }
    // nothing else recognizes this character, but we always make progress
    advance();
    addError(lexeme(), "Unexpected character: <" + lexeme() + ">.");
  }

  private boolean operator() {
    Optional<Trie.Match<TokenKind>> match =
        operators.longestMatch(sourceCode, current);
    if (match.isEmpty())
      return false;

    current += match.get().length;
    addToken(match.get().value);
    return true;
  }

  private boolean whitespace() {
    if (!isHorizontalWhitespace(peek()))
      return false;

    while (isHorizontalWhitespace(peek()))
      advance();
    addToken(WHITESPACE);
    return true;
  }

  private boolean newline() {
    if (peek() != '\n')
      return false;

    advance();
    addToken(NEWLINE);
    return true;
  }

  private boolean identifier() {
    if (!Character.isAlphabetic(peek()))
      return false;

    while (isIdentifierPart(peek()))
      advance();

    // keywords are only recognized once the whole run is known, so `letter`
    // is an identifier and not `let` followed by `ter`
    TokenKind kind = keywords.getOrDefault(lexeme(), IDENTIFIER);
    addToken(kind);
    return true;
  }

  private boolean string() {
    if (peek() != '"')
      return false;

    // the opening "
    advance();
    while (peek() != '"' && !isAtEnd())
      advance();

    if (isAtEnd()) {
      String content = sourceCode.substring(start + 1, current);
      addError(content, "Unterminated string.");
      return true;
    }
    // the closing "
    advance();

    // trim the surrounding quotes
    addToken(STRING_LITERAL, sourceCode.substring(start + 1, current - 1));
    return true;
  }

  // the Unicode White_Space property, minus `\n`: unlike
  // `Character.isWhitespace`, this includes no-break spaces and NEL and
  // excludes the information separators U+001C..U+001F
  private static boolean isHorizontalWhitespace(int c) {
    if (c == '\n' || c == -1)
      return false;
    return (c >= '\t' && c <= '\r') || c == 0x85 || Character.isSpaceChar(c);
  }

  // alphabetic or numeric in the Unicode sense (so `x²` is one identifier)
  private static boolean isIdentifierPart(int c) {
    if (c == '_' || Character.isAlphabetic(c))
      return true;
    switch (Character.getType(c)) {
    case Character.DECIMAL_DIGIT_NUMBER:
    case Character.LETTER_NUMBER:
    case Character.OTHER_NUMBER:
      return true;
    default:
      return false;
    }
  }

  // returns the code point to be consumed next, or -1 at the end of input
  private int peek() {
    if (isAtEnd())
      return -1;
    return sourceCode.codePointAt(current);
  }

  private boolean isAtEnd() { return current >= sourceCode.length(); }

  // consumes one code point (i.e., never splits a surrogate pair)
  private void advance() { current += Character.charCount(peek()); }

  private String lexeme() { return sourceCode.substring(start, current); }

  private void addToken(TokenKind kind) { addToken(kind, lexeme()); }

  private void addToken(TokenKind kind, String text) {
    tokens.add(new Token(kind, lexeme(), text, start));
  }

  private void addError(String text, String message) {
    addToken(ERROR, text);
    reporter.report(
        Diagnostic.error(Diagnostic.Kind.LEXICAL_ERROR, start, message)
    );
  }
}
