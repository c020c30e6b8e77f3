package dev.zxul767.decl.parsing;

import static dev.zxul767.decl.parsing.TokenKind.*;

import java.util.ArrayList;
import java.util.List;

// Groups a flat token stream into a ROOT node holding one VAR_DECL node per
// `let` declaration.
//
// The grammar is deliberately permissive: every part of a declaration after
// `let` is optional, so a partial declaration still yields a VAR_DECL with
// whatever was there. Judging whether a declaration is complete is left to
// lowering.
public class TreeBuilder {
  // varDecl -> "let" IDENTIFIER? ":"? TYPE? "="? STRING_LITERAL? ";"?
  private static final TokenKind[] declarationShape = {
      IDENTIFIER, COLON, TYPE, EQUAL, STRING_LITERAL, SEMICOLON
  };

  private final List<Token> tokens;
  // indexes the token currently being looked at
  private int current = 0;

  public TreeBuilder(List<Token> tokens) { this.tokens = tokens; }

  public SyntaxNode build() {
    List<SyntaxElement> declarations = new ArrayList<>();
    while (match(LET)) {
      declarations.add(SyntaxElement.of(varDeclaration()));
    }
    // anything left from here on is not part of the tree
    return new SyntaxNode(ROOT, declarations);
  }

  // pre-condition: the `let` keyword has just been consumed
  private SyntaxNode varDeclaration() {
    List<SyntaxElement> children = new ArrayList<>();
    children.add(SyntaxElement.of(previous()));

    for (TokenKind expected : declarationShape) {
      if (match(expected)) {
        children.add(SyntaxElement.of(previous()));
      } else if (expected == TYPE && lastKind(children) == COLON &&
                 match(IDENTIFIER)) {
        // a user type name (e.g., `number`) scans as an identifier; right
        // after a colon it can only be a type
        children.add(SyntaxElement.of(previous().withKind(TYPE)));
      }
    }
    return new SyntaxNode(VAR_DECL, children);
  }

  private static TokenKind lastKind(List<SyntaxElement> children) {
    SyntaxElement last = children.get(children.size() - 1);
    return ((SyntaxElement.TokenElement)last).token.kind;
  }

  // consumes the next significant token (and any trivia before it) only if
  // it is of the `expected` kind
  private boolean match(TokenKind expected) {
    int next = skipTrivia(current);
    if (next < tokens.size() && tokens.get(next).kind == expected) {
      current = next + 1;
      return true;
    }
    return false;
  }

  // returns the index of the first non-trivia token at or after `index`
  private int skipTrivia(int index) {
    while (index < tokens.size() && tokens.get(index).kind.isTrivia())
      index++;
    return index;
  }

  private Token previous() { return tokens.get(current - 1); }
}
