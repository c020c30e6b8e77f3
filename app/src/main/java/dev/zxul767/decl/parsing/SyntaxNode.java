package dev.zxul767.decl.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class SyntaxNode {
  public final TokenKind kind;
  // unmodifiable: nodes are never edited once built
  public final List<SyntaxElement> children;

  public SyntaxNode(TokenKind kind, List<SyntaxElement> children) {
    if (!kind.isStructural()) {
      throw new IllegalArgumentException(
          String.format("%s is not a structural kind", kind)
      );
    }
    this.kind = kind;
    this.children = Collections.unmodifiableList(new ArrayList<>(children));
  }

  // direct token children, in order
  public List<Token> tokens() {
    List<Token> result = new ArrayList<>();
    for (SyntaxElement child : children) {
      if (child instanceof SyntaxElement.TokenElement)
        result.add(((SyntaxElement.TokenElement)child).token);
    }
    return result;
  }

  // direct node children, in order
  public List<SyntaxNode> childNodes() {
    List<SyntaxNode> result = new ArrayList<>();
    for (SyntaxElement child : children) {
      if (child instanceof SyntaxElement.NodeElement)
        result.add(((SyntaxElement.NodeElement)child).node);
    }
    return result;
  }

  // the first direct token child of the given kind
  public Optional<Token> firstToken(TokenKind tokenKind) {
    return tokens().stream().filter(t -> t.kind == tokenKind).findFirst();
  }

  // concatenated lexemes of every token below this node
  public String text() {
    StringBuilder builder = new StringBuilder();
    for (SyntaxElement child : children) {
      builder.append(child.accept(new SyntaxElement.Visitor<String>() {
        @Override
        public String visitToken(Token token) {
          return token.lexeme;
        }

        @Override
        public String visitNode(SyntaxNode node) {
          return node.text();
        }
      }));
    }
    return builder.toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof SyntaxNode))
      return false;
    SyntaxNode that = (SyntaxNode)other;
    return kind == that.kind && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, children);
  }

  @Override
  public String toString() {
    return new TreePrinter().print(this);
  }
}
