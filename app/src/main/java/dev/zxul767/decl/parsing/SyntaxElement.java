package dev.zxul767.decl.parsing;

import java.util.Objects;

// A child of a syntax node: either a token (a leaf) or another node.
//
// The constructor is private so `TokenElement` and `NodeElement` are the
// only two cases; use a `Visitor` to tell them apart.
public abstract class SyntaxElement {
  public interface Visitor<R> {
    R visitToken(Token token);
    R visitNode(SyntaxNode node);
  }

  private SyntaxElement() {}

  public abstract <R> R accept(Visitor<R> visitor);

  public static SyntaxElement of(Token token) { return new TokenElement(token); }

  public static SyntaxElement of(SyntaxNode node) {
    return new NodeElement(node);
  }

  public static final class TokenElement extends SyntaxElement {
    public final Token token;

    private TokenElement(Token token) { this.token = Objects.requireNonNull(token); }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitToken(token);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof TokenElement &&
          token.equals(((TokenElement)other).token);
    }

    @Override
    public int hashCode() {
      return token.hashCode();
    }

    @Override
    public String toString() {
      return token.toString();
    }
  }

  public static final class NodeElement extends SyntaxElement {
    public final SyntaxNode node;

    private NodeElement(SyntaxNode node) { this.node = Objects.requireNonNull(node); }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNode(node);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof NodeElement &&
          node.equals(((NodeElement)other).node);
    }

    @Override
    public int hashCode() {
      return node.hashCode();
    }

    @Override
    public String toString() {
      return node.toString();
    }
  }
}
