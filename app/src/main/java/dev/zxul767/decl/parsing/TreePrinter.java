package dev.zxul767.decl.parsing;

// Renders a syntax tree as an s-expression, e.g.:
//
//   (ROOT (VARDECL let x : string = "hi" ;))
public class TreePrinter implements SyntaxElement.Visitor<String> {
  public String print(SyntaxNode node) { return visitNode(node); }

  @Override
  public String visitToken(Token token) {
    return token.lexeme;
  }

  @Override
  public String visitNode(SyntaxNode node) {
    StringBuilder builder = new StringBuilder();

    builder.append("(").append(node.kind.displayName());
    for (SyntaxElement child : node.children) {
      builder.append(" ");
      builder.append(child.accept(this));
    }
    builder.append(")");

    return builder.toString();
  }
}
