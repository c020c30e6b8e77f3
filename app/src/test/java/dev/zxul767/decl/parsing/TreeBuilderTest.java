package dev.zxul767.decl.parsing;

import static dev.zxul767.decl.parsing.TokenKind.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TreeBuilderTest {
  static SyntaxNode build(String source) {
    return new TreeBuilder(new Scanner(source).scanTokens()).build();
  }

  private static List<TokenKind> kinds(SyntaxNode node) {
    return node.tokens().stream().map(t -> t.kind).collect(Collectors.toList());
  }

  @Test
  void canBuildASingleDeclaration() {
    SyntaxNode root = build("let x: string = \"hi\";");

    assertEquals(ROOT, root.kind);
    assertEquals(1, root.children.size());

    SyntaxNode declaration = root.childNodes().get(0);
    assertEquals(VAR_DECL, declaration.kind);
    assertThat(
        kinds(declaration),
        contains(LET, IDENTIFIER, COLON, TYPE, EQUAL, STRING_LITERAL, SEMICOLON)
    );
    assertThat(
        declaration.tokens().stream().map(t -> t.text).collect(Collectors.toList()),
        contains("let", "x", ":", "string", "=", "hi", ";")
    );
  }

  @Test
  void declarationsKeepTheirSourceOrder() {
    SyntaxNode root =
        build("let a: string = \"1\";\nlet b: string = \"2\";\n");

    List<SyntaxNode> declarations = root.childNodes();
    assertEquals(2, declarations.size());
    assertEquals("a", declarations.get(0).firstToken(IDENTIFIER).get().text);
    assertEquals("b", declarations.get(1).firstToken(IDENTIFIER).get().text);
  }

  @Test
  void whitespaceIsNeverPartOfTheTree() {
    SyntaxNode root = build("  let\n x :string=\"hi\"  ;  ");
    SyntaxNode declaration = root.childNodes().get(0);

    assertThat(
        kinds(declaration),
        contains(LET, IDENTIFIER, COLON, TYPE, EQUAL, STRING_LITERAL, SEMICOLON)
    );
    assertEquals("letx:string=\"hi\";", root.text());
  }

  @Test
  void missingPartsDontAbortTheDeclaration() {
    SyntaxNode declaration = build("let x = \"hi\"").childNodes().get(0);
    assertThat(kinds(declaration), contains(LET, IDENTIFIER, EQUAL, STRING_LITERAL));

    declaration = build("let").childNodes().get(0);
    assertThat(kinds(declaration), contains(LET));
  }

  @Test
  void partsAreNeverTakenOutOfOrder() {
    // once past the colon, an `=` can't be followed by a late colon
    SyntaxNode root = build("let x = : string;");
    SyntaxNode declaration = root.childNodes().get(0);

    assertThat(kinds(declaration), contains(LET, IDENTIFIER, EQUAL));
    assertEquals(1, root.childNodes().size());
  }

  @Test
  void unterminatedStringIsLeftOutOfTheDeclaration() {
    SyntaxNode declaration =
        build("let x: string = \"oops").childNodes().get(0);
    assertThat(kinds(declaration), contains(LET, IDENTIFIER, COLON, TYPE, EQUAL));
  }

  @Test
  void identifierAfterColonIsATypeName() {
    SyntaxNode declaration =
        build("let a: number = \"1\";").childNodes().get(0);

    assertThat(
        kinds(declaration),
        contains(LET, IDENTIFIER, COLON, TYPE, EQUAL, STRING_LITERAL, SEMICOLON)
    );
    Token type = declaration.firstToken(TYPE).get();
    assertEquals("number", type.text);
    assertEquals(7, type.offset);
  }

  @Test
  void identifierWithoutColonIsNotATypeName() {
    SyntaxNode root = build("let a number = \"1\";");
    assertThat(kinds(root.childNodes().get(0)), contains(LET, IDENTIFIER));
  }

  @Test
  void stopsAtTheFirstTokenThatIsNotLet() {
    SyntaxNode root =
        build("let a: string = \"1\"; oops let b: string = \"2\";");
    assertEquals(1, root.childNodes().size());

    assertThat(build("x let a: string = \"1\";").children, is(empty()));
    assertThat(build("").children, is(empty()));
  }

  @Test
  void consecutiveLetsOpenSeparateDeclarations() {
    SyntaxNode root = build("let let x: string = \"1\";");
    assertEquals(2, root.childNodes().size());
    assertThat(kinds(root.childNodes().get(0)), contains(LET));
  }

  @Test
  void treesAreImmutable() {
    SyntaxNode root = build("let x: string = \"hi\";");
    assertThrows(
        UnsupportedOperationException.class, () -> root.children.clear()
    );
  }

  @Test
  void syntaxElementsAreEitherTokensOrNodes() {
    SyntaxNode root = build("let x: string = \"hi\";");
    SyntaxElement.Visitor<String> describer =
        new SyntaxElement.Visitor<String>() {
          @Override
          public String visitToken(Token token) {
            return "token";
          }

          @Override
          public String visitNode(SyntaxNode node) {
            return "node";
          }
        };

    assertEquals("node", root.children.get(0).accept(describer));
    SyntaxNode declaration = root.childNodes().get(0);
    assertEquals("token", declaration.children.get(0).accept(describer));
    assertThat(declaration.childNodes(), is(empty()));
  }
}
