package dev.zxul767.decl;

import static dev.zxul767.decl.parsing.TokenKind.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.decl.lowering.Declaration;
import dev.zxul767.decl.parsing.SyntaxNode;
import dev.zxul767.decl.parsing.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DeclCompilerTest {
  private static DeclCompiler.Result compile(String source) {
    return new DeclCompiler().compile(source);
  }

  @Test
  void canCompileADeclaration() {
    DeclCompiler.Result result = compile("let x: string = \"hi\";");

    assertThat(
        result.tokens.stream().map(t -> t.kind).collect(Collectors.toList()),
        contains(
            LET, WHITESPACE, IDENTIFIER, COLON, WHITESPACE, TYPE, WHITESPACE,
            EQUAL, WHITESPACE, STRING_LITERAL, SEMICOLON
        )
    );
    SyntaxNode declaration = result.tree.childNodes().get(0);
    assertEquals(VAR_DECL, declaration.kind);
    assertThat(
        result.lowering.declarations,
        contains(new Declaration("x", "string", "hi"))
    );
    assertEquals("{\n  \"x\": \"hi\",\n}", result.output);
    assertThat(result.diagnostics, is(empty()));
    assertFalse(result.hadError());
  }

  @Test
  void canCompileSeveralDeclarations() {
    DeclCompiler.Result result =
        compile("let a: string = \"1\"; let b: string = \"2\";");

    assertEquals(2, result.tree.childNodes().size());
    assertEquals("{\n  \"a\": \"1\",\n  \"b\": \"2\",\n}", result.output);
  }

  @Test
  void unterminatedStringIsReportedTwice() {
    DeclCompiler.Result result = compile("let x: string = \"oops");

    List<Token> errors = result.tokens.stream()
                             .filter(t -> t.kind == ERROR)
                             .collect(Collectors.toList());
    assertEquals(1, errors.size());
    assertEquals("oops", errors.get(0).text);

    assertThat(result.lowering.declarations, is(empty()));
    assertThat(result.lowering.failures.get(0).missing, contains(STRING_LITERAL));
    assertThat(
        result.diagnostics.stream().map(d -> d.kind).collect(Collectors.toList()),
        contains(Diagnostic.Kind.LEXICAL_ERROR, Diagnostic.Kind.MISSING_FIELD)
    );
    assertEquals("{\n}", result.output);
    assertTrue(result.hadError());
  }

  @Test
  void unsupportedTypeIsOnlyAWarning() {
    DeclCompiler.Result result = compile("let a: number = \"1\";");

    assertThat(
        result.lowering.declarations,
        contains(new Declaration("a", "number", "1"))
    );
    assertEquals("{\n  \"a\": \"1\",\n}", result.output);
    assertEquals(1, result.diagnostics.size());
    assertEquals(Diagnostic.Kind.UNSUPPORTED_TYPE, result.diagnostics.get(0).kind);
    assertFalse(result.hadError());
  }

  @Test
  void emptyValueIsOnlyAWarning() {
    DeclCompiler.Result result = compile("let e: string = \"\";");

    assertEquals("{\n  \"e\": \"\",\n}", result.output);
    assertEquals(Diagnostic.Kind.EMPTY_VALUE, result.diagnostics.get(0).kind);
    assertFalse(result.hadError());
  }

  @Test
  void badDeclarationsDontStopTheGoodOnes() {
    DeclCompiler.Result result = compile(
        "let a: string = \"1\";\nlet = \"2\";\nlet c: string = \"3\";\n"
    );
    assertEquals("{\n  \"a\": \"1\",\n  \"c\": \"3\",\n}", result.output);
    assertEquals(1, result.lowering.failures.size());
    assertTrue(result.hadError());
  }

  @Test
  void listenerSeesEveryDiagnostic() {
    List<Diagnostic> seen = new ArrayList<>();
    DeclCompiler.Result result =
        new DeclCompiler(seen::add).compile("let x: string = \"oops");
    assertEquals(result.diagnostics, seen);
  }

  @Test
  void compilationsDontShareState() {
    DeclCompiler compiler = new DeclCompiler();
    assertTrue(compiler.compile("@").hadError());
    assertFalse(compiler.compile("let x: string = \"hi\";").hadError());
  }

  @Test
  void neverCrashesOnRandomInput() {
    String[] fragments = {
        "let", "string", "number", "x", ":", "=", ";", "\"", "\"v\"", " ",
        "\n", "@", "_", "1",
    };
    Random random = new Random(7);
    for (int i = 0; i < 500; i++) {
      StringBuilder source = new StringBuilder();
      int length = random.nextInt(20);
      for (int j = 0; j < length; j++) {
        source.append(fragments[random.nextInt(fragments.length)]);
      }

      DeclCompiler.Result result = compile(source.toString());

      String lexemes =
          result.tokens.stream().map(t -> t.lexeme).collect(Collectors.joining());
      assertEquals(source.toString(), lexemes);
      assertEquals(
          result.tree.childNodes().size(),
          result.lowering.declarations.size() +
              result.lowering.failures.size()
      );
      assertThat(result.output, startsWith("{\n"));
      assertThat(result.output, endsWith("}"));
    }
  }
}
