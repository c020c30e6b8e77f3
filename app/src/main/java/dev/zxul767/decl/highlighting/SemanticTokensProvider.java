package dev.zxul767.decl.highlighting;

import dev.zxul767.decl.parsing.Scanner;
import dev.zxul767.decl.parsing.SyntaxNode;
import dev.zxul767.decl.parsing.Token;
import dev.zxul767.decl.parsing.TokenKind;
import dev.zxul767.decl.parsing.TreeBuilder;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

// Computes the semantic tokens of a whole document from its token stream.
// Lines and columns are counted in UTF-16 code units, the default encoding
// of editor positions.
public class SemanticTokensProvider {
  public List<SemanticToken> provide(String source) {
    return provide(new Scanner(source).scanTokens());
  }

  public List<SemanticToken> provide(List<Token> tokens) {
    Set<Integer> typeOffsets = typeOffsets(tokens);

    List<SemanticToken> result = new ArrayList<>();
    int line = 0;
    int column = 0;
    int previousLine = 0;
    int previousStart = 0;

    for (Token token : tokens) {
      TokenKind kind =
          typeOffsets.contains(token.offset) ? TokenKind.TYPE : token.kind;
      Optional<SemanticTokenType> type = SemanticTokenType.of(kind);
      if (type.isPresent()) {
        int deltaLine = line - previousLine;
        int deltaStart = deltaLine == 0 ? column - previousStart : column;
        result.add(new SemanticToken(
            deltaLine, deltaStart, token.lexeme.length(), type.get()
        ));
        previousLine = line;
        previousStart = column;
      }

      // newlines may also hide inside string literals
      for (int i = 0; i < token.lexeme.length(); i++) {
        if (token.lexeme.charAt(i) == '\n') {
          line++;
          column = 0;
        } else {
          column++;
        }
      }
    }
    return result;
  }

  // user type names (e.g., `number`) scan as identifiers and only become
  // TYPE tokens in the tree, so their offsets are looked up there
  static Set<Integer> typeOffsets(List<Token> tokens) {
    SyntaxNode root = new TreeBuilder(tokens).build();
    Set<Integer> offsets = new HashSet<>();
    for (SyntaxNode declaration : root.childNodes()) {
      declaration.firstToken(TokenKind.TYPE).ifPresent(t -> offsets.add(t.offset));
    }
    return offsets;
  }

  // flattens `tokens` into the integer array sent to editors
  public static int[] encode(List<SemanticToken> tokens) {
    int[] data = new int[tokens.size() * 5];
    for (int i = 0; i < tokens.size(); i++) {
      System.arraycopy(tokens.get(i).encode(), 0, data, i * 5, 5);
    }
    return data;
  }
}
