package dev.zxul767.decl.highlighting;

import dev.zxul767.decl.parsing.Scanner;
import dev.zxul767.decl.parsing.Token;
import dev.zxul767.decl.parsing.TokenKind;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jline.reader.Highlighter;
import org.jline.reader.LineReader;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

// Colors the REPL input line as it is being typed.
public class TokenHighlighter implements Highlighter {
  @Override
  public AttributedString highlight(LineReader reader, String buffer) {
    AttributedStringBuilder builder = new AttributedStringBuilder();
    List<Token> tokens = new Scanner(buffer).scanTokens();
    Set<Integer> typeOffsets = SemanticTokensProvider.typeOffsets(tokens);
    // scanning is lossless, so appending every lexeme rebuilds `buffer`
    for (Token token : tokens) {
      TokenKind kind =
          typeOffsets.contains(token.offset) ? TokenKind.TYPE : token.kind;
      builder.styled(styleOf(kind), token.lexeme);
    }
    return builder.toAttributedString();
  }

  @Override
  public void setErrorPattern(Pattern errorPattern) {}

  @Override
  public void setErrorIndex(int errorIndex) {}

  static AttributedStyle styleOf(TokenKind kind) {
    if (kind == TokenKind.ERROR)
      return AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);

    return SemanticTokenType.of(kind)
        .map(TokenHighlighter::styleOfType)
        .orElse(AttributedStyle.DEFAULT);
  }

  private static AttributedStyle styleOfType(SemanticTokenType type) {
    switch (type) {
    case KEYWORD:
      return AttributedStyle.BOLD.foreground(AttributedStyle.MAGENTA);
    case TYPE:
      return AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN);
    case STRING:
      return AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN);
    default:
      return AttributedStyle.DEFAULT;
    }
  }
}
