package dev.zxul767.decl.highlighting;

import java.util.Objects;

// One entry of a delta-encoded semantic tokens array.
public class SemanticToken {
  // lines since the previous entry
  public final int deltaLine;
  // columns since the previous entry's start if on the same line, otherwise
  // the absolute column
  public final int deltaStart;
  public final int length;
  public final SemanticTokenType type;
  public final int modifiers;

  public SemanticToken(
      int deltaLine, int deltaStart, int length, SemanticTokenType type
  ) {
    this.deltaLine = deltaLine;
    this.deltaStart = deltaStart;
    this.length = length;
    this.type = Objects.requireNonNull(type);
    this.modifiers = 0;
  }

  // the five integers this entry contributes to the wire format
  public int[] encode() {
    return new int[] {deltaLine, deltaStart, length, type.index(), modifiers};
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof SemanticToken))
      return false;
    SemanticToken that = (SemanticToken)other;
    return deltaLine == that.deltaLine && deltaStart == that.deltaStart &&
        length == that.length && type == that.type &&
        modifiers == that.modifiers;
  }

  @Override
  public int hashCode() {
    return Objects.hash(deltaLine, deltaStart, length, type, modifiers);
  }

  @Override
  public String toString() {
    return String.format(
        "[%d, %d, %d, %s]", deltaLine, deltaStart, length, type.legendName
    );
  }
}
