package dev.zxul767.decl;

import java.util.Objects;

public class Diagnostic {
  public enum Severity { ERROR, WARNING }

  public enum Kind {
    // an unrecognized character or an unterminated string literal
    LEXICAL_ERROR,
    // a declaration lacking its name, type or value
    MISSING_FIELD,
    UNSUPPORTED_TYPE,
    EMPTY_VALUE
  }

  // for diagnostics that aren't tied to a place in the source code
  public static final int NO_OFFSET = -1;

  public final Severity severity;
  public final Kind kind;
  // character offset in the source code the diagnostic refers to
  public final int offset;
  public final String message;

  public Diagnostic(Severity severity, Kind kind, int offset, String message) {
    this.severity = Objects.requireNonNull(severity);
    this.kind = Objects.requireNonNull(kind);
    this.offset = offset;
    this.message = Objects.requireNonNull(message);
  }

  public static Diagnostic error(Kind kind, int offset, String message) {
    return new Diagnostic(Severity.ERROR, kind, offset, message);
  }

  public static Diagnostic warning(Kind kind, int offset, String message) {
    return new Diagnostic(Severity.WARNING, kind, offset, message);
  }

  public boolean isError() { return severity == Severity.ERROR; }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Diagnostic))
      return false;
    Diagnostic that = (Diagnostic)other;
    return severity == that.severity && kind == that.kind &&
        offset == that.offset && message.equals(that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(severity, kind, offset, message);
  }

  @Override
  public String toString() {
    String label = severity == Severity.ERROR ? "Error" : "Warning";
    if (offset == NO_OFFSET)
      return String.format("%s: %s", label, message);
    return String.format("%s: [offset %d] %s", label, offset, message);
  }
}
