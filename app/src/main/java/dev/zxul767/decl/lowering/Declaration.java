package dev.zxul767.decl.lowering;

import java.util.Objects;

public class Declaration {
  public final String name;
  public final String typeName;
  public final String value;

  public Declaration(String name, String typeName, String value) {
    this.name = Objects.requireNonNull(name);
    this.typeName = Objects.requireNonNull(typeName);
    this.value = Objects.requireNonNull(value);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Declaration))
      return false;
    Declaration that = (Declaration)other;
    return name.equals(that.name) && typeName.equals(that.typeName) &&
        value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, typeName, value);
  }

  @Override
  public String toString() {
    return String.format(
        "Declaration(name=%s, type=%s, value=\"%s\")", name, typeName, value
    );
  }
}
