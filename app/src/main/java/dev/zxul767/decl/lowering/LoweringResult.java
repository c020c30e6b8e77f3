package dev.zxul767.decl.lowering;

import java.util.Collections;
import java.util.List;

public class LoweringResult {
  // successfully lowered declarations, in source order
  public final List<Declaration> declarations;
  // one entry per declaration that couldn't be lowered, in source order
  public final List<MissingFieldError> failures;

  LoweringResult(List<Declaration> declarations, List<MissingFieldError> failures) {
    this.declarations = Collections.unmodifiableList(declarations);
    this.failures = Collections.unmodifiableList(failures);
  }

  public boolean hasFailures() { return !failures.isEmpty(); }
}
