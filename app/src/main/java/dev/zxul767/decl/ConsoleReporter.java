package dev.zxul767.decl;

import java.io.PrintStream;

public class ConsoleReporter implements Reporter {
  private final PrintStream stream;

  public ConsoleReporter() { this(System.err); }

  public ConsoleReporter(PrintStream stream) { this.stream = stream; }

  @Override
  public void report(Diagnostic diagnostic) {
    stream.println(diagnostic);
    stream.flush();
  }
}
