package dev.zxul767.decl;

import dev.zxul767.decl.highlighting.TokenHighlighter;
import dev.zxul767.decl.parsing.Scanner;
import dev.zxul767.decl.parsing.Token;
import dev.zxul767.decl.parsing.TreePrinter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.stream.Collectors;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

public class Decl {
  static final String USAGE = "Usage: decl [--tokens | --tree | --json] [script]";

  enum Mode {
    TOKENS("--tokens"),
    TREE("--tree"),
    JSON("--json");

    final String flag;

    Mode(String flag) { this.flag = flag; }
  }

  static class UsageError extends RuntimeException {
    UsageError(String message) { super(message); }
  }

  static class Options {
    final Mode mode;
    // null when running the REPL
    final String scriptPath;

    Options(Mode mode, String scriptPath) {
      this.mode = mode;
      this.scriptPath = scriptPath;
    }
  }

  public static void main(String[] args) throws IOException {
    Options options;
    try {
      options = parseArgs(args);
    } catch (UsageError e) {
      System.out.println(e.getMessage());
      System.out.println(USAGE);
      System.exit(64);
      return;
    }

    if (options.scriptPath != null) {
      runFile(options);
    } else {
      runPrompt(options.mode);
    }
  }

  static Options parseArgs(String[] args) {
    Mode mode = Mode.JSON;
    String scriptPath = null;
    for (String arg : args) {
      if (arg.startsWith("--")) {
        mode = modeOf(arg);
      } else if (scriptPath == null) {
        scriptPath = arg;
      } else {
        throw new UsageError("Too many scripts: only one can be compiled.");
      }
    }
    return new Options(mode, scriptPath);
  }

  private static Mode modeOf(String flag) {
    for (Mode mode : Mode.values()) {
      if (mode.flag.equals(flag))
        return mode;
    }
    throw new UsageError(String.format("Unknown option: %s", flag));
  }

  private static void runFile(Options options) throws IOException {
    byte[] bytes = Files.readAllBytes(Paths.get(options.scriptPath));
    boolean hadError =
        run(new String(bytes, StandardCharsets.UTF_8), options.mode);
    if (hadError)
      System.exit(65);
  }

  private static void runPrompt(Mode mode) throws IOException {
    Terminal terminal = TerminalBuilder.builder().build();
    showBannerAndHelp(terminal);
    // keep diagnostics and output in the same channel so they don't get
    // interleaved with the prompt
    System.setErr(System.out);

    LineReader reader = createReplReader(terminal);
    while (true) {
      try {
        String line = reader.readLine(">>> ").trim();
        if (line.equals("quit"))
          break;
        if (line.isEmpty())
          continue;

        // every line is compiled on its own; a bad one doesn't end the session
        run(line, mode);
        System.out.println();

      } catch (UserInterruptException e) {
        break;
      } catch (EndOfFileException e) {
        break;
      }
    }
  }

  // returns true if any error was reported while compiling `source`
  private static boolean run(String source, Mode mode) {
    DeclCompiler compiler = new DeclCompiler(new ConsoleReporter());
    DeclCompiler.Result result = compiler.compile(source);
    System.out.println(render(result, mode));
    return result.hadError();
  }

  static String render(DeclCompiler.Result result, Mode mode) {
    switch (mode) {
    case TOKENS:
      return result.tokens.stream()
          .map(Token::toString)
          .collect(Collectors.joining("\n"));
    case TREE:
      return new TreePrinter().print(result.tree);
    default:
      return result.output;
    }
  }

  private static void showBannerAndHelp(Terminal terminal) {
    String logo =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append("Welcome to the decl REPL.")
            .style(AttributedStyle.DEFAULT)
            .toAnsi();
    terminal.writer().println(logo);

    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println("- Use «tab» for word completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    // provide completions (triggered via TAB) for all keywords
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit"),
        new StringsCompleter(Scanner.keywords.keySet())
    );

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(new DefaultParser())
        .completer(completer)
        .highlighter(new TokenHighlighter())
        .build();
  }
}
