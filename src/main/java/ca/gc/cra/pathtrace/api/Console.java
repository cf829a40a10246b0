package ca.gc.cra.pathtrace.api;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Standard output of the commands: help and usage text, run summaries and reports.
 *
 * <p>Log output goes to standard error (see {@code logback.xml}), so anything printed here can be piped,
 * for example {@code view action=map | dot -Tsvg}.</p>
 *
 * @since 0.1.0
 */
final class Console {
  private static final PrintWriter STANDARD_OUT =
      new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> CAPTURE = new AtomicReference<>();

  private Console() {}

  static PrintWriter out() {
    PrintWriter captured = CAPTURE.get();
    return captured != null ? captured : STANDARD_OUT;
  }

  static void line(String text) {
    out().println(text);
  }

  static void lines(String... lines) {
    PrintWriter out = out();
    for (String line : lines) {
      out.println(line);
    }
    out.flush();
  }

  /** Prints a text block without the trailing newline its literal ends with. */
  static void help(String text) {
    line(text.stripTrailing());
  }

  static void capture(PrintWriter writer) {
    CAPTURE.set(writer);
  }

  static void release() {
    CAPTURE.set(null);
  }
}
