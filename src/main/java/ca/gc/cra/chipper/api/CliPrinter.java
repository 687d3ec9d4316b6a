package ca.gc.cra.chipper.api;

import java.io.PrintWriter;

/**
 * Console output for usage text and rendered lines.
 * <p>Resolves {@code System.out} on each call so redirection after class loading is honoured; tests install their
 * own writer instead.</p>
 */
final class CliPrinter {
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  static void println(String message) {
    PrintWriter writer = writer();
    writer.println(message);
    writer.flush();
  }

  /**
   * Prints text as-is; rendered lines already end with a newline.
   *
   * @param text text to print
   */
  static void print(String text) {
    PrintWriter writer = writer();
    writer.print(text);
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : new PrintWriter(System.out, false);
  }
}
