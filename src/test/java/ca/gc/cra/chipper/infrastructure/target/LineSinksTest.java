package ca.gc.cra.chipper.infrastructure.target;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LineSinksTest {
  @TempDir
  Path tempDir;

  @Test
  void sameFileResolvesToSharedSink() {
    Path file = tempDir.resolve("shared.log");

    assertSame(LineSinks.file(file), LineSinks.file(tempDir.resolve("./x/../shared.log")));
    assertNotSame(LineSinks.file(file), LineSinks.file(tempDir.resolve("other.log")));
  }

  @Test
  void closeFilesFlushesAndAllowsReopen() throws Exception {
    Path file = tempDir.resolve("reopen.log");
    LineSinks.file(file).write("a\n");
    LineSinks.closeFiles();
    LineSinks.file(file).write("b\n");
    LineSinks.closeFiles();

    assertEquals("a\nb\n", Files.readString(file));
  }

  @Test
  void stdoutSinkHonoursRedirection() throws Exception {
    PrintStream original = System.out;
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    try {
      LineSinks.stdout().write("hello\n");
    } finally {
      System.setOut(original);
    }

    assertEquals("hello\n", buffer.toString(StandardCharsets.UTF_8));
    assertEquals("stdout", LineSinks.stdout().describe());
    assertEquals("stderr", LineSinks.stderr().describe());
  }
}
