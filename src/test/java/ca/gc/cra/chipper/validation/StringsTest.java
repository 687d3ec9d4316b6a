package ca.gc.cra.chipper.validation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrimsAndRejectsBlank() {
    assertEquals("audit", Strings.requireNonBlank("handler name", "  audit "));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireNonBlank("handler name", "   "));
    assertTrue(ex.getMessage().startsWith("handler name"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("x", "a\u0001b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("x", null));
  }

  @Test
  void splitListDropsEmptyEntries() {
    assertArrayEquals(new String[] {"sql", "blog"}, Strings.splitList(" sql, ,blog ,"));
    assertArrayEquals(new String[0], Strings.splitList(null));
    assertArrayEquals(new String[0], Strings.splitList("  "));
  }
}
