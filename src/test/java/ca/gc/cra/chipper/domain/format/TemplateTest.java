package ca.gc.cra.chipper.domain.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TemplateTest {

  @Test
  void substitutesNamedPlaceholders() {
    Template template = Template.compile("[{date} {time}]");

    assertEquals("[2024-03-05 14:07:09]", template.render(Map.of("date", "2024-03-05", "time", "14:07:09")));
    assertEquals(Set.of("date", "time"), template.placeholders());
  }

  @Test
  void doubledBracesRenderAsLiterals() {
    Template template = Template.compile("{{{tag}}}");

    assertEquals("{INFO}", template.render(Map.of("tag", "INFO")));
  }

  @Test
  void templateWithoutPlaceholdersIsLiteral() {
    assertEquals(" :: ", Template.compile(" :: ").render(Map.of()));
    assertEquals("", Template.compile("").render(Map.of()));
  }

  @Test
  void unknownPlaceholderFailsAtRender() {
    Template template = Template.compile("{tags}{severity}");

    TemplateException ex = assertThrows(TemplateException.class, () -> template.render(Map.of("tags", "x")));
    assertTrue(ex.getMessage().contains("{severity}"));
  }

  @Test
  void optionalPlaceholdersRenderEmptyWhenAbsent() {
    Template template = Template.compile("{datetime}{trace}{tags}");

    assertEquals("AB", template.render(Map.of("datetime", "A", "tags", "B"), Set.of("trace")));
  }

  @Test
  void malformedTemplatesFailAtCompile() {
    assertThrows(TemplateException.class, () -> Template.compile("{tags"));
    assertThrows(TemplateException.class, () -> Template.compile("tags}"));
    assertThrows(TemplateException.class, () -> Template.compile("{}"));
    assertThrows(TemplateException.class, () -> Template.compile("{1st}"));
    assertThrows(TemplateException.class, () -> Template.compile("{two words}"));
  }
}
