package ca.gc.cra.facet.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("money", Strings.requireNonBlank("categories", "  money "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "   "));
    assertEquals("in must not be blank", blank.getMessage());

    IllegalArgumentException control =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank(null, "a\u0007b"));
    assertEquals("value must not contain control characters", control.getMessage());

    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("in", null));
  }

  @Test
  void splitListSkipsEmptyItems() {
    assertEquals(List.of("a.yaml", "b.yaml"), Strings.splitList("patterns", " a.yaml,, b.yaml ,"));
    assertEquals(List.of(), Strings.splitList("patterns", null));
    assertEquals(List.of(), Strings.splitList("patterns", " "));
  }
}
