package ca.gc.cra.salvage.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireIdentifierAllowsSafeCharacters() {
    assertEquals("jpeg-info_2.x", Strings.requireIdentifier("check", "jpeg-info_2.x"));
  }

  @Test
  void requireIdentifierRejectsInvalidCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("check", "jpeg info"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("attrs", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abc", 2));
  }
}
