package ca.gc.cra.facet.domain.lexicon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumberLexiconTest {

  @Test
  void parsesSeparatorsSignsAndCurrency() {
    assertEquals(1234.56, NumberLexicon.parseNumber("$1,234.56").getAsDouble());
    assertEquals(-20.0, NumberLexicon.parseNumber("−20").getAsDouble());
    assertEquals(-50_000.0, NumberLexicon.parseNumber("-$50,000").getAsDouble());
    assertEquals(-500.0, NumberLexicon.parseNumber("$-500").getAsDouble());
    assertEquals(15.0, NumberLexicon.parseNumber("USD 15").getAsDouble());
  }

  @Test
  void appliesScaleWordsAndSuffixes() {
    assertEquals(1_500_000.0, NumberLexicon.parseNumber("$1.5 million").getAsDouble());
    assertEquals(2_000_000.0, NumberLexicon.parseNumber("$2M").getAsDouble());
    assertEquals(10_000.0, NumberLexicon.parseNumber("10K").getAsDouble());
    assertEquals(3e9, NumberLexicon.parseNumber("3 Billion").getAsDouble());
    assertEquals(1.5, NumberLexicon.parseMantissa("$1.5 million").getAsDouble());
    assertTrue(NumberLexicon.hasScale("5 thousand"));
    assertFalse(NumberLexicon.hasScale("5 meters"));
  }

  @Test
  void missingDigitsYieldEmpty() {
    assertTrue(NumberLexicon.parseNumber("dollars").isEmpty());
    assertTrue(NumberLexicon.parseNumber("").isEmpty());
    assertTrue(NumberLexicon.parseNumber(null).isEmpty());
  }

  @Test
  void valuesBeyondDoubleRangeYieldEmpty() {
    String huge = "9".repeat(400);

    assertTrue(NumberLexicon.parseMantissa(huge).isEmpty());
    assertTrue(NumberLexicon.parseNumber("$" + huge).isEmpty());
    assertTrue(NumberLexicon.parseNumber("1" + "0".repeat(300) + " trillion").isEmpty());
    assertTrue(NumberLexicon.finite(Double.NaN).isEmpty());
    assertEquals(1e300, NumberLexicon.parseNumber("1" + "0".repeat(300)).getAsDouble());
  }

  @Test
  void formatsWithoutExponentOrTrailingZeros() {
    assertEquals("5000000", NumberLexicon.format(5_000_000.0));
    assertEquals("1234.5", NumberLexicon.format(1234.50));
    assertEquals("-25000", NumberLexicon.format(-25_000.0));
    assertEquals("0", NumberLexicon.format(-0.0));
  }

  @Test
  void normalizesDashGlyphs() {
    assertEquals("-1 -2 -3", NumberLexicon.normalizeSigns("−1 –2 —3"));
  }
}
