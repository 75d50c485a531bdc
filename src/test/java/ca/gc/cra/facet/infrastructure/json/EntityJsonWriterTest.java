package ca.gc.cra.facet.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.facet.domain.entity.Entity;
import ca.gc.cra.facet.domain.entity.EntityCategory;
import ca.gc.cra.facet.domain.entity.RangeEntity;
import ca.gc.cra.facet.domain.entity.ScalarEntity;
import ca.gc.cra.facet.domain.entity.Span;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EntityJsonWriterTest {
  private final EntityJsonWriter writer = new EntityJsonWriter();

  @Test
  void rangeFieldsAreWrittenInOrder() throws IOException {
    RangeEntity range = new RangeEntity(EntityCategory.MONEY, 1_000_000, 5_000_000, "$", "$", "$1",
        "5 million", "1000000", "5000000", new Span(10, 22), "$1-5 million", "money.range.currency", 2);

    Map<String, Object> fields = parse(writer.toJson(range));

    assertEquals(List.of("category", "kind", "span.start", "span.end", "unit", "endUnit", "startValue",
        "endValue", "normalizedStart", "normalizedEnd", "rawStart", "rawEnd", "rawText", "pattern", "tier"),
        new ArrayList<>(fields.keySet()));
    assertEquals("MONEY", fields.get("category"));
    assertEquals("RANGE", fields.get("kind"));
    assertEquals(10, fields.get("span.start"));
    assertEquals(22, fields.get("span.end"));
    assertEquals(1_000_000.0, fields.get("startValue"));
    assertEquals("5 million", fields.get("rawEnd"));
    assertEquals(2, fields.get("tier"));
  }

  @Test
  void dateValuesAreWrittenAsIntegers() throws IOException {
    long epochDay = LocalDate.of(2024, 3, 15).toEpochDay();
    ScalarEntity date = new ScalarEntity(EntityCategory.DATE, epochDay, "", "2024-03-15", new Span(0, 14),
        "March 15, 2024", "date.scalar.month_day_year", 5, false);

    String json = writer.toJson(date);
    Map<String, Object> fields = parse(json);

    assertEquals((int) epochDay, fields.get("value"));
    assertEquals("2024-03-15", fields.get("normalized"));
    assertEquals(Boolean.FALSE, fields.get("negated"));
    assertFalse(json.contains("startValue"));
  }

  @Test
  void escapesTextAndWritesOneLinePerEntity() throws IOException {
    ScalarEntity quoted = new ScalarEntity(EntityCategory.MEASUREMENT, -5, "°F", "-5", new Span(0, 4),
        "-5\"°F", "measurement.negative", 4, true);
    StringWriter out = new StringWriter();

    int lines = writer.writeLines(out, List.<Entity>of(quoted, quoted));

    assertEquals(2, lines);
    String[] rows = out.toString().split("\n");
    assertEquals(2, rows.length);
    assertTrue(out.toString().endsWith("\n"));
    Map<String, Object> fields = parse(rows[0]);
    assertEquals("-5\"°F", fields.get("rawText"));
    assertEquals(Boolean.TRUE, fields.get("negated"));
    assertEquals(-5.0, fields.get("value"));
  }

  @Test
  void emptyInputWritesNothing() throws IOException {
    StringWriter out = new StringWriter();

    assertEquals(0, writer.writeLines(out, List.of()));
    assertEquals("", out.toString());
  }

  private static Map<String, Object> parse(String json) throws IOException {
    Map<String, Object> fields = new LinkedHashMap<>();
    try (JsonParser parser = new JsonFactory().createParser(json)) {
      String prefix = "";
      String name = null;
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        switch (token) {
          case FIELD_NAME -> name = parser.getCurrentName();
          case START_OBJECT -> prefix = name == null ? "" : name + ".";
          case END_OBJECT -> prefix = "";
          case VALUE_STRING -> fields.put(prefix + name, parser.getText());
          case VALUE_NUMBER_INT -> fields.put(prefix + name, parser.getIntValue());
          case VALUE_NUMBER_FLOAT -> fields.put(prefix + name, parser.getDoubleValue());
          case VALUE_TRUE, VALUE_FALSE -> fields.put(prefix + name, parser.getBooleanValue());
          default -> {
          }
        }
      }
    }
    return fields;
  }
}
