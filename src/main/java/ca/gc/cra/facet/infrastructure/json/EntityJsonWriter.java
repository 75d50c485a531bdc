package ca.gc.cra.facet.infrastructure.json;

import ca.gc.cra.facet.domain.entity.Entity;
import ca.gc.cra.facet.domain.entity.EntityCategory;
import ca.gc.cra.facet.domain.entity.RangeEntity;
import ca.gc.cra.facet.domain.entity.ScalarEntity;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Serializes entities as one JSON object per line (NDJSON).
 *
 * <pre>
 * {"category":"MONEY","kind":"RANGE","span":{"start":10,"end":24},"unit":"$","endUnit":"$",
 *  "startValue":1000000.0,"endValue":5000000.0,"normalizedStart":"1000000","normalizedEnd":"5000000",
 *  "rawStart":"$1","rawEnd":"5 million","rawText":"$1-5 million","pattern":"money.range.currency","tier":2}
 * </pre>
 *
 * <p>DATE and TIME values are written as integers (epoch day, seconds since midnight).</p>
 *
 * @since FACET 0.1.0
 */
public final class EntityJsonWriter {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Serializes one entity without a trailing newline.
   *
   * @param entity entity to serialize
   * @return JSON object text
   */
  public String toJson(Entity entity) {
    Objects.requireNonNull(entity, "entity");
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeEntity(gen, entity);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize entity " + entity.pattern(), ex);
    }
    return out.toString();
  }

  /**
   * Appends entities to {@code out}, one line each. The writer is flushed but not closed.
   *
   * @param out destination
   * @param entities entities in output order
   * @return number of lines written
   * @throws IOException when the destination fails
   */
  public int writeLines(Writer out, Iterable<? extends Entity> entities) throws IOException {
    Objects.requireNonNull(out, "out");
    int lines = 0;
    for (Entity entity : entities) {
      out.write(toJson(entity));
      out.write('\n');
      lines++;
    }
    out.flush();
    return lines;
  }

  private void writeEntity(JsonGenerator gen, Entity entity) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("category", entity.category().name());
    gen.writeStringField("kind", entity.kind().name());
    gen.writeObjectFieldStart("span");
    gen.writeNumberField("start", entity.span().start());
    gen.writeNumberField("end", entity.span().end());
    gen.writeEndObject();
    gen.writeStringField("unit", entity.unit());
    if (entity instanceof RangeEntity range) {
      gen.writeStringField("endUnit", range.endUnit());
      writeValue(gen, "startValue", range.category(), range.startValue());
      writeValue(gen, "endValue", range.category(), range.endValue());
      gen.writeStringField("normalizedStart", range.normalizedStart());
      gen.writeStringField("normalizedEnd", range.normalizedEnd());
      gen.writeStringField("rawStart", range.rawStart());
      gen.writeStringField("rawEnd", range.rawEnd());
    } else if (entity instanceof ScalarEntity scalar) {
      writeValue(gen, "value", scalar.category(), scalar.value());
      gen.writeStringField("normalized", scalar.normalized());
      gen.writeBooleanField("negated", scalar.negated());
    }
    gen.writeStringField("rawText", entity.rawText());
    gen.writeStringField("pattern", entity.pattern());
    gen.writeNumberField("tier", entity.tier());
    gen.writeEndObject();
  }

  private static void writeValue(JsonGenerator gen, String field, EntityCategory category, double value)
      throws IOException {
    if (category == EntityCategory.DATE || category == EntityCategory.TIME) {
      gen.writeNumberField(field, (long) value);
    } else {
      gen.writeNumberField(field, value);
    }
  }
}
