package ca.gc.cra.facet.application.extract;

import ca.gc.cra.facet.domain.entity.Entity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Re-positions parsed entities on codepoint offsets and orders them by start.
 *
 * @since FACET 0.1.0
 */
final class ResultAssembler {
  private static final Comparator<Entity> BY_START = Comparator.comparingInt(entity -> entity.span().start());

  /**
   * Builds the final result list.
   *
   * @param text source text the spans refer to
   * @param parsed entities positioned on UTF-16 offsets
   * @return unmodifiable list sorted by span start; ties keep commit order
   */
  List<Entity> assemble(String text, List<Entity> parsed) {
    if (parsed.isEmpty()) {
      return List.of();
    }
    OffsetMapper mapper = OffsetMapper.of(text);
    List<Entity> ordered = new ArrayList<>(parsed.size());
    for (Entity entity : parsed) {
      ordered.add(mapper.isIdentity() ? entity : entity.withSpan(mapper.toCodePoints(entity.span())));
    }
    ordered.sort(BY_START);
    return Collections.unmodifiableList(ordered);
  }
}
