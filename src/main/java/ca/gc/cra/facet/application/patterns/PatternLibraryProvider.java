package ca.gc.cra.facet.application.patterns;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Facade that combines the built-in tier table with custom YAML pattern files.
 *
 * <p>Custom patterns are appended after the built-ins, so inside a tier they are evaluated after the four
 * built-in categories.</p>
 *
 * @since FACET 0.1.0
 */
public final class PatternLibraryProvider {
  private final PatternDefinitionLoader loader = new PatternDefinitionLoader();

  /**
   * Loads custom pattern files and builds a library restricted to {@code categories}.
   *
   * @param patternFiles ordered list of YAML pattern files; may be empty
   * @param categories categories to keep
   * @param strict when {@code true}, any pattern that fails to compile aborts the load
   * @return pattern library
   * @throws IOException when a pattern file cannot be read
   * @throws PatternCompilationException when {@code strict} is set and a pattern is rejected
   */
  public PatternLibrary load(List<Path> patternFiles, Set<EntityCategory> categories, boolean strict)
      throws IOException, PatternCompilationException {
    Objects.requireNonNull(patternFiles, "patternFiles");
    Objects.requireNonNull(categories, "categories");
    PatternLibrary.Builder builder = PatternLibrary.builder()
        .addAll(BuiltInPatterns.sources())
        .addAll(loader.load(patternFiles));
    PatternLibrary library = strict ? builder.buildStrict() : builder.build();
    return library.restrictTo(categories);
  }
}
