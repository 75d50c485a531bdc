package ca.gc.cra.facet.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void readableFileIsNormalized() throws IOException {
    Path file = Files.writeString(tempDir.resolve("doc.txt"), "text");

    Path result = Paths.requireReadableFile("in", tempDir.resolve("sub/../doc.txt"));

    assertEquals(file.toAbsolutePath().normalize(), result);
  }

  @Test
  void readableFileRejectsMissingFilesAndDirectories() {
    IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("in", tempDir.resolve("absent.txt")));
    assertTrue(missing.getMessage().startsWith("in does not exist"));

    IllegalArgumentException dir = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("in", tempDir));
    assertTrue(dir.getMessage().startsWith("in is not a regular file"));

    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", null));
  }

  @Test
  void outputFileNeedsExistingParent() {
    Path out = tempDir.resolve("entities.ndjson");
    assertEquals(out.toAbsolutePath().normalize(), Paths.validateOutputFile("out", out));

    IllegalArgumentException parent = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile("out", tempDir.resolve("missing/entities.ndjson")));
    assertTrue(parent.getMessage().startsWith("out parent directory does not exist"));

    IllegalArgumentException dir = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile("out", tempDir));
    assertTrue(dir.getMessage().startsWith("out is a directory"));
  }
}
