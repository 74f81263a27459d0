package ca.gc.cra.filedrop.validation;

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
  void validateWritableDirReturnsRealPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("Manufacturing"));
    assertEquals(dir.toRealPath(), Paths.validateWritableDir(dir, tempDir, false));
  }

  @Test
  void validateWritableDirCreatesWhenRequested() {
    Path validated = Paths.validateWritableDir(tempDir.resolve("root/Distribution"), null, true);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirRejectsMissingOrEscaping() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableDir(tempDir.resolve("missing"), null, false));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableDir(tempDir.resolve("../elsewhere"), tempDir, true));
  }

  @Test
  void requireReadableFileRejectsDirectoriesAndMissingFiles() throws IOException {
    Path file = Files.writeString(tempDir.resolve("report.txt"), "q3");

    assertEquals(file.toAbsolutePath().normalize(), Paths.requireReadableFile("file", file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("file", tempDir));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("file", tempDir.resolve("absent.txt")));
  }
}
