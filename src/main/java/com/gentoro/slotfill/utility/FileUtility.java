package com.gentoro.slotfill.utility;

import com.gentoro.slotfill.exception.IoException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;

public class FileUtility {

  /** Creates a fresh, uniquely named directory under {@code base} (created when missing). */
  public static Path createWorkDirectory(Path base, String prefix) {
    try {
      Files.createDirectories(base);
      return Files.createTempDirectory(base, prefix);
    } catch (IOException e) {
      throw new IoException("Failed to create work directory under: " + base, e);
    }
  }

  public static void writeUtf8(Path file, String content) {
    try {
      Files.writeString(file, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to write file: " + file, e);
    }
  }

  public static void deleteDir(Path dir, boolean quietly) {
    try {
      if (dir != null && Files.exists(dir)) {
        try (var paths = Files.walk(dir)) {
          paths
              .sorted(Comparator.reverseOrder()) // delete children first
              .forEach(
                  path -> {
                    try {
                      Files.delete(path);
                    } catch (IOException e) {
                      throw new IoException("Failed to delete file: " + path, e);
                    }
                  });
        }
      }
    } catch (Exception e) {
      if (!quietly) {
        throw new IoException("Failed to delete directory: " + dir, e);
      }
    }
  }
}
