package com.github.fsmcompiler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Blocking file output shared by the serializer and the script generator.
 */
final class OutputFiles {
  private static final Logger logger = LogManager.getLogger(OutputFiles.class.getSimpleName());

  /**
   * Creates missing parent directories, then truncates and writes the file in one go.
   */
  static void write(final Path file, final byte[] content) throws AutomatonException {
    try {
      final Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(file, content, StandardOpenOption.CREATE,
          StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    } catch (IOException problem) {
      logger.error("Failed to open file for writing: " + file, problem);
      throw new AutomatonException(AutomatonException.Code.FILE_WRITE_FAILURE,
          "Failed to open file for writing: " + file, problem);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Wrote " + content.length + " bytes to " + file);
    }
  }

  private OutputFiles() {}
}
