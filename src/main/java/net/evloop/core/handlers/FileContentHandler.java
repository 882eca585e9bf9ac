package net.evloop.core.handlers;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import net.evloop.core.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Returns the contents of the file named by the payload, resolved against a base directory.
 * Missing files are created with placeholder content. I/O failures are returned as an error
 * description.
 */
public class FileContentHandler implements Handler {
  private static final Logger log = LoggerFactory.getLogger(FileContentHandler.class);

  private final Path directory;
  private final String placeholder;

  public FileContentHandler(Path directory, String placeholder) {
    this.directory = directory;
    this.placeholder = placeholder;
  }

  @Override
  public String handle(String payload) {
    var path = directory.resolve(payload);
    try {
      return Files.readString(path, UTF_8);
    } catch (NoSuchFileException e) {
      return create(path);
    } catch (IOException e) {
      log.warn("Failed to read file; path={}", path, e);
      return "Error reading file: " + e.getMessage();
    }
  }

  private String create(Path path) {
    log.info("File does not exist, creating it; path={}", path);
    try {
      var parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(path, placeholder, UTF_8);
    } catch (IOException e) {
      log.warn("Failed to create file; path={}", path, e);
      return "Error creating file: " + e.getMessage();
    }

    try {
      return Files.readString(path, UTF_8);
    } catch (IOException e) {
      log.warn("Failed to read created file; path={}", path, e);
      return "Error reading file: " + e.getMessage();
    }
  }
}
