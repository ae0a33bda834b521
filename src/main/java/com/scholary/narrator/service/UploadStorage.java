package com.scholary.narrator.service;

import com.scholary.narrator.config.NarratorProperties;
import com.scholary.narrator.extraction.DocumentTextExtractor;
import com.scholary.narrator.extraction.UnsupportedDocumentException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stages incoming documents in the upload directory.
 *
 * <p>Each staged file gets a unique name so concurrent uploads of the same document never collide.
 */
@Component
public class UploadStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadStorage.class);

  private final DocumentTextExtractor extractor;
  private final Path uploadDir;

  public UploadStorage(DocumentTextExtractor extractor, NarratorProperties properties) {
    this.extractor = extractor;
    this.uploadDir = Paths.get(properties.uploadDir());

    try {
      Files.createDirectories(this.uploadDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create upload directory: " + uploadDir, e);
    }
  }

  /**
   * Copy a document into the upload directory.
   *
   * @param content the document bytes
   * @param originalFilename the client's file name
   * @return the staged file
   * @throws UnsupportedDocumentException if the file name has no supported extension
   */
  public Path store(InputStream content, String originalFilename) throws IOException {
    String safeName = sanitize(originalFilename);
    if (!extractor.isSupported(safeName)) {
      throw new UnsupportedDocumentException(
          "Unsupported file type: " + originalFilename + ". Only .pdf and .epub are supported");
    }

    Path target = uploadDir.resolve(UUID.randomUUID() + "_" + safeName);
    Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
    LOGGER.info("Stored upload {} as {} ({} bytes)", originalFilename, target, Files.size(target));
    return target;
  }

  /** Copy a local document into the upload directory. */
  public Path store(Path source) throws IOException {
    try (InputStream in = Files.newInputStream(source)) {
      return store(in, source.getFileName().toString());
    }
  }

  /** Strip directories and anything outside {@code [A-Za-z0-9._-]} from a client file name. */
  public static String sanitize(String filename) {
    if (filename == null) {
      return "upload";
    }
    String name = filename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    name = name.replaceAll("[^A-Za-z0-9._-]", "_").replaceAll("^[._]+", "");
    return name.isEmpty() ? "upload" : name;
  }
}
