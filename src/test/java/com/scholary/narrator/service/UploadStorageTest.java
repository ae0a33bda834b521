package com.scholary.narrator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.narrator.extraction.DocumentTextExtractor;
import com.scholary.narrator.extraction.EpubTextExtractor;
import com.scholary.narrator.extraction.PdfTextExtractor;
import com.scholary.narrator.extraction.UnsupportedDocumentException;
import com.scholary.narrator.testutil.TestProperties;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UploadStorageTest {

  @TempDir Path root;

  private UploadStorage storage;

  @BeforeEach
  void setUp() {
    storage =
        new UploadStorage(
            new DocumentTextExtractor(List.of(new PdfTextExtractor(), new EpubTextExtractor())),
            TestProperties.narrator(root));
  }

  @Test
  void store_shouldStageUnderUniqueSanitizedName() throws Exception {
    Path first = storage.store(new ByteArrayInputStream(new byte[] {1, 2}), "../My Book.epub");
    Path second = storage.store(new ByteArrayInputStream(new byte[] {3}), "../My Book.epub");

    assertThat(first.getParent()).isEqualTo(root.resolve("uploads"));
    assertThat(first.getFileName().toString()).endsWith("_My_Book.epub");
    assertThat(first).isNotEqualTo(second);
    assertThat(Files.readAllBytes(first)).containsExactly(1, 2);
  }

  @Test
  void store_shouldRejectUnsupportedExtension() {
    assertThatThrownBy(() -> storage.store(new ByteArrayInputStream(new byte[0]), "notes.docx"))
        .isInstanceOf(UnsupportedDocumentException.class)
        .hasMessageContaining("notes.docx");
  }

  @Test
  void store_shouldCopyLocalFile() throws Exception {
    Path local = Files.writeString(root.resolve("paper.pdf"), "%PDF");

    Path staged = storage.store(local);

    assertThat(staged).hasContent("%PDF");
    assertThat(local).exists();
  }

  @Test
  void sanitize_shouldStripDirectoriesAndUnsafeCharacters() {
    assertThat(UploadStorage.sanitize("C:\\docs\\report (final).pdf"))
        .isEqualTo("report__final_.pdf");
    assertThat(UploadStorage.sanitize("/etc/../.hidden.epub")).isEqualTo("hidden.epub");
    assertThat(UploadStorage.sanitize(null)).isEqualTo("upload");
    assertThat(UploadStorage.sanitize("...")).isEqualTo("upload");
  }
}
