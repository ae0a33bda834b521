package com.scholary.narrator.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentTextExtractorTest {

  @Test
  void extract_shouldDelegateByExtension() {
    EpubTextExtractor epub = mock(EpubTextExtractor.class);
    when(epub.supports("book.epub")).thenReturn(true);
    when(epub.extract(any())).thenReturn("epub text");
    DocumentTextExtractor extractor =
        new DocumentTextExtractor(List.of(new PdfTextExtractor(), epub));

    assertThat(extractor.extract(Path.of("staged_book.epub"), "book.epub")).isEqualTo("epub text");
    assertThat(extractor.isSupported("book.pdf")).isTrue();
    assertThat(extractor.isSupported("book.epub")).isTrue();
  }

  @Test
  void extract_shouldRejectUnsupportedFile() {
    EpubTextExtractor epub = mock(EpubTextExtractor.class);
    DocumentTextExtractor extractor =
        new DocumentTextExtractor(List.of(new PdfTextExtractor(), epub));

    assertThat(extractor.isSupported("notes.docx")).isFalse();
    assertThatThrownBy(() -> extractor.extract(Path.of("notes.docx"), "notes.docx"))
        .isInstanceOf(UnsupportedDocumentException.class)
        .hasMessageContaining("Only .pdf and .epub are supported");
    verify(epub, never()).extract(any());
  }

  @Test
  void extract_shouldReportLibraryFailuresAsParseErrors() {
    EpubTextExtractor epub = mock(EpubTextExtractor.class);
    when(epub.supports("broken.epub")).thenReturn(true);
    IllegalArgumentException zipError = new IllegalArgumentException("invalid CEN header");
    when(epub.extract(any())).thenThrow(zipError);
    DocumentTextExtractor extractor = new DocumentTextExtractor(List.of(epub));

    assertThatThrownBy(() -> extractor.extract(Path.of("broken.epub"), "broken.epub"))
        .isInstanceOf(DocumentParseException.class)
        .hasMessageContaining("broken.epub")
        .hasMessageContaining("invalid CEN header")
        .hasCause(zipError);
  }

  @Test
  void extract_shouldPassParseErrorsThrough() {
    EpubTextExtractor epub = mock(EpubTextExtractor.class);
    when(epub.supports("locked.epub")).thenReturn(true);
    DocumentParseException parseError = new DocumentParseException("Encrypted document");
    when(epub.extract(any())).thenThrow(parseError);
    DocumentTextExtractor extractor = new DocumentTextExtractor(List.of(epub));

    assertThatThrownBy(() -> extractor.extract(Path.of("locked.epub"), "locked.epub"))
        .isSameAs(parseError);
  }
}
