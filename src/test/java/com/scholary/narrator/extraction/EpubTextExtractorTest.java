package com.scholary.narrator.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EpubTextExtractorTest {

  private static final String CONTAINER =
      """
      <?xml version="1.0" encoding="UTF-8"?>
      <container version="1.0" xmlns="urn:oasis:names:tc:opendocument:xmlns:container">
        <rootfiles>
          <rootfile full-path="OEBPS/content.opf" media-type="application/oebps-package+xml"/>
        </rootfiles>
      </container>
      """;

  private static final String OPF =
      """
      <?xml version="1.0" encoding="UTF-8"?>
      <package xmlns="http://www.idpf.org/2007/opf" version="3.0">
        <manifest>
          <item id="nav" href="nav.xhtml" media-type="application/xhtml+xml" properties="nav"/>
          <item id="c1" href="text/chapter%201.xhtml" media-type="application/xhtml+xml"/>
          <item id="c2" href="text/chapter2.xhtml#start" media-type="application/xhtml+xml"/>
          <item id="css" href="style.css" media-type="text/css"/>
        </manifest>
        <spine>
          <itemref idref="c2"/>
          <itemref idref="c1"/>
          <itemref idref="css"/>
          <itemref idref="c2"/>
        </spine>
      </package>
      """;

  @TempDir Path tempDir;

  private final EpubTextExtractor extractor = new EpubTextExtractor();

  @Test
  void extract_shouldFollowSpineOrderOnce() throws Exception {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("mimetype", "application/epub+zip");
    entries.put("META-INF/container.xml", CONTAINER);
    entries.put("OEBPS/content.opf", OPF);
    entries.put("OEBPS/nav.xhtml", xhtml("<nav><p>Table of contents</p></nav>"));
    entries.put("OEBPS/text/chapter 1.xhtml", xhtml("<h1>Chapter One</h1><p>Later text.</p>"));
    entries.put("OEBPS/text/chapter2.xhtml", xhtml("<h1>Chapter Two</h1><p>Earlier text.</p>"));
    entries.put("OEBPS/style.css", "p { margin: 0; }");
    Path epub = writeEpub("book.epub", entries);

    String text = extractor.extract(epub);

    assertThat(text)
        .isEqualTo("Chapter Two\n\nEarlier text.\n\nChapter One\n\nLater text.");
  }

  @Test
  void extract_shouldSkipNonNarrativeElements() throws Exception {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put(
        "chapter.xhtml",
        xhtml(
            "<header>Running head</header>"
                + "<p>Kept <em>paragraph</em>.</p>"
                + "<script>var x = 1;</script>"
                + "<figure><img src=\"a.png\"/><figcaption>Caption</figcaption></figure>"
                + "<aside>Side note</aside>"
                + "<div>Also kept.</div>"
                + "<footer>Page 3</footer>"));
    Path epub = writeEpub("plain.epub", entries);

    assertThat(extractor.extract(epub)).isEqualTo("Kept paragraph.\n\nAlso kept.");
  }

  @Test
  void extract_shouldFallBackToSortedXhtmlEntriesWithoutContainer() throws Exception {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("b.xhtml", xhtml("<p>Second.</p>"));
    entries.put("a.html", xhtml("<p>First.</p>"));
    entries.put("notes.txt", "not content");
    Path epub = writeEpub("loose.epub", entries);

    assertThat(extractor.extract(epub)).isEqualTo("First.\n\nSecond.");
  }

  @Test
  void extract_shouldWrapCorruptArchive() throws Exception {
    Path corrupt = Files.writeString(tempDir.resolve("corrupt.epub"), "not a zip file at all");

    assertThatThrownBy(() -> extractor.extract(corrupt))
        .isInstanceOf(DocumentParseException.class)
        .hasMessageContaining("corrupt.epub");
  }

  @Test
  void resolveHref_shouldDecodeAndNormalizePaths() {
    assertThat(EpubTextExtractor.resolveHref("OEBPS/", "text/ch%201.xhtml#p3"))
        .isEqualTo("OEBPS/text/ch 1.xhtml");
    assertThat(EpubTextExtractor.resolveHref("OEBPS/text/", "../ch2.xhtml"))
        .isEqualTo("OEBPS/ch2.xhtml");
    assertThat(EpubTextExtractor.resolveHref("", "./a+b.xhtml")).isEqualTo("a+b.xhtml");
  }

  @Test
  void supports_shouldMatchEpubExtension() {
    assertThat(extractor.supports("Book.EPUB")).isTrue();
    assertThat(extractor.supports("book.pdf")).isFalse();
  }

  private static String xhtml(String body) {
    return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<html xmlns=\"http://www.w3.org/1999/xhtml\"><head><title>Ignored title</title></head>"
        + "<body>"
        + body
        + "</body></html>";
  }

  private Path writeEpub(String name, Map<String, String> entries) throws IOException {
    Path file = tempDir.resolve(name);
    try (OutputStream out = Files.newOutputStream(file);
        ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out)) {
      for (Map.Entry<String, String> entry : entries.entrySet()) {
        zip.putArchiveEntry(new ZipArchiveEntry(entry.getKey()));
        zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
        zip.closeArchiveEntry();
      }
    }
    return file;
  }
}
