package com.scholary.narrator.extraction;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts text from EPUB files.
 *
 * <p>An EPUB is a zip archive. {@code META-INF/container.xml} points at the OPF package document,
 * whose spine lists the XHTML content documents in reading order. Each content document is parsed
 * with jsoup and its body is read block by block:
 *
 * <ul>
 *   <li>loose text directly under the body is kept when longer than one character
 *   <li>non-narrative elements (scripts, navigation, figures, page furniture) are skipped
 *   <li>every other element contributes its text followed by a paragraph break
 * </ul>
 *
 * <p>Archives without a usable container or spine fall back to every XHTML entry in name order.
 */
@Component
public class EpubTextExtractor implements TextExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(EpubTextExtractor.class);

  private static final String CONTAINER_PATH = "META-INF/container.xml";

  private static final Set<String> SKIPPED_TAGS =
      Set.of("script", "style", "nav", "header", "footer", "aside", "figure", "img", "br", "hr");

  private static final Set<String> CONTENT_MEDIA_TYPES =
      Set.of("application/xhtml+xml", "text/html");

  @Override
  public boolean supports(String filename) {
    return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".epub");
  }

  @Override
  public String extract(Path file) {
    LOGGER.info("Extracting text from EPUB: {}", file.getFileName());

    try (ZipFile zip = ZipFile.builder().setPath(file).get()) {
      List<String> contentPaths = readSpine(zip);
      if (contentPaths.isEmpty()) {
        LOGGER.warn("No spine found in {}, falling back to all XHTML entries", file.getFileName());
        contentPaths = listXhtmlEntries(zip);
      }
      LOGGER.info("Found {} content documents", contentPaths.size());

      StringBuilder text = new StringBuilder();
      // Malformed spines sometimes repeat documents
      for (String contentPath : new LinkedHashSet<>(contentPaths)) {
        ZipArchiveEntry entry = zip.getEntry(contentPath);
        if (entry == null) {
          LOGGER.warn("Spine references missing entry: {}", contentPath);
          continue;
        }

        String documentText;
        try (InputStream in = zip.getInputStream(entry)) {
          documentText = extractDocumentText(Jsoup.parse(in, null, ""));
        }
        if (!documentText.isBlank()) {
          text.append(documentText.strip()).append("\n\n");
        }
      }

      LOGGER.info("Extracted {} characters from EPUB", text.length());
      return text.toString().strip();

    } catch (IOException e) {
      throw new DocumentParseException("Failed to read EPUB: " + file.getFileName(), e);
    }
  }

  /** Resolve the content documents listed in the OPF spine, in reading order. */
  private List<String> readSpine(ZipFile zip) throws IOException {
    ZipArchiveEntry containerEntry = zip.getEntry(CONTAINER_PATH);
    if (containerEntry == null) {
      return List.of();
    }

    Document container;
    try (InputStream in = zip.getInputStream(containerEntry)) {
      container = Jsoup.parse(in, StandardCharsets.UTF_8.name(), "", Parser.xmlParser());
    }
    Element rootfile = container.selectFirst("rootfile[full-path]");
    if (rootfile == null) {
      return List.of();
    }

    String opfPath = rootfile.attr("full-path");
    ZipArchiveEntry opfEntry = zip.getEntry(opfPath);
    if (opfEntry == null) {
      LOGGER.warn("Container points at missing package document: {}", opfPath);
      return List.of();
    }

    Document opf;
    try (InputStream in = zip.getInputStream(opfEntry)) {
      opf = Jsoup.parse(in, StandardCharsets.UTF_8.name(), "", Parser.xmlParser());
    }

    String opfDir = opfPath.contains("/") ? opfPath.substring(0, opfPath.lastIndexOf('/') + 1) : "";

    Map<String, String> manifest = new HashMap<>();
    for (Element item : opf.select("manifest > item")) {
      String mediaType = item.attr("media-type").toLowerCase(Locale.ROOT);
      if (CONTENT_MEDIA_TYPES.contains(mediaType)) {
        manifest.put(item.attr("id"), resolveHref(opfDir, item.attr("href")));
      }
    }

    List<String> spine = new ArrayList<>();
    for (Element itemref : opf.select("spine > itemref")) {
      String path = manifest.get(itemref.attr("idref"));
      if (path != null) {
        spine.add(path);
      }
    }
    return spine;
  }

  private List<String> listXhtmlEntries(ZipFile zip) {
    List<String> names = new ArrayList<>();
    for (ZipArchiveEntry entry : Collections.list(zip.getEntries())) {
      String name = entry.getName().toLowerCase(Locale.ROOT);
      if (!entry.isDirectory()
          && (name.endsWith(".xhtml") || name.endsWith(".html") || name.endsWith(".htm"))) {
        names.add(entry.getName());
      }
    }
    Collections.sort(names);
    return names;
  }

  private String extractDocumentText(Document document) {
    Element body = document.body();
    if (body == null || body.childNodeSize() == 0) {
      return document.text();
    }

    StringBuilder text = new StringBuilder();
    for (Node node : body.childNodes()) {
      if (node instanceof TextNode textNode) {
        String loose = textNode.text().strip();
        if (loose.length() > 1) {
          text.append(loose).append(' ');
        }
      } else if (node instanceof Element element) {
        if (SKIPPED_TAGS.contains(element.normalName())) {
          continue;
        }
        String blockText = element.text().strip();
        if (!blockText.isEmpty()) {
          text.append(blockText).append("\n\n");
        }
      }
    }
    return text.toString();
  }

  /** Resolve a manifest href against the package document's directory. */
  static String resolveHref(String baseDir, String href) {
    String path = href;
    int fragment = path.indexOf('#');
    if (fragment >= 0) {
      path = path.substring(0, fragment);
    }
    path = URLDecoder.decode(path.replace("+", "%2B"), StandardCharsets.UTF_8);

    Deque<String> segments = new ArrayDeque<>();
    for (String segment : (baseDir + path).split("/")) {
      if (segment.isEmpty() || segment.equals(".")) {
        continue;
      }
      if (segment.equals("..")) {
        segments.pollLast();
      } else {
        segments.addLast(segment);
      }
    }
    return String.join("/", segments);
  }
}
