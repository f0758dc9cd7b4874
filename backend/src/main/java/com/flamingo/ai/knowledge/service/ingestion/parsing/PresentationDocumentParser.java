package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Parser for PowerPoint (PPTX) decks.
 *
 * <p>Reads the slide parts of the package directly, in slide-number order, and collects the
 * DrawingML text runs of each slide into one chunk per slide.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PresentationDocumentParser implements DocumentParser {

  private static final Pattern SLIDE_ENTRY = Pattern.compile("^ppt/slides/slide(\\d+)\\.xml$");
  private static final String DRAWINGML_NS =
      "http://schemas.openxmlformats.org/drawingml/2006/main";

  private final TextChunker textChunker;

  @Override
  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    TreeMap<Integer, byte[]> slides;
    try {
      slides = readSlideParts(content);
    } catch (IOException e) {
      log.error("PPTX parsing failed for {}: {}", fileName, e.getMessage());
      throw new DocumentParseException(FileType.PPTX, "Failed to parse PPTX presentation", e);
    }

    List<ParsedChunk> chunks = new ArrayList<>();
    List<String> allText = new ArrayList<>();
    try {
      DocumentBuilder builder = newDocumentBuilder();
      int slideNumber = 0;
      for (byte[] slideXml : slides.values()) {
        slideNumber++;
        List<String> texts = textRuns(builder.parse(new ByteArrayInputStream(slideXml)));
        if (texts.isEmpty()) {
          continue;
        }
        allText.add("Slide " + slideNumber + ": " + String.join(" ", texts));
        String slideText = "Slide " + slideNumber + ":\n" + String.join("\n", texts);
        chunks.add(ParsedChunk.of(slideText, ChunkType.TEXT).withPage(slideNumber));
      }
    } catch (ParserConfigurationException | SAXException | IOException e) {
      log.error("PPTX slide XML unreadable in {}: {}", fileName, e.getMessage());
      throw new DocumentParseException(FileType.PPTX, "Failed to parse PPTX presentation", e);
    }

    String fullText = String.join("\n\n", allText);
    if (chunks.isEmpty()) {
      chunks.addAll(textChunker.chunk(fullText, ChunkType.TEXT));
    }
    return new ParsedDocument(fullText, Map.of("slideCount", slides.size()), chunks);
  }

  @Override
  public Set<FileType> supportedTypes() {
    return Set.of(FileType.PPTX);
  }

  private TreeMap<Integer, byte[]> readSlideParts(byte[] content) throws IOException {
    TreeMap<Integer, byte[]> slides = new TreeMap<>();
    boolean anyEntry = false;
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(content))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        anyEntry = true;
        Matcher matcher = SLIDE_ENTRY.matcher(entry.getName());
        if (matcher.matches()) {
          slides.put(Integer.parseInt(matcher.group(1)), zip.readAllBytes());
        }
      }
    }
    if (!anyEntry) {
      throw new IOException("Not a zip package");
    }
    return slides;
  }

  private static List<String> textRuns(Document slide) {
    NodeList runs = slide.getElementsByTagNameNS(DRAWINGML_NS, "t");
    List<String> texts = new ArrayList<>();
    for (int i = 0; i < runs.getLength(); i++) {
      String text = runs.item(i).getTextContent().trim();
      if (!text.isEmpty()) {
        texts.add(text);
      }
    }
    return texts;
  }

  private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    factory.setExpandEntityReferences(false);
    return factory.newDocumentBuilder();
  }
}
