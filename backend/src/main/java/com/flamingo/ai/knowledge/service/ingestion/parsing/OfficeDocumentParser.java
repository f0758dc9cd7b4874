package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * Parser for Word documents (DOCX, DOC) and legacy PowerPoint (PPT) using Apache Tika.
 *
 * <p>Extracts raw text only. Recoverable problems reported by Tika are kept as warnings under
 * {@code messages} in the document metadata; only an unreadable container fails the parse.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OfficeDocumentParser implements DocumentParser {

  private static final Map<FileType, String> CONTENT_TYPES =
      Map.of(
          FileType.DOCX,
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          FileType.DOC,
          "application/msword",
          FileType.PPT,
          "application/vnd.ms-powerpoint");

  private final TextChunker textChunker;

  @Override
  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    AutoDetectParser parser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, CONTENT_TYPES.get(fileType));
    if (fileName != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
    }

    try (InputStream input = new ByteArrayInputStream(content)) {
      parser.parse(input, handler, metadata, new ParseContext());
    } catch (IOException | SAXException | TikaException e) {
      log.error("{} parsing failed for {}: {}", fileType, fileName, e.getMessage());
      throw new DocumentParseException(fileType, failureMessage(fileType), e);
    }

    String text = handler.toString().trim();
    List<String> messages = new ArrayList<>(warnings(metadata));
    if (text.isEmpty()) {
      messages.add("No text content found in document");
    }
    if (!messages.isEmpty()) {
      log.warn("{} parsed with warnings: {}", fileName, messages);
    }

    List<ParsedChunk> chunks = textChunker.chunk(text, ChunkType.TEXT);
    return new ParsedDocument(text, Map.of("messages", messages), chunks);
  }

  @Override
  public Set<FileType> supportedTypes() {
    return CONTENT_TYPES.keySet();
  }

  private static List<String> warnings(Metadata metadata) {
    String[] values = metadata.getValues(TikaCoreProperties.TIKA_META_EXCEPTION_WARNING);
    return values == null ? List.of() : Arrays.asList(values);
  }

  private static String failureMessage(FileType fileType) {
    return fileType == FileType.PPT
        ? "Failed to parse PPT presentation"
        : "Failed to parse " + fileType.name() + " document";
  }
}
