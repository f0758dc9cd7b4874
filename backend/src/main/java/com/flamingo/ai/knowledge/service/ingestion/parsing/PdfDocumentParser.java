package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * Parser for PDF files using Apache PDFBox 3.x.
 *
 * <p>Extracts the full text and chunks it as prose. Page attribution is approximate: chunk {@code
 * i} of {@code n} is assigned page {@code floor(i / n * pages) + 1}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfDocumentParser implements DocumentParser {

  private final TextChunker textChunker;

  @Override
  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    try (PDDocument pdf = Loader.loadPDF(content)) {
      String text = new PDFTextStripper().getText(pdf);
      int pages = Math.max(pdf.getNumberOfPages(), 1);

      List<ParsedChunk> chunks = textChunker.chunk(text, ChunkType.TEXT);
      List<ParsedChunk> paged = new ArrayList<>(chunks.size());
      for (int i = 0; i < chunks.size(); i++) {
        int page = (int) Math.floor((double) i / chunks.size() * pages) + 1;
        paged.add(chunks.get(i).withPage(page));
      }

      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("pages", pdf.getNumberOfPages());
      metadata.put("info", documentInfo(pdf.getDocumentInformation()));
      return new ParsedDocument(text, metadata, paged);
    } catch (IOException e) {
      log.error("PDF parsing failed for {}: {}", fileName, e.getMessage());
      throw new DocumentParseException(FileType.PDF, "Failed to parse PDF document", e);
    }
  }

  @Override
  public Set<FileType> supportedTypes() {
    return Set.of(FileType.PDF);
  }

  private static Map<String, Object> documentInfo(PDDocumentInformation info) {
    Map<String, Object> values = new LinkedHashMap<>();
    if (info == null) {
      return values;
    }
    putIfPresent(values, "title", info.getTitle());
    putIfPresent(values, "author", info.getAuthor());
    putIfPresent(values, "subject", info.getSubject());
    putIfPresent(values, "creator", info.getCreator());
    putIfPresent(values, "producer", info.getProducer());
    return values;
  }

  private static void putIfPresent(Map<String, Object> values, String key, String value) {
    if (value != null && !value.isBlank()) {
      values.put(key, value);
    }
  }
}
