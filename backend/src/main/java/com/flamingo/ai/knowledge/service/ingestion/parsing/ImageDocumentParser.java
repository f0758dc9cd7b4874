package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import com.flamingo.ai.knowledge.service.ingestion.vision.ImageTranscriptionService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Parser for images. Text comes from the vision model's OCR.
 *
 * <p>Never fails: without a vision model, or when the model call fails, the image is kept with a
 * placeholder content and no chunks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageDocumentParser implements DocumentParser {

  static final String NO_OCR_PLACEHOLDER = "[Image - no OCR available]";
  static final String OCR_FAILED_PLACEHOLDER = "[Image - OCR failed]";

  private final ImageTranscriptionService transcriptionService;
  private final TextChunker textChunker;

  @Override
  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    String mimeType = sniffMimeType(content);

    if (!transcriptionService.isAvailable()) {
      log.warn("No vision model for image OCR, storing {} with empty chunks", fileName);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("mimeType", mimeType);
      metadata.put("ocrAvailable", false);
      return new ParsedDocument(NO_OCR_PLACEHOLDER, metadata, List.of());
    }

    try {
      String text = transcriptionService.transcribe(content, mimeType);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("mimeType", mimeType);
      metadata.put("ocrAvailable", true);
      return new ParsedDocument(text, metadata, textChunker.chunk(text, ChunkType.TEXT));
    } catch (RuntimeException e) {
      log.error("Image OCR failed for {}: {}", fileName, e.getMessage());
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("ocrAvailable", false);
      metadata.put("error", e.getMessage() != null ? e.getMessage() : "Unknown error");
      return new ParsedDocument(OCR_FAILED_PLACEHOLDER, metadata, List.of());
    }
  }

  @Override
  public Set<FileType> supportedTypes() {
    return Set.of(FileType.IMAGE);
  }

  static String sniffMimeType(byte[] content) {
    if (content.length >= 2) {
      int b0 = content[0] & 0xFF;
      int b1 = content[1] & 0xFF;
      if (b0 == 0xFF && b1 == 0xD8) {
        return "image/jpeg";
      }
      if (b0 == 0x47 && b1 == 0x49) {
        return "image/gif";
      }
      if (b0 == 0x52 && b1 == 0x49) {
        return "image/webp";
      }
      if (b0 == '<' || b0 == 0xEF) {
        return "image/svg+xml";
      }
    }
    return "image/png";
  }
}
