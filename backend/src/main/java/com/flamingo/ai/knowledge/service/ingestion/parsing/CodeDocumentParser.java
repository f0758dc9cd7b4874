package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.service.ingestion.FileTypeDetector;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Parser for source code.
 *
 * <p>Scans line by line and starts a new chunk at a declaration boundary (function, class, type)
 * once the current chunk has enough lines, or whenever the current chunk outgrows the code chunk
 * size. Every chunk records its 1-based line range.
 */
@Service
public class CodeDocumentParser implements DocumentParser {

  private static final List<Pattern> BOUNDARIES =
      List.of(
          Pattern.compile("^(export\\s+)?(async\\s+)?function\\s+\\w+"), // js/ts functions
          Pattern.compile("^(export\\s+)?(class|interface|type|enum)\\s+\\w+"),
          Pattern.compile("^def\\s+\\w+"), // python
          Pattern.compile("^class\\s+\\w+"),
          Pattern.compile("^func\\s+\\w+"), // go
          Pattern.compile("^(pub\\s+)?fn\\s+\\w+"), // rust
          Pattern.compile("^(public|private|protected)?\\s*(static\\s+)?[\\w<>]+\\s+\\w+\\s*\\("));

  private final int codeChunkSize;
  private final int minLinesBeforeSplit;

  public CodeDocumentParser(KnowledgeConfig knowledgeConfig) {
    this.codeChunkSize = knowledgeConfig.getChunking().getCodeChunkSize();
    this.minLinesBeforeSplit = knowledgeConfig.getChunking().getCodeMinLines();
  }

  @Override
  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    String text = new String(content, StandardCharsets.UTF_8);
    String[] lines = text.split("\n", -1);

    List<ParsedChunk> chunks = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int currentLength = -1;
    int chunkStart = 1;

    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      boolean boundary = isBoundary(line.trim());

      if ((boundary && current.size() >= minLinesBeforeSplit) || currentLength > codeChunkSize) {
        chunks.add(ParsedChunk.lines(String.join("\n", current), ChunkType.CODE, chunkStart, i));
        current = new ArrayList<>();
        currentLength = -1;
        chunkStart = i + 1;
      }
      current.add(line);
      currentLength += line.length() + 1;
    }

    if (!current.isEmpty()) {
      chunks.add(
          ParsedChunk.lines(String.join("\n", current), ChunkType.CODE, chunkStart, lines.length));
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("language", FileTypeDetector.extensionOf(fileName));
    metadata.put("lineCount", lines.length);
    metadata.put("fileName", fileName);
    return new ParsedDocument(text, metadata, chunks);
  }

  @Override
  public Set<FileType> supportedTypes() {
    return Set.of(FileType.CODE);
  }

  static boolean isBoundary(String trimmedLine) {
    for (Pattern pattern : BOUNDARIES) {
      if (pattern.matcher(trimmedLine).find()) {
        return true;
      }
    }
    return false;
  }
}
