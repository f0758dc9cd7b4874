package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Parser for plain text and Markdown.
 *
 * <p>Markdown is split before every ATX heading line. Each heading becomes its own {@link
 * ChunkType#HEADING} chunk and the section body goes through the {@link TextChunker}.
 */
@Service
@RequiredArgsConstructor
public class TextDocumentParser implements DocumentParser {

  private static final Pattern SECTION_START = Pattern.compile("(?=^#{1,6}\\s)", Pattern.MULTILINE);
  private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+)");

  private final TextChunker textChunker;

  @Override
  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    String text = new String(content, StandardCharsets.UTF_8);
    List<ParsedChunk> chunks =
        fileType == FileType.MD ? chunkMarkdown(text) : textChunker.chunk(text, ChunkType.TEXT);

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("lineCount", text.split("\n", -1).length);
    metadata.put("charCount", text.length());
    return new ParsedDocument(text, metadata, chunks);
  }

  @Override
  public Set<FileType> supportedTypes() {
    return Set.of(FileType.TXT, FileType.MD);
  }

  List<ParsedChunk> chunkMarkdown(String text) {
    List<ParsedChunk> chunks = new ArrayList<>();
    for (String section : SECTION_START.split(text)) {
      if (section.isBlank()) {
        continue;
      }
      Matcher heading = HEADING.matcher(section);
      if (heading.lookingAt()) {
        chunks.add(ParsedChunk.of(heading.group(2).trim(), ChunkType.HEADING));
        String body = section.substring(heading.end()).trim();
        if (!body.isEmpty()) {
          chunks.addAll(textChunker.chunk(body, ChunkType.TEXT));
        }
      } else {
        chunks.addAll(textChunker.chunk(section, ChunkType.TEXT));
      }
    }
    return chunks;
  }
}
