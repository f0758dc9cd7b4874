package com.flamingo.ai.knowledge.service.ingestion.chunking;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.service.ingestion.parsing.ParsedChunk;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Paragraph-based splitter shared by the parsers.
 *
 * <p>Paragraphs (separated by blank lines) are packed into chunks of at most {@code maxChunkSize}
 * characters. Each new chunk starts with the last {@code overlapWords} words of the previous one.
 * A paragraph larger than the limit is never split, and no text is dropped: a trailing remainder
 * shorter than {@code minChunkSize} is merged into the previous chunk.
 */
@Component
public class TextChunker {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\n+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final String SEPARATOR = "\n\n";

  private final KnowledgeConfig.Chunking config;

  public TextChunker(KnowledgeConfig knowledgeConfig) {
    this.config = knowledgeConfig.getChunking();
  }

  public List<ParsedChunk> chunk(String text, ChunkType chunkType) {
    List<ParsedChunk> chunks = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return chunks;
    }

    int maxSize = config.getMaxChunkSize();
    int minSize = config.getMinChunkSize();
    StringBuilder current = new StringBuilder();

    for (String paragraph : PARAGRAPH_BREAK.split(text)) {
      String trimmed = paragraph.trim();
      if (trimmed.isEmpty()) {
        continue;
      }

      if (current.length() + trimmed.length() > maxSize) {
        if (current.length() >= minSize) {
          String emitted = current.toString().trim();
          chunks.add(ParsedChunk.of(emitted, chunkType));
          current.setLength(0);
          current.append(overlapTail(emitted)).append(SEPARATOR).append(trimmed);
        } else {
          current.append(SEPARATOR).append(trimmed);
        }
      } else {
        if (current.length() > 0) {
          current.append(SEPARATOR);
        }
        current.append(trimmed);
      }
    }

    String remainder = current.toString().trim();
    if (remainder.length() >= minSize) {
      chunks.add(ParsedChunk.of(remainder, chunkType));
    } else if (!remainder.isEmpty() && !chunks.isEmpty()) {
      int last = chunks.size() - 1;
      ParsedChunk previous = chunks.get(last);
      chunks.set(last, previous.withContent(previous.content() + SEPARATOR + remainder));
    } else if (!remainder.isEmpty()) {
      chunks.add(ParsedChunk.of(remainder, chunkType));
    }
    return chunks;
  }

  private String overlapTail(String emitted) {
    String[] words = WHITESPACE.split(emitted);
    int from = Math.max(0, words.length - config.getOverlapWords());
    return String.join(" ", Arrays.copyOfRange(words, from, words.length));
  }
}
