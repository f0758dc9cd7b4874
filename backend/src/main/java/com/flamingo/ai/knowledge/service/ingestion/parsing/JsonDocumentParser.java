package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Parser for JSON files.
 *
 * <p>An object root yields one chunk per top-level key. Values too large for a single chunk are
 * pretty-printed and split by the {@link TextChunker}, each part tagged with its key and 1-based
 * part number. Array and scalar roots are chunked as a whole.
 */
@Service
@Slf4j
public class JsonDocumentParser implements DocumentParser {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT)
          .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  private final TextChunker textChunker;
  private final int maxChunkSize;

  public JsonDocumentParser(TextChunker textChunker, KnowledgeConfig knowledgeConfig) {
    this.textChunker = textChunker;
    this.maxChunkSize = knowledgeConfig.getChunking().getMaxChunkSize();
  }

  @Override
  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    JsonNode root;
    String formatted;
    try {
      root = MAPPER.readTree(new String(content, StandardCharsets.UTF_8));
      if (root == null || root.isMissingNode()) {
        throw new DocumentParseException(FileType.JSON, "Failed to parse JSON file");
      }
      formatted = MAPPER.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      log.error("JSON parsing failed for {}: {}", fileName, e.getOriginalMessage());
      throw new DocumentParseException(FileType.JSON, "Failed to parse JSON file", e);
    }

    List<ParsedChunk> chunks = new ArrayList<>();
    List<String> keys = new ArrayList<>();
    if (root.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        keys.add(field.getKey());
        chunks.addAll(chunkField(field.getKey(), field.getValue()));
      }
    } else {
      chunks.addAll(textChunker.chunk(formatted, ChunkType.TEXT));
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("type", typeOf(root));
    metadata.put("keys", keys);
    return new ParsedDocument(formatted, metadata, chunks);
  }

  @Override
  public Set<FileType> supportedTypes() {
    return Set.of(FileType.JSON);
  }

  private List<ParsedChunk> chunkField(String key, JsonNode value) {
    String valueText = write(value);
    if (valueText.length() <= maxChunkSize) {
      String quotedKey = write(MAPPER.getNodeFactory().textNode(key));
      return List.of(
          ParsedChunk.of(quotedKey + ": " + valueText, ChunkType.TEXT)
              .withMetadata(Map.of("key", key)));
    }

    List<ParsedChunk> parts = textChunker.chunk(valueText, ChunkType.TEXT);
    List<ParsedChunk> tagged = new ArrayList<>(parts.size());
    for (int i = 0; i < parts.size(); i++) {
      Map<String, Object> partMetadata = new LinkedHashMap<>();
      partMetadata.put("key", key);
      partMetadata.put("part", i + 1);
      tagged.add(parts.get(i).withMetadata(partMetadata));
    }
    return tagged;
  }

  private static String write(JsonNode node) {
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize JSON node", e);
    }
  }

  private static String typeOf(JsonNode root) {
    if (root.isArray()) {
      return "array";
    }
    if (root.isTextual()) {
      return "string";
    }
    if (root.isNumber()) {
      return "number";
    }
    if (root.isBoolean()) {
      return "boolean";
    }
    return "object";
  }
}
