package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Dispatches a file to the {@link DocumentParser} registered for its type.
 *
 * <p>The table is built once from every parser bean. Registering two parsers for one type is a
 * configuration error.
 */
@Service
@Slf4j
public class DocumentParserRegistry {

  private final Map<FileType, DocumentParser> parsers;

  public DocumentParserRegistry(List<DocumentParser> parsers) {
    Map<FileType, DocumentParser> table = new EnumMap<>(FileType.class);
    for (DocumentParser parser : parsers) {
      for (FileType type : parser.supportedTypes()) {
        DocumentParser existing = table.putIfAbsent(type, parser);
        if (existing != null) {
          throw new IllegalStateException(
              "Both "
                  + existing.getClass().getSimpleName()
                  + " and "
                  + parser.getClass().getSimpleName()
                  + " are registered for "
                  + type);
        }
      }
    }
    this.parsers = Collections.unmodifiableMap(table);
    log.info("Registered document parsers for types: {}", this.parsers.keySet());
  }

  public ParsedDocument parse(byte[] content, FileType fileType, String fileName) {
    DocumentParser parser = fileType == null ? null : parsers.get(fileType);
    if (parser == null) {
      throw new DocumentParseException(fileType, "Unsupported file type: " + fileType);
    }
    log.debug("Parsing {} as {} with {}", fileName, fileType, parser.getClass().getSimpleName());
    return parser.parse(content, fileType, fileName);
  }

  public boolean supports(FileType fileType) {
    return fileType != null && parsers.containsKey(fileType);
  }
}
