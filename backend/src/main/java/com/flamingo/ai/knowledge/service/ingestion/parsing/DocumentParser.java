package com.flamingo.ai.knowledge.service.ingestion.parsing;

import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.DocumentParseException;
import java.util.Set;

/**
 * Turns the raw bytes of one file format family into a {@link ParsedDocument}.
 *
 * <p>Implementations must be stateless so a single instance can be shared across concurrent
 * processing threads. A parser only parses and chunks; it does not embed or persist.
 */
public interface DocumentParser {

  /**
   * Parses the given file.
   *
   * @param content raw file bytes
   * @param fileType detected type, one of {@link #supportedTypes()}
   * @param fileName original file name, used for language and extension hints
   * @return normalized content, metadata and chunks
   * @throws DocumentParseException if the file cannot be read at all
   */
  ParsedDocument parse(byte[] content, FileType fileType, String fileName);

  /** File types this parser handles. */
  Set<FileType> supportedTypes();
}
