package com.flamingo.ai.knowledge.exception;

import com.flamingo.ai.knowledge.domain.enums.FileType;

/** Exception thrown when a parser cannot extract content from a file. */
public class DocumentParseException extends RuntimeException {

  private final FileType fileType;

  public DocumentParseException(FileType fileType, String message) {
    super(message);
    this.fileType = fileType;
  }

  public DocumentParseException(FileType fileType, String message, Throwable cause) {
    super(message, cause);
    this.fileType = fileType;
  }

  public FileType getFileType() {
    return fileType;
  }
}
