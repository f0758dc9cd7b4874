package com.flamingo.ai.knowledge.exception;

/** Exception thrown when an upload does not map to any supported file type. */
public class UnsupportedFileTypeException extends RuntimeException {

  private final String mimeType;
  private final String fileName;

  public UnsupportedFileTypeException(String mimeType, String fileName) {
    super("Unsupported file type: " + mimeType + " (" + fileName + ")");
    this.mimeType = mimeType;
    this.fileName = fileName;
  }

  public String getMimeType() {
    return mimeType;
  }

  public String getFileName() {
    return fileName;
  }
}
