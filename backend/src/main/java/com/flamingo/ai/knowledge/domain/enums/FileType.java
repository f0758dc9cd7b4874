package com.flamingo.ai.knowledge.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/** Closed set of file types the ingestion pipeline distinguishes. */
public enum FileType {
  PDF,
  DOCX,
  DOC,
  TXT,
  MD,
  CSV,
  JSON,
  XLSX,
  XLS,
  CODE,
  PPTX,
  PPT,
  IMAGE,
  OTHER;

  private static final Set<FileType> TEXT_TYPES = EnumSet.of(TXT, MD, CSV, JSON, CODE);

  /** Whether the format is plain UTF-8 text on disk. */
  public boolean isText() {
    return TEXT_TYPES.contains(this);
  }
}
