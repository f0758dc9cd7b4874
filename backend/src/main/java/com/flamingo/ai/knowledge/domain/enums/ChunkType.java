package com.flamingo.ai.knowledge.domain.enums;

/** Kind of content held by a chunk; drives token estimation. */
public enum ChunkType {
  TEXT,
  CODE,
  TABLE,
  HEADING,
  METADATA
}
