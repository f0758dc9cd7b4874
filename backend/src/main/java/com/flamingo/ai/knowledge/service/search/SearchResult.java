package com.flamingo.ai.knowledge.service.search;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import java.util.Map;
import java.util.UUID;

/** A chunk matching a search, with the document it belongs to. */
public record SearchResult(
    String chunkId,
    UUID documentId,
    String documentName,
    FileType fileType,
    String content,
    ChunkType chunkType,
    Integer sourcePage,
    double similarity,
    Map<String, Object> metadata) {}
