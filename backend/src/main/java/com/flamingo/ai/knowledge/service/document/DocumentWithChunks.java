package com.flamingo.ai.knowledge.service.document;

import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.elasticsearch.DocumentChunk;
import java.util.List;

/** A document with its chunks in chunk order. */
public record DocumentWithChunks(Document document, List<DocumentChunk> chunks) {}
