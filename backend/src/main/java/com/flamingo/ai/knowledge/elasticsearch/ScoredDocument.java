package com.flamingo.ai.knowledge.elasticsearch;

/** Marker interface for documents that carry the relevance score of a search hit. */
public interface ScoredDocument {

  void setRelevanceScore(Double score);
}
