package com.flamingo.ai.knowledge.service.search;

import java.util.List;
import java.util.UUID;

/**
 * Document text assembled for a conversation prompt.
 *
 * @param content labeled chunk texts, separated by horizontal rules
 * @param sources the chunks used, in the order they appear in {@code content}
 */
public record ConversationContext(String content, List<Source> sources) {

  public static ConversationContext empty() {
    return new ConversationContext("", List.of());
  }

  public boolean isEmpty() {
    return sources.isEmpty();
  }

  /**
   * A chunk cited by the context.
   *
   * @param cumulativeTokens token total of the context up to and including this chunk
   */
  public record Source(
      String chunkId,
      UUID documentId,
      String documentName,
      double similarity,
      int cumulativeTokens) {}
}
