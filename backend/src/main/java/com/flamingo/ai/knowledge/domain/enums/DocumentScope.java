package com.flamingo.ai.knowledge.domain.enums;

/** Visibility of a document to conversations. */
public enum DocumentScope {
  /** Attached to a single conversation thread. */
  CONVERSATION,

  /** Available to every conversation of the owner. */
  GLOBAL
}
