package com.flamingo.ai.knowledge.service.rag.embedding;

/** Whether a vector came from the primary model or from a fallback. */
public enum EmbeddingStatus {
  OK,
  DEGRADED
}
