package com.flamingo.ai.knowledge.domain.enums;

/** Non-fatal conditions reported in an ingestion summary. */
public enum IssueCode {
  /** Page text looked mis-decoded or the cleaner failed; the raw text was kept. */
  NORMALIZATION_DEGRADED,

  /** The primary embedding backend failed; a fallback vector was stored and flagged for repair. */
  EMBEDDING_BACKEND_UNAVAILABLE,

  /** A page could not be processed; sibling pages were still ingested. */
  PAGE_FAILED
}
