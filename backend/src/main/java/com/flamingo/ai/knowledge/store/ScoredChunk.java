package com.flamingo.ai.knowledge.store;

/** A search hit: the chunk and its cosine similarity to the query vector. */
public record ScoredChunk(Chunk chunk, double score) {}
