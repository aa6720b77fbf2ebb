package com.flamingo.ai.knowledge.exception;

/**
 * A read or write crossed an owner boundary. Always a bug; never recovered from.
 */
public class OwnerIsolationViolationException extends RuntimeException {

  private final String ownerId;
  private final String chunkId;

  public OwnerIsolationViolationException(String ownerId, String chunkId, String message) {
    super(message);
    this.ownerId = ownerId;
    this.chunkId = chunkId;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public String getChunkId() {
    return chunkId;
  }
}
