package com.flamingo.ai.knowledge.exception;

/** Exception thrown when the chunk store cannot be read or written. Retrying may succeed. */
public class ChunkStoreException extends RuntimeException {

  private final String userMessage;

  public ChunkStoreException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "The document store is temporarily unavailable. Please retry.";
  }

  public String getUserMessage() {
    return userMessage;
  }

  public boolean isRetryable() {
    return true;
  }
}
