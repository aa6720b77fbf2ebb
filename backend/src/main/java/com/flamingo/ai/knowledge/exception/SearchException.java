package com.flamingo.ai.knowledge.exception;

/** Exception thrown when a search cannot be served. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
