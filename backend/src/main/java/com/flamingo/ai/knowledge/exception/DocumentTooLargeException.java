package com.flamingo.ai.knowledge.exception;

/** Thrown at ingestion entry when a document exceeds the configured size limits. */
public class DocumentTooLargeException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public DocumentTooLargeException(String documentId, String message, String userMessage) {
    super(message);
    this.documentId = documentId;
    this.userMessage = userMessage;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
