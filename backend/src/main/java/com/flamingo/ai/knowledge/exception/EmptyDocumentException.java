package com.flamingo.ai.knowledge.exception;

/** Thrown at ingestion entry when a document has no pages or only blank pages. */
public class EmptyDocumentException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public EmptyDocumentException(String documentId) {
    super("Document has no text content: " + documentId);
    this.documentId = documentId;
    this.userMessage = "The document contains no text to ingest";
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
