package com.flamingo.ai.knowledge.exception;

/** Thrown when a vector does not have the store's configured dimension. */
public class EmbeddingDimensionException extends RuntimeException {

  private final int expected;
  private final int actual;

  public EmbeddingDimensionException(String subject, int expected, int actual) {
    super(
        String.format(
            "Embedding dimension mismatch for %s: expected %d but was %d",
            subject, expected, actual));
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
