package com.flamingo.ai.argumentation.exception;

/** Exception thrown when token, label and offset sequences are not 1:1. */
public class MisalignedSequenceException extends ArgumentAnalysisException {

  private final int expected;
  private final int actual;

  public MisalignedSequenceException(int tokenCount, int labelCount) {
    this(
        "Expected one label per token but got "
            + labelCount
            + " labels for "
            + tokenCount
            + " tokens",
        tokenCount,
        labelCount);
  }

  public MisalignedSequenceException(String message, int expected, int actual) {
    super(message);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }

  @Override
  public String getErrorCode() {
    return ApiError.MISALIGNED_SEQUENCE;
  }
}
