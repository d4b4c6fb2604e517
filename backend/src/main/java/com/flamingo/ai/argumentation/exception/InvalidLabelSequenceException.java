package com.flamingo.ai.argumentation.exception;

/** Exception thrown when a label sequence cannot be decoded at all. */
public class InvalidLabelSequenceException extends ArgumentAnalysisException {

  public InvalidLabelSequenceException(String message) {
    super(message);
  }

  @Override
  public String getErrorCode() {
    return ApiError.INVALID_LABEL_SEQUENCE;
  }
}
