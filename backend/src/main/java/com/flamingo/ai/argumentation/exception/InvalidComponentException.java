package com.flamingo.ai.argumentation.exception;

/** Exception thrown when a caller-supplied component carries an impossible position. */
public class InvalidComponentException extends ArgumentAnalysisException {

  public InvalidComponentException(String message) {
    super(message);
  }

  @Override
  public String getErrorCode() {
    return ApiError.INVALID_COMPONENT;
  }
}
