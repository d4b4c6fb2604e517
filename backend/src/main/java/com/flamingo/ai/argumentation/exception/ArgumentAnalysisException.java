package com.flamingo.ai.argumentation.exception;

/** Base class for input errors surfaced by the analysis pipeline. */
public abstract class ArgumentAnalysisException extends RuntimeException {

  protected ArgumentAnalysisException(String message) {
    super(message);
  }

  /** Machine-readable code reported in {@link ApiError#getCode()}. */
  public abstract String getErrorCode();
}
