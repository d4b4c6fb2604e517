package com.flamingo.ai.argumentation.service.tagging;

import com.flamingo.ai.argumentation.service.argument.model.TaggedText;

/**
 * Producer of tokens and BIO labels for a text. Implementations wrap a pretrained sequence model
 * and own timeouts, retries and failure handling.
 */
public interface TagSource {

  /**
   * Tokenizes and labels a text.
   *
   * @param text the text to tag, already trimmed and non-empty
   * @return tokens with parallel labels; empty when the model could not produce a result
   */
  TaggedText tag(String text);

  /**
   * Checks whether the underlying model can serve requests.
   *
   * @return true if the model is loaded and reachable
   */
  boolean isAvailable();
}
