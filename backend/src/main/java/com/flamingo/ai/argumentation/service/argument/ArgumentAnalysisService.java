package com.flamingo.ai.argumentation.service.argument;

import com.flamingo.ai.argumentation.service.argument.model.ArgumentAnalysis;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ExtractedComponents;
import com.flamingo.ai.argumentation.service.argument.model.ParagraphAnalysis;
import com.flamingo.ai.argumentation.service.argument.model.TaggedText;
import java.util.List;

/** Service interface for argument component extraction and paragraph strength analysis. */
public interface ArgumentAnalysisService {

  /**
   * Tags the text with the tagging model and runs the full pipeline. When the model is not ready
   * the result has no components, and paragraphs are scored as containing none.
   *
   * @param text trimmed, non-empty text
   * @return components and paragraph metrics
   */
  ArgumentAnalysis analyze(String text);

  /**
   * Runs the full pipeline on tags produced elsewhere.
   *
   * @param text the text the tags refer to
   * @param tagged tokens and labels
   * @return components and paragraph metrics
   */
  ArgumentAnalysis analyzeTagged(String text, TaggedText tagged);

  /**
   * Aligns offsets and decodes components without paragraph scoring.
   *
   * @param text the text the tags refer to
   * @param tagged tokens and labels
   * @return premises and conclusions in text order
   */
  ExtractedComponents extractComponents(String text, TaggedText tagged);

  /**
   * Segments and scores paragraphs against known components.
   *
   * @param text the source text
   * @param premises premises, with or without offsets
   * @param conclusions conclusions, with or without offsets
   * @return paragraph metrics in text order
   */
  List<ParagraphAnalysis> analyzeParagraphs(
      String text, List<ArgumentComponent> premises, List<ArgumentComponent> conclusions);
}
