package com.flamingo.ai.argumentation.service.argument;

import com.flamingo.ai.argumentation.service.argument.model.ArgumentAnalysis;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ExtractedComponents;
import com.flamingo.ai.argumentation.service.argument.model.ParagraphAnalysis;
import com.flamingo.ai.argumentation.service.argument.model.ParagraphSegment;
import com.flamingo.ai.argumentation.service.argument.model.TaggedText;
import com.flamingo.ai.argumentation.service.argument.model.TokenSpan;
import com.flamingo.ai.argumentation.service.tagging.TaggingModelService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of {@link ArgumentAnalysisService}. Runs offset alignment, component extraction,
 * paragraph segmentation and scoring in sequence; holds no state between calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArgumentAnalysisServiceImpl implements ArgumentAnalysisService {

  private final TaggingModelService taggingModelService;
  private final OffsetAligner offsetAligner;
  private final ComponentExtractor componentExtractor;
  private final ParagraphSegmenter paragraphSegmenter;
  private final ParagraphScorer paragraphScorer;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "argument.analyze", description = "Time to tag and analyze a text")
  public ArgumentAnalysis analyze(String text) {
    TaggedText tagged = taggingModelService.tag(text);
    if (tagged.isEmpty()) {
      log.debug("No tags available for text of {} chars", text.length());
    }
    return analyzeTagged(text, tagged);
  }

  @Override
  @Timed(value = "argument.analyzeTagged", description = "Time to analyze a pre-tagged text")
  public ArgumentAnalysis analyzeTagged(String text, TaggedText tagged) {
    ExtractedComponents components = extractComponents(text, tagged);
    List<ParagraphAnalysis> paragraphs =
        analyzeParagraphs(text, components.premises(), components.conclusions());

    log.info(
        "Analysis complete: {} premises, {} conclusions, {} paragraphs",
        components.premises().size(),
        components.conclusions().size(),
        paragraphs.size());

    return new ArgumentAnalysis(
        components.premises(), components.conclusions(), paragraphs, Instant.now());
  }

  @Override
  public ExtractedComponents extractComponents(String text, TaggedText tagged) {
    if (tagged == null || tagged.isEmpty()) {
      return ExtractedComponents.empty();
    }
    List<TokenSpan> spans = offsetAligner.align(tagged.tokens(), text);
    ExtractedComponents components =
        componentExtractor.extract(tagged.tokens(), spans, tagged.labels());

    meterRegistry
        .counter("argument.components.extracted", "kind", "premise")
        .increment(components.premises().size());
    meterRegistry
        .counter("argument.components.extracted", "kind", "conclusion")
        .increment(components.conclusions().size());
    return components;
  }

  @Override
  @Timed(value = "argument.paragraphs", description = "Time to segment and score paragraphs")
  public List<ParagraphAnalysis> analyzeParagraphs(
      String text, List<ArgumentComponent> premises, List<ArgumentComponent> conclusions) {
    List<ParagraphSegment> segments = paragraphSegmenter.segment(text);
    return paragraphScorer.score(segments, premises, conclusions);
  }
}
