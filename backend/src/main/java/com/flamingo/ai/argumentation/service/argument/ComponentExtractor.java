package com.flamingo.ai.argumentation.service.argument;

import com.flamingo.ai.argumentation.domain.enums.ArgumentLabel;
import com.flamingo.ai.argumentation.domain.enums.ComponentKind;
import com.flamingo.ai.argumentation.exception.InvalidLabelSequenceException;
import com.flamingo.ai.argumentation.exception.MisalignedSequenceException;
import com.flamingo.ai.argumentation.service.argument.model.ArgumentComponent;
import com.flamingo.ai.argumentation.service.argument.model.ExtractedComponents;
import com.flamingo.ai.argumentation.service.argument.model.Token;
import com.flamingo.ai.argumentation.service.argument.model.TokenSpan;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes a BIO label sequence into premise and conclusion spans.
 *
 * <p>Each class has its own {@link SpanAccumulator}. A token whose label belongs to the class
 * extends the current run; any other label closes it. Both accumulators are flushed after the last
 * token. {@code B-} and {@code I-} are not distinguished, so two adjacent spans of the same class
 * without an {@code O} between them are merged.
 *
 * <p>The tag source assigns exactly one label per token, so a token never belongs to both classes.
 */
@Component
@Slf4j
public class ComponentExtractor {

  /**
   * Extracts components.
   *
   * @param tokens tokens in text order
   * @param spans resolved offsets, parallel to {@code tokens}
   * @param labels raw labels, parallel to {@code tokens}
   * @return premises and conclusions in text order
   * @throws MisalignedSequenceException if the three sequences differ in length
   * @throws InvalidLabelSequenceException if {@code labels} is missing
   */
  public ExtractedComponents extract(
      List<Token> tokens, List<TokenSpan> spans, List<String> labels) {
    if (labels == null) {
      throw new InvalidLabelSequenceException("Label sequence is missing");
    }
    if (tokens.size() != labels.size()) {
      throw new MisalignedSequenceException(tokens.size(), labels.size());
    }
    if (tokens.size() != spans.size()) {
      throw new MisalignedSequenceException(
          "Expected one offset span per token but got "
              + spans.size()
              + " spans for "
              + tokens.size()
              + " tokens",
          tokens.size(),
          spans.size());
    }

    SpanAccumulator premises = new SpanAccumulator(ComponentKind.PREMISE);
    SpanAccumulator conclusions = new SpanAccumulator(ComponentKind.CONCLUSION);
    List<ArgumentComponent> premiseList = new ArrayList<>();
    List<ArgumentComponent> conclusionList = new ArrayList<>();

    for (int i = 0; i < tokens.size(); i++) {
      ArgumentLabel label = ArgumentLabel.parse(labels.get(i));
      String tokenText = tokens.get(i).text();
      TokenSpan span = spans.get(i);
      step(premises, label, tokenText, span, premiseList);
      step(conclusions, label, tokenText, span, conclusionList);
    }

    premises.close().ifPresent(premiseList::add);
    conclusions.close().ifPresent(conclusionList::add);

    log.debug(
        "Extracted {} premises and {} conclusions from {} tokens",
        premiseList.size(),
        conclusionList.size(),
        tokens.size());
    return new ExtractedComponents(premiseList, conclusionList);
  }

  private void step(
      SpanAccumulator accumulator,
      ArgumentLabel label,
      String tokenText,
      TokenSpan span,
      List<ArgumentComponent> sink) {
    if (label.belongsTo(accumulator.kind())) {
      accumulator.accept(tokenText, span);
    } else {
      accumulator.close().ifPresent(sink::add);
    }
  }
}
