package com.flamingo.ai.argumentation.service.argument;

import com.flamingo.ai.argumentation.config.ArgumentationConfig;
import com.flamingo.ai.argumentation.service.argument.model.ParagraphSegment;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits a text into paragraphs at blank lines ({@code \n\n}) and recovers each paragraph's
 * character offsets in the original text.
 *
 * <p>Candidates are stripped and those shorter than {@code argumentation.paragraphs.min-words} are
 * discarded. Each remaining candidate is searched from a forward-only cursor, first verbatim and
 * then with whitespace runs collapsed to single spaces. A paragraph found by neither search is
 * dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ParagraphSegmenter {

  static final String PARAGRAPH_SEPARATOR = "\n\n";

  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern EDGE_WHITESPACE =
      Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

  private final ArgumentationConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Segments the text.
   *
   * @param text the original text
   * @return located paragraphs in text order
   */
  public List<ParagraphSegment> segment(String text) {
    return locate(text, splitIntoParagraphs(text));
  }

  /** Finds each candidate in the text from a forward-only cursor; unmatched ones are dropped. */
  List<ParagraphSegment> locate(String text, List<String> candidates) {
    List<ParagraphSegment> segments = new ArrayList<>(candidates.size());
    int cursor = 0;

    for (String paragraph : candidates) {
      int start = text.indexOf(paragraph, cursor);
      int end;
      if (start >= 0) {
        end = start + paragraph.length();
      } else {
        String normalized = normalizeWhitespace(paragraph);
        start = text.indexOf(normalized, cursor);
        if (start < 0) {
          log.debug(
              "Dropping paragraph not found after offset {}: '{}'",
              cursor,
              abbreviate(paragraph));
          meterRegistry.counter("argument.paragraphs.dropped").increment();
          continue;
        }
        end = start + normalized.length();
      }
      segments.add(new ParagraphSegment(paragraph, start, end));
      cursor = end;
    }

    log.debug(
        "Segmented text into {} paragraphs ({} candidates)", segments.size(), candidates.size());
    return segments;
  }

  /** Splits at blank lines, strips and drops candidates under the word threshold. */
  List<String> splitIntoParagraphs(String text) {
    int minWords = config.getParagraphs().getMinWords();
    List<String> paragraphs = new ArrayList<>();
    for (String raw : text.split(PARAGRAPH_SEPARATOR, -1)) {
      String stripped = stripWhitespace(raw);
      if (!stripped.isEmpty() && countWords(stripped) >= minWords) {
        paragraphs.add(stripped);
      }
    }
    return paragraphs;
  }

  /**
   * Counts whitespace-delimited words.
   *
   * @param text any text
   * @return number of words, 0 for blank text
   */
  public static int countWords(String text) {
    String stripped = text == null ? "" : normalizeWhitespace(text);
    if (stripped.isEmpty()) {
      return 0;
    }
    return stripped.split(" ").length;
  }

  static String normalizeWhitespace(String text) {
    return stripWhitespace(WHITESPACE.matcher(text).replaceAll(" "));
  }

  /** Strips leading and trailing Unicode whitespace, including no-break spaces. */
  static String stripWhitespace(String text) {
    return EDGE_WHITESPACE.matcher(text).replaceAll("");
  }

  private static String abbreviate(String text) {
    return text.length() <= 60 ? text : text.substring(0, 60) + "...";
  }
}
