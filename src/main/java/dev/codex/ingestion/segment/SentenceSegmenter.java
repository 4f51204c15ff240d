package dev.codex.ingestion.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Splits normalized ordinance text into sentences.
 *
 * <p>Segmentation runs in two passes:
 *
 * <ol>
 *   <li>Tokenization: paragraphs are split at blank lines, then each paragraph is cut after
 *       {@code .}, {@code !} or {@code ?} (plus closing quotes or brackets) followed by whitespace,
 *       unless the period belongs to a non-terminal abbreviation such as "Fla." or "§101.".
 *   <li>Merge: a sentence ending with a legal abbreviation is joined with the next sentence when
 *       that one starts lowercase. The pass goes left to right and looks at each pair once; a merged
 *       sentence is not compared again with its new successor.
 * </ol>
 */
@Component
public class SentenceSegmenter {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n\\s*");
  private static final Pattern TERMINAL = Pattern.compile("[.!?]+[\"'”’)\\]]*(?=\\s)");

  private final Abbreviations abbreviations;

  public SentenceSegmenter() {
    this(Abbreviations.legal());
  }

  public SentenceSegmenter(Abbreviations abbreviations) {
    this.abbreviations = abbreviations;
  }

  /**
   * Segments normalized text.
   *
   * @param text output of {@link TextNormalizer#normalize}
   * @return sentences in document order; empty for blank text
   */
  public List<Sentence> segment(String text) {
    if (text.isBlank()) {
      return List.of();
    }
    List<Sentence> tokenized = new ArrayList<>();
    Matcher breaks = PARAGRAPH_BREAK.matcher(text);
    int paragraphStart = 0;
    while (breaks.find()) {
      splitParagraph(text, paragraphStart, breaks.start(), tokenized);
      paragraphStart = breaks.end();
    }
    splitParagraph(text, paragraphStart, text.length(), tokenized);
    return mergeAbbreviationSplits(tokenized);
  }

  /** Undoes false splits after abbreviations when the continuation starts lowercase. */
  List<Sentence> mergeAbbreviationSplits(List<Sentence> sentences) {
    List<Sentence> merged = new ArrayList<>(sentences.size());
    int i = 0;
    while (i < sentences.size()) {
      Sentence current = sentences.get(i);
      if (i + 1 < sentences.size()
          && abbreviations.endsWithAbbreviation(current.text())
          && startsLowercase(sentences.get(i + 1).text())) {
        merged.add(current.mergeWith(sentences.get(i + 1)));
        i += 2;
      } else {
        merged.add(current);
        i++;
      }
    }
    return merged;
  }

  private void splitParagraph(String text, int from, int to, List<Sentence> out) {
    boolean paragraphStart = true;
    int sentenceStart = from;
    Matcher terminal = TERMINAL.matcher(text).region(from, to);
    while (terminal.find()) {
      if (text.charAt(terminal.start()) == '.'
          && isNonTerminal(text, sentenceStart, terminal.start())) {
        continue;
      }
      paragraphStart = addSentence(text, sentenceStart, terminal.end(), paragraphStart, out);
      sentenceStart = terminal.end();
    }
    addSentence(text, sentenceStart, to, paragraphStart, out);
  }

  private boolean isNonTerminal(String text, int sentenceStart, int periodIndex) {
    int tokenStart = periodIndex;
    while (tokenStart > sentenceStart && !Character.isWhitespace(text.charAt(tokenStart - 1))) {
      tokenStart--;
    }
    String token = text.substring(tokenStart, periodIndex + 1);
    boolean sentenceHead = text.substring(sentenceStart, tokenStart).isBlank();
    return abbreviations.isNonTerminal(token, sentenceHead);
  }

  /** Adds the trimmed span if non-blank; returns the paragraph-start flag for the next sentence. */
  private static boolean addSentence(
      String text, int from, int to, boolean paragraphStart, List<Sentence> out) {
    int start = from;
    while (start < to && Character.isWhitespace(text.charAt(start))) {
      start++;
    }
    int end = to;
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    if (start == end) {
      return paragraphStart;
    }
    out.add(new Sentence(text.substring(start, end), start, paragraphStart));
    return false;
  }

  private static boolean startsLowercase(String sentence) {
    return !sentence.isEmpty() && Character.isLowerCase(sentence.charAt(0));
  }
}
