package dev.codex.ingestion.assembly;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** Reads section numbering and titles from the leading line of a chunk. */
final class SectionParser {

  private static final Pattern NUMBERED =
      Pattern.compile("^(\\d+(?:\\.\\d+)+)\\.?\\s*[-—–]\\s*(.+?)\\.?\\s*$");
  private static final Pattern ARTICLE_HEADING =
      Pattern.compile("^(ARTICLE\\s+[IVXLCDM]+)\\b\\.?\\s*(?:[-—–:]\\s*(.+?))?\\.?\\s*$");
  private static final Pattern SECTION_SIGN =
      Pattern.compile(
          "^(?:§+|Sec\\.|Section)\\s*(\\d+(?:\\.\\d+)*)\\.?\\s*(?:[-—–]\\s*)?(.*?)\\.?\\s*$");
  private static final Pattern ARTICLE_MENTION = Pattern.compile("\\bARTICLE\\s+[IVXLCDM]+\\b");

  private SectionParser() {
    // utility class
  }

  /**
   * Parses section information.
   *
   * @param leadingSentence the chunk's first sentence
   * @param chunkText the full chunk text, searched for an article mention
   */
  static SectionInfo parse(String leadingSentence, String chunkText) {
    String leadingLine = firstLine(leadingSentence);
    String article = findArticle(chunkText);

    Matcher m = NUMBERED.matcher(leadingLine);
    if (m.matches()) {
      String id = m.group(1);
      return new SectionInfo(id, m.group(2), article, dottedParent(id, article), levelOf(id));
    }
    m = ARTICLE_HEADING.matcher(leadingLine);
    if (m.matches()) {
      String id = collapse(m.group(1));
      String title = m.group(2) != null ? m.group(2) : id;
      return new SectionInfo(id, title, article != null ? article : id, null, 0);
    }
    m = SECTION_SIGN.matcher(leadingLine);
    if (m.matches()) {
      String id = m.group(1);
      String title = m.group(2).isBlank() ? "Section " + id : m.group(2);
      return new SectionInfo(id, title, article, dottedParent(id, article), levelOf(id));
    }
    return new SectionInfo(SectionInfo.UNKNOWN_ID, SectionInfo.UNKNOWN_TITLE, article, article, 0);
  }

  private static @Nullable String findArticle(String text) {
    Matcher m = ARTICLE_MENTION.matcher(text);
    return m.find() ? collapse(m.group()) : null;
  }

  private static @Nullable String dottedParent(String id, @Nullable String article) {
    int lastDot = id.lastIndexOf('.');
    return lastDot > 0 ? id.substring(0, lastDot) : article;
  }

  private static int levelOf(String id) {
    return id.split("\\.").length - 1;
  }

  private static String firstLine(String text) {
    int newline = text.indexOf('\n');
    return newline >= 0 ? text.substring(0, newline) : text;
  }

  private static String collapse(String text) {
    return text.replaceAll("\\s+", " ");
  }
}
