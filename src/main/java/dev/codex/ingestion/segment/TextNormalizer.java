package dev.codex.ingestion.segment;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Light normalization applied to scraped ordinance text before sentence segmentation.
 *
 * <p>Removes municode navigation boilerplate, turns informative Markdown images into {@code [Image:
 * alt]} markers, strips control characters and collapses whitespace while keeping paragraph breaks
 * (a single blank line) intact.
 */
@Component
public class TextNormalizer {

  private static final Pattern SHARE_LINK =
      Pattern.compile("Share Link to section.*?Compare versions", Pattern.DOTALL);
  private static final Pattern PRINT_EMAIL = Pattern.compile("Print section.*?Email section");
  private static final Pattern LOADING =
      Pattern.compile("Loading, please wait|Show Changes.*?more", Pattern.DOTALL);
  private static final Pattern IMAGE = Pattern.compile("!\\[(.*?)\\]\\((.*?)\\)");
  private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
  private static final Pattern SPACE_RUN = Pattern.compile("[ \\t]+");
  private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");
  private static final Pattern NEWLINE_RUN = Pattern.compile("\\n{3,}");

  /** Alt texts this short carry no information worth keeping. */
  static final int MIN_ALT_TEXT_LENGTH = 10;

  private static final List<String> PLACEHOLDER_ALT_WORDS =
      List.of("logo", "icon", "button", "image");

  /**
   * Normalizes raw document text.
   *
   * @param raw the scraped text, possibly null
   * @return normalized text, or an empty string for null or blank input
   */
  public String normalize(@Nullable String raw) {
    if (raw == null || raw.isBlank()) {
      return "";
    }
    String text = raw.replace("\r\n", "\n").replace('\r', '\n');
    text = CONTROL.matcher(text).replaceAll("");
    text = SHARE_LINK.matcher(text).replaceAll("");
    text = PRINT_EMAIL.matcher(text).replaceAll("");
    text = LOADING.matcher(text).replaceAll("");
    text =
        IMAGE
            .matcher(text)
            .replaceAll(match -> Matcher.quoteReplacement(imageMarker(match.group(1))));
    text = SPACE_RUN.matcher(text).replaceAll(" ");
    text = SPACE_AROUND_NEWLINE.matcher(text).replaceAll("\n");
    text = NEWLINE_RUN.matcher(text).replaceAll("\n\n");
    return text.strip();
  }

  static String imageMarker(String altText) {
    String lower = altText.toLowerCase(Locale.ROOT);
    if (altText.length() > MIN_ALT_TEXT_LENGTH
        && PLACEHOLDER_ALT_WORDS.stream().noneMatch(lower::contains)) {
      return "[Image: " + altText + "]";
    }
    return "";
  }
}
