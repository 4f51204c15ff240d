package dev.codex.ingestion.metadata;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Pattern-based extractors for municipal code and statute text. All methods are pure. */
final class LegalPatterns {

  private static final Pattern TABLE = Pattern.compile("\\|.*?\\|.*?\\n\\s*\\|[-:| ]+\\|");
  private static final Pattern LIST =
      Pattern.compile("(?m)(?:^|(?<=[.:;]\\s))\\((?:\\d+|[a-z])\\)\\s");

  private static final List<Pattern> DEFINITIONS =
      List.of(
          Pattern.compile("[\"“]([^\"”]+)[\"”]\\s+(?i:shall\\s+mean|means)\\b"),
          Pattern.compile("\\b(\\p{Lu}\\p{Ll}+(?:\\s+\\p{Lu}\\p{Ll}+)*)\\s+means\\b"),
          Pattern.compile("(?i:the\\s+term)\\s+[\"“]([^\"”]+)[\"”]"));

  private static final List<Pattern> CITATIONS =
      List.of(
          Pattern.compile("\\b\\d+\\s+U\\.S\\.C\\.\\s*§+\\s*\\d+[a-z]?(?:[.\\-]\\d+[a-z]?)*"),
          Pattern.compile("\\bFla\\.\\s+Stat\\.(?:\\s*§+\\s*\\d+(?:\\.\\d+)*)?"),
          Pattern.compile("\\b\\d+\\s+\\p{Lu}\\p{Ll}+\\.(?:\\s+\\d[a-z]{1,2})?\\s+\\d+\\b"),
          Pattern.compile("§+\\s*\\d+(?:\\.\\d+)*"));

  private static final List<Pattern> CROSS_REFERENCES =
      List.of(
          Pattern.compile("(?:\\bSection|\\bSec\\.|§)\\s*(\\d+(?:\\.\\d+)*)"),
          Pattern.compile("nodeId=[^\\s)]*?(\\d+\\.\\d+)"));

  private static final String NAME = "\\p{Lu}\\p{Ll}+(?:\\s+\\p{Lu}\\p{Ll}+)*";
  private static final List<Pattern> LEGAL_ENTITIES =
      List.of(
          Pattern.compile("\\bCity of " + NAME + "\\b"),
          Pattern.compile("\\b\\p{Lu}\\p{Ll}+\\s+County\\b"),
          Pattern.compile("\\bState of \\p{Lu}\\p{Ll}+\\b"),
          Pattern.compile("\\b\\p{Lu}\\p{Ll}+\\s+Commission\\b"));

  private static final Pattern KEY_PHRASE =
      Pattern.compile("\\b\\p{Lu}\\p{Ll}+(?:\\s+\\p{Lu}\\p{Ll}+){1,3}\\b");
  private static final Set<String> KEY_PHRASE_NOISE =
      Set.of("The City", "As Provided", "In Accordance");
  static final int MAX_KEY_PHRASES = 10;

  private static final Pattern NUMBER = Pattern.compile("\\d+");
  private static final Pattern CITATION_MARKER = Pattern.compile("§|\\d+\\.\\d+");
  private static final Pattern CAPITALIZED_WORD = Pattern.compile("\\b\\p{Lu}\\p{Ll}+\\b");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private LegalPatterns() {
    // utility class
  }

  static boolean hasTable(String text) {
    return TABLE.matcher(text).find();
  }

  static boolean hasList(String text) {
    return LIST.matcher(text).find();
  }

  static List<String> definitions(String text) {
    return sortedGroupMatches(DEFINITIONS, text, 1);
  }

  static List<String> citations(String text) {
    return sortedGroupMatches(CITATIONS, text, 0);
  }

  static List<String> crossReferences(String text) {
    return sortedGroupMatches(CROSS_REFERENCES, text, 1);
  }

  static List<String> legalEntities(String text) {
    return sortedGroupMatches(LEGAL_ENTITIES, text, 0);
  }

  static List<String> keyPhrases(String text) {
    Set<String> phrases = new LinkedHashSet<>();
    Matcher m = KEY_PHRASE.matcher(text);
    while (m.find() && phrases.size() < MAX_KEY_PHRASES) {
      String phrase = collapseWhitespace(m.group());
      if (!KEY_PHRASE_NOISE.contains(phrase)) {
        phrases.add(phrase);
      }
    }
    return List.copyOf(phrases);
  }

  /**
   * Information density heuristic: half type-token ratio, plus numeric, citation-marker and
   * capitalized-word densities weighted 0.2, 0.2 and 0.1, clamped to [0, 1].
   */
  static double semanticDensity(String text) {
    String stripped = text.strip();
    if (stripped.isEmpty()) {
      return 0.0;
    }
    String[] words = WHITESPACE.split(stripped.toLowerCase(Locale.ROOT));
    double total = words.length;
    double uniqueRatio = new HashSet<>(Arrays.asList(words)).size() / total;
    double numbers = count(NUMBER, text) / total;
    double citations = count(CITATION_MARKER, text) / total;
    double capitalized = count(CAPITALIZED_WORD, text) / total;
    double density = uniqueRatio * 0.5 + numbers * 0.2 + citations * 0.2 + capitalized * 0.1;
    return Math.max(0.0, Math.min(1.0, density));
  }

  private static List<String> sortedGroupMatches(List<Pattern> patterns, String text, int group) {
    Set<String> found = new TreeSet<>();
    for (Pattern pattern : patterns) {
      Matcher m = pattern.matcher(text);
      while (m.find()) {
        String value = collapseWhitespace(m.group(group)).strip();
        if (!value.isEmpty()) {
          found.add(value);
        }
      }
    }
    return List.copyOf(found);
  }

  private static int count(Pattern pattern, String text) {
    Matcher m = pattern.matcher(text);
    int count = 0;
    while (m.find()) {
      count++;
    }
    return count;
  }

  private static String collapseWhitespace(String value) {
    return WHITESPACE.matcher(value).replaceAll(" ");
  }
}
