package dev.codex.ingestion.segment;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Abbreviation knowledge used by the {@link SentenceSegmenter}.
 *
 * <p>Two sets are kept apart. <em>Non-terminal</em> tokens (titles, citation abbreviations,
 * section signs, initials) never end a sentence during tokenization. <em>Merge</em> abbreviations
 * may legitimately end a sentence, so a split after one is only undone when the following sentence
 * starts with a lowercase letter.
 */
public final class Abbreviations {

  static final List<String> LEGAL_MERGE_ABBREVIATIONS =
      List.of(
          "U.S.", "Inc.", "Corp.", "Ltd.", "Co.", "Fla.", "Cal.", "N.Y.", "Stat.", "Rev.", "Art.",
          "Sec.", "No.", "v.", "et al.", "i.e.", "e.g.", "etc.", "Dr.", "Mr.", "Mrs.", "Ms.",
          "Prof.");

  static final Set<String> LEGAL_NON_TERMINAL =
      Set.of(
          "Mr.", "Mrs.", "Ms.", "Dr.", "Prof.", "Jr.", "Sr.", "St.", "Fla.", "Cal.", "Stat.",
          "Sec.", "Secs.", "Art.", "No.", "Nos.", "v.", "vs.", "Ch.", "Ord.", "Res.", "Ann.",
          "Supp.", "Fed.", "Reg.", "U.S.C.", "C.F.R.", "F.S.");

  /** Section and paragraph signs with an optional number, e.g. "§", "§ 101." or "¶3". */
  private static final String SIGN_ALTERNATIVES = "§+\\s*[\\d.\\-]*|¶+\\s*[\\d.]*";

  private static final Pattern SIGN_TOKEN = Pattern.compile("[§¶]+[\\d.\\-]*\\.");
  private static final Pattern INITIAL = Pattern.compile("\\p{Lu}\\.");
  private static final Pattern NUMBERING = Pattern.compile("\\d+(?:\\.\\d+)*\\.");

  private final Pattern trailingAbbreviation;
  private final Set<String> nonTerminal;

  public Abbreviations(Collection<String> mergeAbbreviations, Set<String> nonTerminal) {
    String alternatives =
        mergeAbbreviations.stream().map(Pattern::quote).collect(Collectors.joining("|"));
    this.trailingAbbreviation =
        Pattern.compile("(?:^|[\\s(\\[])(?:" + alternatives + "|" + SIGN_ALTERNATIVES + ")$");
    this.nonTerminal = Set.copyOf(nonTerminal);
  }

  /** Abbreviations found in municipal codes, statutes and case citations. */
  public static Abbreviations legal() {
    return new Abbreviations(LEGAL_MERGE_ABBREVIATIONS, LEGAL_NON_TERMINAL);
  }

  /** Whether the sentence ends with one of the merge abbreviations. */
  public boolean endsWithAbbreviation(String sentence) {
    return trailingAbbreviation.matcher(sentence.strip()).find();
  }

  /**
   * Whether a period-terminated token can never end a sentence.
   *
   * @param token the whitespace-delimited token including its final period
   * @param sentenceHead whether the token is the first of its sentence
   */
  public boolean isNonTerminal(String token, boolean sentenceHead) {
    String bare = stripOpeningPunctuation(token);
    return nonTerminal.contains(bare)
        || SIGN_TOKEN.matcher(bare).matches()
        || INITIAL.matcher(bare).matches()
        || (sentenceHead && NUMBERING.matcher(bare).matches());
  }

  private static String stripOpeningPunctuation(String token) {
    int i = 0;
    while (i < token.length() && "([\"'“‘".indexOf(token.charAt(i)) >= 0) {
      i++;
    }
    return token.substring(i);
  }
}
