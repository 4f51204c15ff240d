package dev.codex.ingestion.boundary;

import dev.codex.ingestion.segment.Sentence;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Places soft breaks before section headers and paragraph starts. Used when semantic boundaries
 * are disabled, and needs no embedding model.
 */
@Component
public class StructuralBoundaryDetector extends WordBudgetBoundaryDetector {

  /** "ARTICLE IV", "3.2 -" / "3.2 —", "Sec. 12", "Section 4", "§ 101". */
  static final Pattern SECTION_HEADER =
      Pattern.compile(
          "^(?:ARTICLE\\s+[IVXLCDM]+\\b|\\d+\\.\\d+(?:\\.\\d+)*\\.?\\s*[-—–]|(?:Sec\\.|Section|§)\\s*\\d+)");

  @Override
  protected boolean[] softBreaks(List<Sentence> sentences, BoundaryPolicy policy) {
    boolean[] breaks = new boolean[sentences.size() - 1];
    for (int i = 0; i < breaks.length; i++) {
      Sentence next = sentences.get(i + 1);
      breaks[i] = next.paragraphStart() || isSectionHeader(next.text());
    }
    return breaks;
  }

  static boolean isSectionHeader(String text) {
    return SECTION_HEADER.matcher(text).find();
  }
}
