package dev.codex.mcp;

import dev.codex.search.SearchResult;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Truncates search results to fit within a configurable token budget.
 *
 * <p>Tokens are estimated as characters / 4. Results are formatted as text blocks carrying the
 * jurisdiction, source document and chunk number for citation, then accumulated until the budget is
 * reached. If the first result alone exceeds the budget it is cut at the character level, so at
 * least one result is always returned.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${codex.mcp.token-budget:5000}") int tokenBudget) {
    if (tokenBudget < 1) {
      throw new IllegalArgumentException("codex.mcp.token-budget must be positive");
    }
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats and truncates search results to fit within the configured token budget.
   *
   * @param results ranked search results
   * @return formatted text containing as many results as fit within the budget
   */
  public String truncate(@Nullable List<SearchResult> results) {
    if (results == null || results.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < results.size(); i++) {
      String formatted = formatResult(i + 1, results.get(i));
      int resultTokens = estimateTokens(formatted);

      if (i == 0 && resultTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + resultTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += resultTokens;
    }

    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatResult(int index, SearchResult result) {
    return "## [%d] %s | %s #%d\nRelevance: %.3f\n\n%s\n\n---\n"
        .formatted(
            index,
            result.jurisdiction(),
            result.sourceDocumentId(),
            result.chunkNumber(),
            result.relevanceScore(),
            result.content());
  }
}
