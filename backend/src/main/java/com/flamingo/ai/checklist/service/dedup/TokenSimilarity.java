package com.flamingo.ai.checklist.service.dedup;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Case- and whitespace-insensitive token-set similarity. */
public final class TokenSimilarity {

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

  private TokenSimilarity() {}

  /** Lowercase letter/digit tokens of {@code text}, in first-occurrence order. */
  public static Set<String> tokens(String text) {
    if (text == null || text.isBlank()) {
      return Set.of();
    }
    Set<String> tokens = new LinkedHashSet<>();
    Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
        .filter(token -> !token.isEmpty())
        .forEach(tokens::add);
    return tokens;
  }

  /** Jaccard index of two token sets. Two empty sets score 0. */
  public static double jaccard(Set<String> left, Set<String> right) {
    if (left.isEmpty() || right.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(left);
    intersection.retainAll(right);
    int union = left.size() + right.size() - intersection.size();
    return (double) intersection.size() / union;
  }

  public static double jaccard(String left, String right) {
    return jaccard(tokens(left), tokens(right));
  }

  /** Lowercased text with runs of whitespace collapsed. */
  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    return text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
