package com.scholary.songgen.genre;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps free-form genre strings onto the fixed vocabulary the audio model was trained with.
 *
 * <p>Matching runs in stages and stops at the first hit:
 *
 * <ol>
 *   <li>exact match after trimming and lowercasing
 *   <li>exact match after dropping everything that is not a letter, digit or whitespace
 *   <li>a small alias table for common spellings ("hiphop", "rb", "pop music", ...)
 *   <li>substring match in either direction, first vocabulary entry in lexicographic order wins
 *   <li>the configured fallback genre
 * </ol>
 *
 * <p>The result is always a member of the vocabulary. Instances are immutable and thread-safe.
 */
public class GenreMatcher {

  private static final Map<String, String> ALIASES =
      Map.of(
          "hiphop", "hip-hop",
          "hip hop", "hip-hop",
          "rb", "r&b",
          "randb", "r&b",
          "rhythm and blues", "r&b",
          "electronica", "electronic",
          "classical music", "classical",
          "pop music", "pop",
          "rock music", "rock");

  private final NavigableSet<String> validGenres;
  private final String fallback;

  public GenreMatcher(Collection<String> validGenres, String fallback) {
    TreeSet<String> normalized = new TreeSet<>();
    for (String genre : validGenres) {
      if (genre != null && !genre.isBlank()) {
        normalized.add(normalize(genre));
      }
    }
    String normalizedFallback = fallback == null ? "" : normalize(fallback);
    if (!normalized.contains(normalizedFallback)) {
      throw new IllegalArgumentException(
          "Fallback genre '" + fallback + "' is not part of the genre vocabulary");
    }
    this.validGenres = Collections.unmodifiableNavigableSet(normalized);
    this.fallback = normalizedFallback;
  }

  /** Returns the vocabulary genre closest to {@code candidate}. Never returns null. */
  public String match(String candidate) {
    if (candidate == null) {
      return fallback;
    }
    String genre = normalize(candidate);
    if (genre.isEmpty()) {
      return fallback;
    }
    if (validGenres.contains(genre)) {
      return genre;
    }

    String cleaned = stripSpecialCharacters(genre);
    if (validGenres.contains(cleaned)) {
      return cleaned;
    }

    String alias = ALIASES.getOrDefault(genre, ALIASES.get(cleaned));
    if (alias != null && validGenres.contains(alias)) {
      return alias;
    }

    for (String valid : validGenres) {
      if (genre.contains(valid) || valid.contains(genre)) {
        return valid;
      }
    }
    return fallback;
  }

  /**
   * Matches every candidate and de-duplicates the results, keeping first-seen order. Fallback hits
   * are dropped whenever at least one candidate matched something else; if nothing matched, the
   * result is the fallback alone.
   */
  public List<String> matchMany(Collection<String> candidates) {
    Set<String> matched = new LinkedHashSet<>();
    if (candidates != null) {
      for (String candidate : candidates) {
        matched.add(match(candidate));
      }
    }
    if (matched.size() > 1) {
      matched.remove(fallback);
    }
    if (matched.isEmpty()) {
      matched.add(fallback);
    }
    return new ArrayList<>(matched);
  }

  /**
   * True when {@code candidate} resolves to something other than the fallback, or literally names
   * the fallback genre.
   */
  public boolean isRecognized(String candidate) {
    if (candidate == null) {
      return false;
    }
    return !match(candidate).equals(fallback) || normalize(candidate).equals(fallback);
  }

  public String fallback() {
    return fallback;
  }

  public Set<String> vocabulary() {
    return validGenres;
  }

  private static String normalize(String value) {
    return value.trim().toLowerCase(Locale.ROOT);
  }

  private static String stripSpecialCharacters(String value) {
    StringBuilder cleaned = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isLetterOrDigit(c) || Character.isWhitespace(c)) {
        cleaned.append(c);
      }
    }
    return cleaned.toString().trim();
  }
}
