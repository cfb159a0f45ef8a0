package com.scholary.songgen.lyrics;

import java.util.List;

/**
 * A language-model backend that writes lyrics and suggests genres.
 *
 * <p>All methods throw {@link LyricsProviderException} when the backend cannot be reached or
 * returns something unusable.
 */
public interface LyricsProvider {

  /** Short identifier, e.g. "openai". */
  String name();

  String model();

  /** Writes section-marked lyrics for {@code prompt} following {@code systemPrompt}. */
  String generateLyrics(String prompt, String systemPrompt);

  /**
   * Suggests a single genre, lowercased.
   *
   * @param genrePrompt extra instructions appended to the built-in one, may be blank
   */
  String extractGenre(String prompt, String genrePrompt);

  /** Suggests a few compatible genres, lowercased and in the order the model gave them. */
  List<String> inferGenres(String prompt);

  /** Writes lyrics that lean on the style of {@code genres}. */
  String generateLyricsWithGenres(String prompt, List<String> genres);
}
