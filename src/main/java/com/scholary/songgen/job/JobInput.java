package com.scholary.songgen.job;

import java.util.List;

/**
 * What the client asked for. Either {@code genre} and {@code lyrics} are both present, or {@code
 * prompt} is present so the missing pieces can be generated.
 */
public record JobInput(
    String prompt,
    String genre,
    List<String> genres,
    String lyrics,
    String songName,
    String userId,
    InferenceTuning tuning) {

  public JobInput {
    genres = genres == null ? List.of() : List.copyOf(genres);
    tuning = tuning == null ? InferenceTuning.DEFAULTS : tuning;
  }

  public static JobInput of(String prompt, String genre, String lyrics) {
    return new JobInput(prompt, genre, List.of(), lyrics, null, null, null);
  }

  public boolean hasPrompt() {
    return prompt != null && !prompt.isBlank();
  }

  public boolean hasGenre() {
    return genre != null && !genre.isBlank();
  }

  public boolean hasGenres() {
    return !genres.isEmpty();
  }

  public boolean hasLyrics() {
    return lyrics != null && !lyrics.isBlank();
  }
}
