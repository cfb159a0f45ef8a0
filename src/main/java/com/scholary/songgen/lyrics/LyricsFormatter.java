package com.scholary.songgen.lyrics;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Makes sure lyrics carry section markers before they reach the audio model.
 *
 * <p>Lyrics that already contain a known marker pass through unchanged. Unmarked lyrics are split
 * into sections by line count; blank lyrics are replaced with a short placeholder song.
 */
@Component
public class LyricsFormatter {

  static final String PLACEHOLDER_LYRICS =
      """
      [verse]
      Your melody flows like a gentle stream
      Through the silence of my heart
      Every note you sing becomes my dream
      A masterpiece of art

      [chorus]
      In this symphony of life we're writing
      Each moment a brand new song
      With every breath our souls uniting
      Together we belong""";

  private static final List<String> SECTION_MARKERS =
      List.of("[verse]", "[chorus]", "[bridge]", "[intro]", "[outro]");

  public String format(String lyrics) {
    if (lyrics == null || lyrics.isBlank() || lyrics.trim().equalsIgnoreCase("none")) {
      return PLACEHOLDER_LYRICS;
    }

    String lower = lyrics.toLowerCase(Locale.ROOT);
    if (SECTION_MARKERS.stream().anyMatch(lower::contains)) {
      return lyrics;
    }

    List<String> lines =
        Arrays.stream(lyrics.split("\\R")).map(String::trim).filter(l -> !l.isEmpty()).toList();

    if (lines.size() <= 4) {
      return section("verse", lines);
    }
    if (lines.size() <= 8) {
      int mid = lines.size() / 2;
      return section("verse", lines.subList(0, mid))
          + "\n\n"
          + section("chorus", lines.subList(mid, lines.size()));
    }
    int quarter = lines.size() / 4;
    return section("verse", lines.subList(0, quarter))
        + "\n\n"
        + section("chorus", lines.subList(quarter, quarter * 2))
        + "\n\n"
        + section("verse", lines.subList(quarter * 2, quarter * 3))
        + "\n\n"
        + section("chorus", lines.subList(quarter * 3, lines.size()));
  }

  private static String section(String name, List<String> lines) {
    return "[" + name + "]\n" + String.join("\n", lines);
  }
}
