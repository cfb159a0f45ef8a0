package com.scholary.songgen.lyrics;

import java.util.List;

/** Built-in system prompts. The lyrics and genre prompts can be overridden through PromptStore. */
public final class LyricsPrompts {

  public static final String DEFAULT_LYRICS_PROMPT =
      """
      You are a professional songwriter. Generate song lyrics based on the given prompt.
      The lyrics MUST follow this exact structure and format:
      - [verse]
      - [chorus]
      - [verse]
      - [chorus]
      - [bridge]
      - [outro]

      Each section should be separated by exactly two newlines.
      Within each section, lines should be separated by a single newline.
      Each section should be marked with its type in square brackets (e.g., [verse], [chorus]).

      Example format:
      [verse]
      Line 1
      Line 2
      Line 3
      Line 4

      [chorus]
      Line 1
      Line 2
      Line 3
      Line 4

      Do not include any explanations or additional text, just the lyrics in the specified format.
      """;

  static final String GENRE_INSTRUCTION =
      """
      Based on the given prompt, determine the most suitable musical genre for the song.
      Respond with just a single genre (e.g., 'rock', 'pop', 'jazz', 'hip-hop', 'blues').
      Do not include any explanations or additional text.""";

  static final String GENRE_INFERENCE_INSTRUCTION =
      """
      As a music expert, analyze the given prompt and suggest 2-3 musical genres that would work \
      well together. Consider the theme and mood of the prompt and common genre combinations in \
      modern music.
      Respond with ONLY a comma-separated list of genres (e.g., 'rock, electronic, indie').
      Do not include any explanations or additional text.""";

  private LyricsPrompts() {}

  static String genreInstruction(String genrePrompt) {
    if (genrePrompt == null || genrePrompt.isBlank()) {
      return GENRE_INSTRUCTION;
    }
    return GENRE_INSTRUCTION + "\n\n" + genrePrompt.trim();
  }

  static String lyricsWithGenresInstruction(List<String> genres) {
    return "You are a professional songwriter. Generate song lyrics based on the given prompt that"
        + " incorporate elements from the following genres: "
        + String.join(", ", genres)
        + ".\n"
        + """
        The lyrics MUST follow this structure: [verse], [chorus], [verse], [chorus], [bridge], \
        [outro], each section marked with its type in square brackets and separated by a blank \
        line.
        Use the themes, vocabulary, rhyme patterns and mood typical of these genres.
        Do not include any explanations or additional text, just the lyrics.""";
  }

  static String userMessage(String prompt) {
    return "Prompt: " + prompt;
  }
}
