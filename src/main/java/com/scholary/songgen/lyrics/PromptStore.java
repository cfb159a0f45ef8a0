package com.scholary.songgen.lyrics;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed system prompts that operators can edit without a restart.
 *
 * <p>The lyrics prompt falls back to {@link LyricsPrompts#DEFAULT_LYRICS_PROMPT} when its file is
 * missing or blank. The genre prompt is optional extra guidance and defaults to empty.
 */
public class PromptStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(PromptStore.class);

  private final Path lyricsPromptFile;
  private final Path genrePromptFile;

  public PromptStore(Path lyricsPromptFile, Path genrePromptFile) {
    this.lyricsPromptFile = lyricsPromptFile;
    this.genrePromptFile = genrePromptFile;
  }

  public String lyricsPrompt() {
    String prompt = read(lyricsPromptFile);
    return prompt.isBlank() ? LyricsPrompts.DEFAULT_LYRICS_PROMPT : prompt;
  }

  public String genrePrompt() {
    return read(genrePromptFile);
  }

  public void updateLyricsPrompt(String prompt) {
    write(lyricsPromptFile, prompt);
  }

  public void updateGenrePrompt(String prompt) {
    write(genrePromptFile, prompt);
  }

  private String read(Path file) {
    if (!Files.isRegularFile(file)) {
      return "";
    }
    try {
      return Files.readString(file, StandardCharsets.UTF_8).trim();
    } catch (IOException e) {
      LOGGER.warn("Could not read prompt file {}, using default: {}", file, e.getMessage());
      return "";
    }
  }

  private void write(Path file, String prompt) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(file, prompt, StandardCharsets.UTF_8);
      LOGGER.info("Saved prompt to {} ({} chars)", file, prompt.length());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to save prompt to " + file, e);
    }
  }
}
