package com.scholary.songgen.lyrics;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PromptStoreTest {

  @TempDir Path tempDir;

  @Test
  void lyricsPrompt_shouldDefaultWhenFileIsMissingOrBlank() throws Exception {
    Path lyricsFile = tempDir.resolve("lyrics_prompt.txt");
    PromptStore store = new PromptStore(lyricsFile, tempDir.resolve("genre_prompt.txt"));

    assertThat(store.lyricsPrompt()).isEqualTo(LyricsPrompts.DEFAULT_LYRICS_PROMPT);

    Files.writeString(lyricsFile, "   \n");
    assertThat(store.lyricsPrompt()).isEqualTo(LyricsPrompts.DEFAULT_LYRICS_PROMPT);
  }

  @Test
  void genrePrompt_shouldBeEmptyByDefault() {
    PromptStore store =
        new PromptStore(tempDir.resolve("lyrics_prompt.txt"), tempDir.resolve("genre_prompt.txt"));

    assertThat(store.genrePrompt()).isEmpty();
  }

  @Test
  void update_shouldPersistPromptsAndCreateDirectories() {
    Path lyricsFile = tempDir.resolve("prompts/lyrics_prompt.txt");
    Path genreFile = tempDir.resolve("prompts/genre_prompt.txt");
    PromptStore store = new PromptStore(lyricsFile, genreFile);

    store.updateLyricsPrompt("Write sea shanties.\n");
    store.updateGenrePrompt("Prefer folk genres.");

    assertThat(lyricsFile).exists();
    PromptStore reopened = new PromptStore(lyricsFile, genreFile);
    assertThat(reopened.lyricsPrompt()).isEqualTo("Write sea shanties.");
    assertThat(reopened.genrePrompt()).isEqualTo("Prefer folk genres.");
  }
}
