package com.scholary.songgen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.songgen.genre.GenreMatcher;
import com.scholary.songgen.genre.GenreVocabularyLoader;
import com.scholary.songgen.job.ResultStore;
import com.scholary.songgen.lyrics.PromptStore;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the job store, genre vocabulary and prompt files from "generation.*" properties.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ResultStore resultStore(GenerationProperties properties, ObjectMapper objectMapper) {
    return new ResultStore(Path.of(properties.resultsFile()), objectMapper);
  }

  @Bean
  public GenreMatcher genreMatcher(
      GenerationProperties properties, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
    GenerationProperties.GenreProperties genres = properties.genres();
    GenreVocabularyLoader loader = new GenreVocabularyLoader(objectMapper);
    return new GenreMatcher(
        loader.load(resourceLoader.getResource(genres.vocabulary())), genres.fallback());
  }

  @Bean
  public PromptStore promptStore(GenerationProperties properties) {
    return new PromptStore(
        Path.of(properties.prompts().lyricsFile()), Path.of(properties.prompts().genreFile()));
  }
}
