package com.scholary.songgen.genre;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Reads the genre vocabulary from a JSON document shaped like {@code {"genre": ["pop", ...]}}.
 */
public class GenreVocabularyLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(GenreVocabularyLoader.class);

  private static final String GENRE_FIELD = "genre";

  private final ObjectMapper objectMapper;

  public GenreVocabularyLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * @throws IllegalStateException if the document has no non-empty {@code genre} array
   * @throws UncheckedIOException if the resource cannot be read
   */
  public List<String> load(Resource resource) {
    try (InputStream in = resource.getInputStream()) {
      JsonNode genres = objectMapper.readTree(in).path(GENRE_FIELD);
      if (!genres.isArray() || genres.isEmpty()) {
        throw new IllegalStateException(
            "Genre vocabulary " + resource.getDescription() + " has no '" + GENRE_FIELD + "' list");
      }
      List<String> vocabulary = new ArrayList<>(genres.size());
      genres.forEach(node -> vocabulary.add(node.asText()));
      LOGGER.info(
          "Loaded genre vocabulary: source={}, size={}",
          resource.getDescription(),
          vocabulary.size());
      return vocabulary;
    } catch (IOException e) {
      throw new UncheckedIOException(
          "Failed to read genre vocabulary " + resource.getDescription(), e);
    }
  }
}
