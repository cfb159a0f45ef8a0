package com.scholary.songgen.lyrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for chat-completion style HTTP backends.
 *
 * <p>Subclasses describe their wire format (request body, endpoint and headers, where the text sits
 * in the response); this class sends the request with the JDK {@link HttpClient} and retries
 * transient failures with exponential backoff and jitter.
 */
public abstract class AbstractHttpLyricsProvider implements LyricsProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractHttpLyricsProvider.class);

  static final int LYRICS_MAX_TOKENS = 1024;
  static final int GENRE_MAX_TOKENS = 50;
  static final int GENRE_LIST_MAX_TOKENS = 100;

  protected final LyricsProperties.Backend backend;
  protected final ObjectMapper objectMapper;
  private final HttpClient httpClient;
  private final Duration readTimeout;
  private final int maxRetries;

  protected AbstractHttpLyricsProvider(
      LyricsProperties.Backend backend, LyricsProperties properties, ObjectMapper objectMapper) {
    this.backend = backend;
    this.objectMapper = objectMapper;
    this.readTimeout = Duration.ofSeconds(properties.readTimeout());
    this.maxRetries = properties.maxRetries();
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();
  }

  @Override
  public String model() {
    return backend.model();
  }

  @Override
  public String generateLyrics(String prompt, String systemPrompt) {
    String instructions =
        systemPrompt == null || systemPrompt.isBlank()
            ? LyricsPrompts.DEFAULT_LYRICS_PROMPT
            : systemPrompt;
    return complete(instructions, LyricsPrompts.userMessage(prompt), LYRICS_MAX_TOKENS).trim();
  }

  @Override
  public String extractGenre(String prompt, String genrePrompt) {
    String genre =
        complete(
            LyricsPrompts.genreInstruction(genrePrompt),
            LyricsPrompts.userMessage(prompt),
            GENRE_MAX_TOKENS);
    return genre.trim().toLowerCase(Locale.ROOT);
  }

  @Override
  public List<String> inferGenres(String prompt) {
    String genres =
        complete(
            LyricsPrompts.GENRE_INFERENCE_INSTRUCTION,
            LyricsPrompts.userMessage(prompt),
            GENRE_LIST_MAX_TOKENS);
    return Arrays.stream(genres.split(","))
        .map(g -> g.trim().toLowerCase(Locale.ROOT))
        .filter(g -> !g.isEmpty())
        .toList();
  }

  @Override
  public String generateLyricsWithGenres(String prompt, List<String> genres) {
    return complete(
            LyricsPrompts.lyricsWithGenresInstruction(genres),
            LyricsPrompts.userMessage(prompt),
            LYRICS_MAX_TOKENS)
        .trim();
  }

  /** Request body for one system + user exchange. */
  protected abstract Map<String, Object> requestBody(
      String systemPrompt, String userMessage, int maxTokens);

  /** Endpoint and authentication headers; the body and timeout are added by the caller. */
  protected abstract HttpRequest.Builder newRequest();

  /**
   * Pulls the generated text out of a successful response.
   *
   * @throws IOException if the response carries no text
   */
  protected abstract String extractText(JsonNode response) throws IOException;

  /**
   * Sends one exchange, retrying transient failures.
   *
   * @throws LyricsProviderException if every attempt fails
   */
  protected String complete(String systemPrompt, String userMessage, int maxTokens) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < maxRetries) {
      try {
        return attemptComplete(systemPrompt, userMessage, maxTokens);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < maxRetries) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "{} request attempt {} failed, retrying in {}ms: {}",
              name(),
              attempt,
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new LyricsProviderException(name() + " request interrupted", e);
      }
    }

    throw new LyricsProviderException(
        String.format("%s request failed after %d attempts", name(), maxRetries), lastException);
  }

  private String attemptComplete(String systemPrompt, String userMessage, int maxTokens)
      throws IOException, InterruptedException {
    String body =
        objectMapper.writeValueAsString(requestBody(systemPrompt, userMessage, maxTokens));
    HttpRequest request =
        newRequest()
            .timeout(readTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

    LOGGER.debug("Sending {} request to {}", name(), request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "%s API returned status %d: %s", name(), response.statusCode(), response.body()));
    }

    String text = extractText(objectMapper.readTree(response.body()));
    LOGGER.info("{} request succeeded: model={}, chars={}", name(), model(), text.length());
    return text;
  }

  private void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LyricsProviderException(name() + " request interrupted", e);
    }
  }

  protected static String requireText(String provider, String text) throws IOException {
    if (text == null || text.isBlank()) {
      throw new IOException(provider + " response contained no text");
    }
    return text;
  }
}
