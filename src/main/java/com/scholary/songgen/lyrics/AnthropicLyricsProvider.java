package com.scholary.songgen.lyrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;

/** Anthropic messages API backend. */
public class AnthropicLyricsProvider extends AbstractHttpLyricsProvider {

  public static final String NAME = "anthropic";

  static final String API_VERSION = "2023-06-01";

  public AnthropicLyricsProvider(
      LyricsProperties.Backend backend, LyricsProperties properties, ObjectMapper objectMapper) {
    super(backend, properties, objectMapper);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected Map<String, Object> requestBody(
      String systemPrompt, String userMessage, int maxTokens) {
    return Map.of(
        "model", backend.model(),
        "max_tokens", maxTokens,
        "system", systemPrompt,
        "messages", List.of(Map.of("role", "user", "content", userMessage)));
  }

  @Override
  protected HttpRequest.Builder newRequest() {
    return HttpRequest.newBuilder()
        .uri(URI.create(backend.baseUrl() + "/v1/messages"))
        .header("x-api-key", backend.apiKey())
        .header("anthropic-version", API_VERSION);
  }

  @Override
  protected String extractText(JsonNode response) throws IOException {
    StringBuilder text = new StringBuilder();
    for (JsonNode block : response.path("content")) {
      if ("text".equals(block.path("type").asText())) {
        text.append(block.path("text").asText());
      }
    }
    return requireText(NAME, text.toString());
  }
}
