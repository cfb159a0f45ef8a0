package com.scholary.songgen.lyrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;

/** OpenAI chat completions backend. */
public class OpenAiLyricsProvider extends AbstractHttpLyricsProvider {

  public static final String NAME = "openai";

  public OpenAiLyricsProvider(
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
        "messages",
            List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userMessage)));
  }

  @Override
  protected HttpRequest.Builder newRequest() {
    return HttpRequest.newBuilder()
        .uri(URI.create(backend.baseUrl() + "/v1/chat/completions"))
        .header("Authorization", "Bearer " + backend.apiKey());
  }

  @Override
  protected String extractText(JsonNode response) throws IOException {
    JsonNode content = response.path("choices").path(0).path("message").path("content");
    return requireText(NAME, content.isTextual() ? content.asText() : null);
  }
}
