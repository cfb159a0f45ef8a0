package com.scholary.songgen.lyrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/** Google Gemini generateContent backend. */
public class GeminiLyricsProvider extends AbstractHttpLyricsProvider {

  public static final String NAME = "gemini";

  public GeminiLyricsProvider(
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
        "systemInstruction", Map.of("parts", List.of(Map.of("text", systemPrompt))),
        "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", userMessage)))),
        "generationConfig", Map.of("maxOutputTokens", maxTokens));
  }

  @Override
  protected HttpRequest.Builder newRequest() {
    String uri =
        String.format(
            "%s/v1beta/models/%s:generateContent?key=%s",
            backend.baseUrl(),
            backend.model(),
            URLEncoder.encode(backend.apiKey(), StandardCharsets.UTF_8));
    return HttpRequest.newBuilder().uri(URI.create(uri));
  }

  @Override
  protected String extractText(JsonNode response) throws IOException {
    StringBuilder text = new StringBuilder();
    for (JsonNode part : response.path("candidates").path(0).path("content").path("parts")) {
      text.append(part.path("text").asText(""));
    }
    return requireText(NAME, text.toString());
  }
}
