package com.scholary.songgen.lyrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Exercises the request path against a local HTTP endpoint. */
class HttpLyricsProviderTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final AtomicInteger status = new AtomicInteger(200);
  private final AtomicReference<String> responseBody = new AtomicReference<>("{}");
  private final AtomicReference<String> lastRequest = new AtomicReference<>();

  private HttpServer server;
  private OpenAiLyricsProvider provider;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/v1/chat/completions",
        exchange -> {
          lastRequest.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          byte[] bytes = responseBody.get().getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(status.get(), bytes.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
          }
        });
    server.start();

    String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    LyricsProperties.Backend backend =
        new LyricsProperties.Backend("sk-test", baseUrl, "gpt-4o-mini");
    LyricsProperties properties =
        new LyricsProperties("openai", 2, 5, 1, backend, backend, backend);
    provider = new OpenAiLyricsProvider(backend, properties, objectMapper);
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void extractGenre_shouldTrimAndLowercase() throws IOException {
    responseBody.set(reply("  Hip-Hop \n"));

    assertThat(provider.extractGenre("city nights", "")).isEqualTo("hip-hop");
    assertThat(objectMapper.readTree(lastRequest.get()).path("max_tokens").asInt())
        .isEqualTo(AbstractHttpLyricsProvider.GENRE_MAX_TOKENS);
  }

  @Test
  void inferGenres_shouldSplitCommaSeparatedReply() {
    responseBody.set(reply("Rock, Electronic , ,indie"));

    assertThat(provider.inferGenres("a road trip")).containsExactly("rock", "electronic", "indie");
  }

  @Test
  void generateLyrics_shouldSendPromptAsUserMessage() throws IOException {
    responseBody.set(reply("\n[verse]\nNeon rain\n"));

    String lyrics = provider.generateLyrics("neon rain", "custom system prompt");

    assertThat(lyrics).isEqualTo("[verse]\nNeon rain");
    assertThat(objectMapper.readTree(lastRequest.get()).path("messages").toString())
        .contains("custom system prompt")
        .contains("Prompt: neon rain");
  }

  @Test
  void generateLyrics_shouldFailOnErrorStatus() {
    status.set(500);
    responseBody.set("{\"error\":\"overloaded\"}");

    assertThatThrownBy(() -> provider.generateLyrics("anything", null))
        .isInstanceOf(LyricsProviderException.class)
        .hasMessageContaining("failed after 1 attempts")
        .hasRootCauseMessage("openai API returned status 500: {\"error\":\"overloaded\"}");
  }

  private String reply(String content) {
    ObjectNode message = objectMapper.createObjectNode().put("content", content);
    ObjectNode choice = objectMapper.createObjectNode();
    choice.set("message", message);
    ObjectNode response = objectMapper.createObjectNode();
    response.putArray("choices").add(choice);
    return response.toString();
  }
}
