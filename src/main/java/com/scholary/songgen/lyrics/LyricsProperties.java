package com.scholary.songgen.lyrics;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the lyrics language-model backends.
 *
 * <p>A backend is only registered when its API key is set. {@code provider} names the one that is
 * active at startup.
 */
@ConfigurationProperties(prefix = "lyrics")
@Validated
public record LyricsProperties(
    @NotBlank String provider,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Valid @NotNull Backend openai,
    @Valid @NotNull Backend anthropic,
    @Valid @NotNull Backend gemini) {

  public record Backend(String apiKey, @NotBlank String baseUrl, @NotBlank String model) {

    public boolean isConfigured() {
      return apiKey != null && !apiKey.isBlank();
    }
  }
}
