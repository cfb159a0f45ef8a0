package com.scholary.songgen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.songgen.lyrics.AnthropicLyricsProvider;
import com.scholary.songgen.lyrics.GeminiLyricsProvider;
import com.scholary.songgen.lyrics.LyricsProperties;
import com.scholary.songgen.lyrics.LyricsProvider;
import com.scholary.songgen.lyrics.LyricsProviderRegistry;
import com.scholary.songgen.lyrics.OpenAiLyricsProvider;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a lyrics backend for every provider that has an API key configured.
 */
@Configuration
@EnableConfigurationProperties(LyricsProperties.class)
public class LyricsConfig {

  @Bean
  public LyricsProviderRegistry lyricsProviderRegistry(
      LyricsProperties properties, ObjectMapper objectMapper) {
    List<LyricsProvider> providers = new ArrayList<>();
    if (properties.openai().isConfigured()) {
      providers.add(new OpenAiLyricsProvider(properties.openai(), properties, objectMapper));
    }
    if (properties.anthropic().isConfigured()) {
      providers.add(new AnthropicLyricsProvider(properties.anthropic(), properties, objectMapper));
    }
    if (properties.gemini().isConfigured()) {
      providers.add(new GeminiLyricsProvider(properties.gemini(), properties, objectMapper));
    }
    return new LyricsProviderRegistry(providers, properties.provider());
  }
}
