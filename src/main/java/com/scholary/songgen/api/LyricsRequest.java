package com.scholary.songgen.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /generate_lyrics}. */
public record LyricsRequest(@NotBlank @Size(max = 4000) String prompt) {}
