package com.scholary.songgen.api;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Body of {@code PUT /system_prompt} and {@code PUT /genre_prompt}. */
public record PromptRequest(@NotNull @Size(max = 20000) String prompt) {}
