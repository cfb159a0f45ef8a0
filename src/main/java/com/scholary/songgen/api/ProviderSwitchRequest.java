package com.scholary.songgen.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /provider}. */
public record ProviderSwitchRequest(@NotBlank String provider) {}
