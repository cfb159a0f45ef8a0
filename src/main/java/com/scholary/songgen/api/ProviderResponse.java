package com.scholary.songgen.api;

import java.util.Set;

/** Active lyrics backend and the ones that can be switched to. */
public record ProviderResponse(String provider, String model, Set<String> available) {}
