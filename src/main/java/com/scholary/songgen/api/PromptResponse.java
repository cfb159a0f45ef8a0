package com.scholary.songgen.api;

public record PromptResponse(String prompt) {}
