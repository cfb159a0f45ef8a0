package com.scholary.songgen.api;

/** Error body returned for every failed request. */
public record ErrorResponse(String error) {}
