package com.scholary.songgen.api;

/** Lyrics written on demand. {@code suggestedGenre} is null when genre extraction failed. */
public record LyricsResponse(String lyrics, String suggestedGenre, String provider) {}
