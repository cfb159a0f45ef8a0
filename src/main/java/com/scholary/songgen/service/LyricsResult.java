package com.scholary.songgen.service;

/** Lyrics written on demand, with a suggested genre when the provider could give one. */
public record LyricsResult(String lyrics, String suggestedGenre, String provider) {}
