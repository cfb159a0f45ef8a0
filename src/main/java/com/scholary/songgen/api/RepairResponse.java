package com.scholary.songgen.api;

/** Outcome of {@code POST /repair/{id}}. */
public record RepairResponse(
    String requestId, boolean repaired, String message, JobStatusResponse job) {}
