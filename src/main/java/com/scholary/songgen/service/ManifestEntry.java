package com.scholary.songgen.service;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Public view of one artifact. {@code url} is a presigned link when the artifact was uploaded. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestEntry(String localPath, String remoteKey, String url) {}
