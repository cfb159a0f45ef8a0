package com.scholary.songgen.service;

import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;

/** An artifact ready to be streamed to a client. */
public record ArtifactDownload(String fileName, MediaType contentType, Resource resource) {}
