package com.scholary.songgen.service;

import com.scholary.songgen.job.ArtifactLocation;
import com.scholary.songgen.job.JobNotFoundException;
import com.scholary.songgen.job.JobRecord;
import com.scholary.songgen.job.JobRepository;
import com.scholary.songgen.job.JobStatus;
import com.scholary.songgen.objectstore.ObjectStoreClient;
import com.scholary.songgen.objectstore.ObjectStoreException;
import com.scholary.songgen.objectstore.ObjectStoreProperties;
import com.scholary.songgen.objectstore.PresignedUrlCache;
import com.scholary.songgen.output.ArtifactNames;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

/**
 * Serves finished artifacts. A local copy is preferred; the bucket is the fallback when the local
 * file is gone.
 */
@Service
public class ArtifactService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactService.class);

  private final JobRepository repository;
  private final Optional<ObjectStoreClient> objectStoreClient;
  private final Optional<PresignedUrlCache> presignedUrls;
  private final String bucket;

  public ArtifactService(
      JobRepository repository,
      Optional<ObjectStoreClient> objectStoreClient,
      Optional<PresignedUrlCache> presignedUrls,
      ObjectStoreProperties objectStoreProperties) {
    this.repository = repository;
    this.objectStoreClient = objectStoreClient;
    this.presignedUrls = presignedUrls;
    this.bucket = objectStoreProperties.bucket();
  }

  /**
   * Resolves an artifact of a COMPLETE job.
   *
   * @param type a manifest name such as "audio" or "lyrics", or an audio extension such as "wav";
   *     null or blank means "audio"
   * @throws JobNotFoundException if the id is unknown
   * @throws ArtifactNotFoundException if the job is not complete or has no such artifact
   */
  public ArtifactDownload resolve(String jobId, String type) {
    JobRecord job = repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    if (job.status() != JobStatus.COMPLETE) {
      throw new ArtifactNotFoundException(
          "Job " + jobId + " is not complete (status: " + job.status() + ")");
    }

    String name = artifactName(job, type);
    ArtifactLocation location = job.outputManifest().get(name);

    if (location.localPath() != null) {
      Path local = Path.of(location.localPath());
      if (Files.isRegularFile(local)) {
        String fileName = local.getFileName().toString();
        return new ArtifactDownload(fileName, mediaType(fileName), new FileSystemResource(local));
      }
    }

    if (location.isRemote() && objectStoreClient.isPresent()) {
      String fileName = location.remoteKey().substring(location.remoteKey().lastIndexOf('/') + 1);
      try {
        Resource remote =
            new InputStreamResource(
                objectStoreClient.get().getObjectStream(bucket, location.remoteKey()));
        return new ArtifactDownload(fileName, mediaType(fileName), remote);
      } catch (ObjectStoreException e) {
        throw new ArtifactNotFoundException(
            "Artifact '" + name + "' of job " + jobId + " is not available: " + e.getMessage());
      }
    }

    throw new ArtifactNotFoundException(
        "Artifact '" + name + "' of job " + jobId + " is no longer available");
  }

  /** Manifest entries with presigned URLs attached where possible. */
  public Map<String, ManifestEntry> describe(JobRecord job) {
    Map<String, ManifestEntry> entries = new LinkedHashMap<>();
    job.outputManifest()
        .forEach(
            (name, location) ->
                entries.put(
                    name,
                    new ManifestEntry(
                        location.localPath(), location.remoteKey(), urlFor(location))));
    return entries;
  }

  private String urlFor(ArtifactLocation location) {
    if (!location.isRemote() || presignedUrls.isEmpty()) {
      return null;
    }
    try {
      return presignedUrls.get().urlFor(location.remoteKey()).toString();
    } catch (ObjectStoreException e) {
      LOGGER.warn("Could not presign {}: {}", location.remoteKey(), e.getMessage());
      return null;
    }
  }

  private static String artifactName(JobRecord job, String type) {
    Map<String, ArtifactLocation> manifest = job.outputManifest();
    String wanted =
        type == null || type.isBlank() ? ArtifactNames.AUDIO : type.trim().toLowerCase(Locale.ROOT);
    if (manifest.containsKey(wanted)) {
      return wanted;
    }

    ArtifactLocation audio = manifest.get(ArtifactNames.AUDIO);
    String extension = "." + (wanted.startsWith(".") ? wanted.substring(1) : wanted);
    if (audio != null
        && audio.localPath() != null
        && audio.localPath().toLowerCase(Locale.ROOT).endsWith(extension)) {
      return ArtifactNames.AUDIO;
    }

    throw new ArtifactNotFoundException(
        "Job " + job.id() + " has no '" + wanted + "' artifact, available: " + manifest.keySet());
  }

  private static MediaType mediaType(String fileName) {
    return MediaTypeFactory.getMediaType(fileName).orElse(MediaType.APPLICATION_OCTET_STREAM);
  }
}
