package com.scholary.songgen.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable snapshot of every job, stored as one JSON object keyed by job id.
 *
 * <p>Writes go to a sibling temp file that is then moved over the snapshot, so a crash mid-write
 * leaves the previous snapshot intact. A snapshot that cannot be parsed is moved aside and the
 * service starts with no jobs.
 */
public class ResultStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResultStore.class);

  private static final TypeReference<LinkedHashMap<String, JobRecord>> SNAPSHOT_TYPE =
      new TypeReference<>() {};

  private final Path file;
  private final ObjectMapper objectMapper;

  public ResultStore(Path file, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
  }

  /**
   * Reads the snapshot. A missing or empty file yields an empty map. An unreadable file, or one
   * that is not an object of job entries, is moved aside and also yields an empty map.
   */
  public Map<String, JobRecord> load() {
    if (!Files.isRegularFile(file)) {
      LOGGER.info("No result snapshot at {}, starting empty", file);
      return new LinkedHashMap<>();
    }
    try {
      if (Files.size(file) == 0) {
        return new LinkedHashMap<>();
      }
      Map<String, JobRecord> jobs = objectMapper.readValue(file.toFile(), SNAPSHOT_TYPE);
      String problem = validate(jobs);
      if (problem != null) {
        quarantine(problem, null);
        return new LinkedHashMap<>();
      }
      LOGGER.info("Loaded {} jobs from {}", jobs.size(), file);
      return jobs;
    } catch (IOException e) {
      quarantine("is unreadable", e);
      return new LinkedHashMap<>();
    }
  }

  private static String validate(Map<String, JobRecord> jobs) {
    if (jobs == null) {
      return "holds no job map";
    }
    for (Map.Entry<String, JobRecord> entry : jobs.entrySet()) {
      JobRecord job = entry.getValue();
      if (job == null || job.id() == null || job.status() == null || job.input() == null) {
        return "has an incomplete entry for job " + entry.getKey();
      }
    }
    return null;
  }

  private void quarantine(String problem, IOException cause) {
    Path quarantine =
        file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
    LOGGER.error("Result snapshot {} {}, moving it to {}", file, problem, quarantine, cause);
    try {
      Files.move(file, quarantine, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException moveFailure) {
      LOGGER.error("Could not move unreadable snapshot {} aside", file, moveFailure);
    }
  }

  /**
   * Replaces the snapshot with {@code jobs}.
   *
   * @throws ResultStoreException if the snapshot cannot be written
   */
  public void save(Collection<JobRecord> jobs) {
    Map<String, JobRecord> byId = new LinkedHashMap<>();
    for (JobRecord job : jobs) {
      byId.put(job.id(), job);
    }

    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), byId);
      try {
        Files.move(
            temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
      LOGGER.debug("Saved {} jobs to {}", byId.size(), file);
    } catch (IOException e) {
      throw new ResultStoreException("Failed to save result snapshot to " + file, e);
    }
  }

  public Path file() {
    return file;
  }
}
