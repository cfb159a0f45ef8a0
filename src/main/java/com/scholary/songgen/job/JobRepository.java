package com.scholary.songgen.job;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Owns every job and keeps the snapshot file in step with memory.
 *
 * <p>Each mutation runs under one lock and is followed by a full snapshot write before the lock is
 * released, so the file never lags an acknowledged change. A mutation whose snapshot write fails is
 * rolled back, so memory never holds a change the file does not. Jobs are never evicted.
 */
@Repository
public class JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRepository.class);

  private final ResultStore resultStore;
  private final Map<String, GenerationJob> jobs = new LinkedHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  public JobRepository(ResultStore resultStore) {
    this.resultStore = resultStore;
    resultStore
        .load()
        .values()
        .forEach(record -> jobs.put(record.id(), GenerationJob.restore(record)));
    LOGGER.info("Job repository initialized with {} jobs", jobs.size());
  }

  /**
   * Adds a new job and persists it.
   *
   * @throws IllegalStateException if the id is already taken
   * @throws ResultStoreException if the snapshot cannot be written; the job is not added
   */
  public JobRecord insert(GenerationJob job) {
    return insert(job, record -> record);
  }

  /**
   * Adds a new job, persists it and runs {@code afterInsert} before any reader can see the job.
   *
   * @throws IllegalStateException if the id is already taken
   * @throws ResultStoreException if the snapshot cannot be written; the job is not added
   */
  public <T> T insert(GenerationJob job, Function<JobRecord, T> afterInsert) {
    lock.lock();
    try {
      if (jobs.containsKey(job.getId())) {
        throw new IllegalStateException("Duplicate job id: " + job.getId());
      }
      jobs.put(job.getId(), job);
      try {
        persist();
      } catch (RuntimeException e) {
        jobs.remove(job.getId());
        throw e;
      }
      return afterInsert.apply(job.toRecord());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Applies {@code mutation} to a job and persists the result.
   *
   * <p>The mutation runs on a copy that replaces the stored job only once the snapshot is written.
   *
   * @throws JobNotFoundException if the id is unknown
   * @throws ResultStoreException if the snapshot cannot be written; the job is left unchanged
   */
  public JobRecord update(String jobId, Consumer<GenerationJob> mutation) {
    lock.lock();
    try {
      GenerationJob current = jobs.get(jobId);
      if (current == null) {
        throw new JobNotFoundException(jobId);
      }
      GenerationJob changed = GenerationJob.restore(current.toRecord());
      mutation.accept(changed);
      jobs.put(jobId, changed);
      try {
        persist();
      } catch (RuntimeException e) {
        jobs.put(jobId, current);
        throw e;
      }
      return changed.toRecord();
    } finally {
      lock.unlock();
    }
  }

  public Optional<JobRecord> findById(String jobId) {
    lock.lock();
    try {
      return Optional.ofNullable(jobs.get(jobId)).map(GenerationJob::toRecord);
    } finally {
      lock.unlock();
    }
  }

  public List<JobRecord> findAll() {
    lock.lock();
    try {
      List<JobRecord> records = new ArrayList<>(jobs.size());
      jobs.values().forEach(job -> records.add(job.toRecord()));
      return records;
    } finally {
      lock.unlock();
    }
  }

  private void persist() {
    resultStore.save(findAll());
  }
}
