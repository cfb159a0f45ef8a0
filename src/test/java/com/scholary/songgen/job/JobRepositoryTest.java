package com.scholary.songgen.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobRepositoryTest {

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

  @TempDir Path tempDir;

  private ResultStore resultStore;
  private JobRepository repository;

  @BeforeEach
  void setUp() {
    resultStore = new ResultStore(tempDir.resolve("results.json"), objectMapper);
    repository = new JobRepository(resultStore);
  }

  @Test
  void insert_shouldPersistImmediately() {
    repository.insert(newJob("job-1"));

    assertThat(resultStore.load()).containsKey("job-1");
  }

  @Test
  void insert_shouldRejectDuplicateIds() {
    repository.insert(newJob("job-1"));

    assertThatThrownBy(() -> repository.insert(newJob("job-1")))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void update_shouldPersistMutation() {
    repository.insert(newJob("job-1"));

    JobRecord updated =
        repository.update("job-1", job -> job.transitionTo(JobStatus.PROCESSING, Instant.EPOCH));

    assertThat(updated.status()).isEqualTo(JobStatus.PROCESSING);
    assertThat(resultStore.load().get("job-1").status()).isEqualTo(JobStatus.PROCESSING);
  }

  @Test
  void update_shouldRejectUnknownJob() {
    assertThatThrownBy(() -> repository.update("missing", job -> {}))
        .isInstanceOf(JobNotFoundException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void constructor_shouldReloadPersistedJobs() {
    repository.insert(newJob("job-1"));
    repository.insert(newJob("job-2"));
    repository.update("job-2", job -> job.fail("boom", Instant.EPOCH));

    JobRepository reloaded = new JobRepository(resultStore);

    assertThat(reloaded.findAll()).extracting(JobRecord::id).containsExactly("job-1", "job-2");
    assertThat(reloaded.findById("job-2")).get().extracting(JobRecord::error).isEqualTo("boom");
  }

  @Test
  void findById_shouldReturnSnapshotNotLiveState() {
    repository.insert(newJob("job-1"));
    JobRecord before = repository.findById("job-1").orElseThrow();

    repository.update("job-1", job -> job.transitionTo(JobStatus.PROCESSING, Instant.EPOCH));

    assertThat(before.status()).isEqualTo(JobStatus.QUEUED);
  }

  @Test
  void insert_shouldDropJobWhenSnapshotWriteFails() {
    FailingResultStore store = new FailingResultStore(tempDir.resolve("flaky.json"));
    JobRepository flaky = new JobRepository(store);
    List<String> enqueued = new ArrayList<>();

    store.failNextSave = true;
    assertThatThrownBy(() -> flaky.insert(newJob("ghost"), record -> enqueued.add(record.id())))
        .isInstanceOf(ResultStoreException.class);
    flaky.insert(newJob("job-1"));

    assertThat(flaky.findById("ghost")).isEmpty();
    assertThat(enqueued).isEmpty();
    assertThat(store.load().keySet()).containsExactly("job-1");
  }

  @Test
  void update_shouldKeepPreviousStateWhenSnapshotWriteFails() {
    FailingResultStore store = new FailingResultStore(tempDir.resolve("flaky.json"));
    JobRepository flaky = new JobRepository(store);
    flaky.insert(newJob("job-1"));

    store.failNextSave = true;
    assertThatThrownBy(
            () ->
                flaky.update(
                    "job-1", job -> job.transitionTo(JobStatus.PROCESSING, Instant.EPOCH)))
        .isInstanceOf(ResultStoreException.class);

    assertThat(flaky.findById("job-1"))
        .get()
        .extracting(JobRecord::status)
        .isEqualTo(JobStatus.QUEUED);
    flaky.update("job-1", job -> job.fail("disk full", Instant.EPOCH));
    assertThat(store.load().get("job-1").status()).isEqualTo(JobStatus.ERROR);
  }

  @Test
  void insert_shouldRunCallbackWithPersistedRecord() {
    JobStatus seen = repository.insert(newJob("job-1"), JobRecord::status);

    assertThat(seen).isEqualTo(JobStatus.QUEUED);
    assertThat(resultStore.load()).containsKey("job-1");
  }

  private final class FailingResultStore extends ResultStore {

    private boolean failNextSave;

    FailingResultStore(Path file) {
      super(file, objectMapper);
    }

    @Override
    public void save(Collection<JobRecord> jobs) {
      if (failNextSave) {
        failNextSave = false;
        throw new ResultStoreException("disk full", new IOException("No space left on device"));
      }
      super.save(jobs);
    }
  }

  private static GenerationJob newJob(String id) {
    return new GenerationJob(id, JobInput.of("a song about " + id, null, null), Instant.EPOCH);
  }
}
