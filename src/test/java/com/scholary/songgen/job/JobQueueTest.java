package com.scholary.songgen.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class JobQueueTest {

  private final JobQueue queue = new JobQueue();

  @Test
  void enqueue_shouldReturnNumberOfJobsAhead() {
    assertThat(queue.enqueue("a")).isZero();
    assertThat(queue.enqueue("b")).isEqualTo(1);
    assertThat(queue.enqueue("c")).isEqualTo(2);
    assertThat(queue.size()).isEqualTo(3);
  }

  @Test
  void take_shouldReturnJobsInSubmissionOrder() throws Exception {
    queue.enqueue("a");
    queue.enqueue("b");

    assertThat(queue.take()).isEqualTo("a");
    assertThat(queue.take()).isEqualTo("b");
    assertThat(queue.size()).isZero();
  }

  @Test
  void position_shouldShrinkAsJobsAreTaken() throws Exception {
    queue.enqueue("a");
    queue.enqueue("b");
    queue.enqueue("c");

    assertThat(queue.position("c")).hasValue(2);
    queue.take();
    assertThat(queue.position("c")).hasValue(1);
    assertThat(queue.position("a")).isEmpty();
    assertThat(queue.pendingIds()).containsExactly("b", "c");
  }

  @Test
  void take_shouldWaitForNextJob() throws Exception {
    CompletableFuture<String> taken =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return queue.take();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
              }
            });

    await()
        .during(Duration.ofMillis(200))
        .atMost(Duration.ofSeconds(1))
        .until(() -> !taken.isDone());
    queue.enqueue("late");

    assertThat(taken.get(5, TimeUnit.SECONDS)).isEqualTo("late");
  }
}
