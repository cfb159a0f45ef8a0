package com.scholary.songgen.inference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.songgen.inference.InferenceTestDoubles.FailingProcessFactory;
import com.scholary.songgen.inference.InferenceTestDoubles.ProcessBehavior;
import com.scholary.songgen.inference.InferenceTestDoubles.StubProcessFactory;
import com.scholary.songgen.inference.InferenceTestDoubles.TestProcess;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class SubprocessInferenceRunnerTest {

  private static final List<String> COMMAND = List.of("python", "infer.py", "--output_dir", "/o");
  private static final List<String> MARKERS = List.of("Traceback", "CUDA out of memory");

  @Test
  void run_shouldReportSuccessForCleanExit() {
    TestProcess process =
        new TestProcess(new ProcessBehavior("Stage 1 done\nStage 2 done\n", 0, 10));
    StubProcessFactory factory = new StubProcessFactory(process);
    SubprocessInferenceRunner runner = runner(factory, Duration.ofSeconds(5));

    InferenceResult result = runner.run(COMMAND, "job-1");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.exitCode()).isZero();
    assertThat(result.errorLines()).isEmpty();
    assertThat(factory.startedCommands).containsExactly(COMMAND);
  }

  @Test
  void run_shouldFailOnErrorMarkerEvenWithZeroExit() {
    String output = "loading model\ntorch.cuda.OutOfMemoryError: cuda OUT OF MEMORY\nexiting\n";
    SubprocessInferenceRunner runner =
        runner(
            new StubProcessFactory(new TestProcess(new ProcessBehavior(output, 0, 10))),
            Duration.ofSeconds(5));

    InferenceResult result = runner.run(COMMAND, "job-1");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.errorLines())
        .containsExactly("torch.cuda.OutOfMemoryError: cuda OUT OF MEMORY");
    assertThat(result.describeFailure()).startsWith("Inference reported an error");
  }

  @Test
  void run_shouldReportNonZeroExit() {
    String output = "Traceback (most recent call last):\n  File \"infer.py\"\n";
    SubprocessInferenceRunner runner =
        runner(
            new StubProcessFactory(new TestProcess(new ProcessBehavior(output, 1, 10))),
            Duration.ofSeconds(5));

    InferenceResult result = runner.run(COMMAND, "job-1");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.exitCode()).isEqualTo(1);
    assertThat(result.describeFailure())
        .isEqualTo("Inference exited with code 1: Traceback (most recent call last):");
  }

  @Test
  void run_shouldKillProcessOnTimeout() {
    TestProcess hung = new TestProcess(new ProcessBehavior("", 0, -1));
    SubprocessInferenceRunner runner =
        runner(new StubProcessFactory(hung), Duration.ofMillis(200));

    assertThatThrownBy(() -> runner.run(COMMAND, "job-1"))
        .isInstanceOf(InferenceException.class)
        .hasMessageContaining("timed out");
    assertThat(hung.wasDestroyed()).isTrue();
  }

  @Test
  void run_shouldWaitForKilledProcessToExitBeforeReturning() {
    TestProcess hung = new TestProcess(new ProcessBehavior("", 0, -1));
    SubprocessInferenceRunner runner =
        runner(new StubProcessFactory(hung), Duration.ofMillis(100));

    assertThatThrownBy(() -> runner.run(COMMAND, "job-1"))
        .isInstanceOf(InferenceException.class);
    assertThat(hung.wasAwaitedAfterDestroy()).isTrue();
    assertThat(hung.isAlive()).isFalse();
  }

  @Test
  void run_shouldWrapStartFailure() {
    SubprocessInferenceRunner runner =
        new SubprocessInferenceRunner(
            new FailingProcessFactory(),
            InferenceTestDoubles.properties(Duration.ofSeconds(5), MARKERS));

    assertThatThrownBy(() -> runner.run(COMMAND, "job-1"))
        .isInstanceOf(InferenceException.class)
        .hasMessageContaining("Failed to start")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void isErrorLine_shouldMatchCaseInsensitively() {
    SubprocessInferenceRunner runner =
        runner(
            new StubProcessFactory(new TestProcess(new ProcessBehavior("", 0, 0))),
            Duration.ofSeconds(1));

    assertThat(runner.isErrorLine("TRACEBACK (most recent call last):")).isTrue();
    assertThat(runner.isErrorLine("Stage 2 inference done")).isFalse();
  }

  private static SubprocessInferenceRunner runner(StubProcessFactory factory, Duration timeout) {
    return new SubprocessInferenceRunner(
        factory, InferenceTestDoubles.properties(timeout, MARKERS));
  }
}
