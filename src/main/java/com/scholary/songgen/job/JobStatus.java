package com.scholary.songgen.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a generation job.
 *
 * <p>Jobs move forward along QUEUED, PROCESSING, GENERATING_LYRICS (only when lyrics must be
 * written), GENERATING_AUDIO, UPLOADING and COMPLETE. Any non-terminal state may drop to ERROR.
 * COMPLETE and ERROR are terminal.
 */
public enum JobStatus {
  QUEUED("queued"),
  PROCESSING("processing"),
  GENERATING_LYRICS("generating_lyrics"),
  GENERATING_AUDIO("generating_audio"),
  UPLOADING("uploading"),
  COMPLETE("complete"),
  ERROR("error");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static JobStatus fromValue(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (JobStatus status : values()) {
      if (status.value.equals(normalized)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + value);
  }

  public boolean isTerminal() {
    return this == COMPLETE || this == ERROR;
  }

  public boolean canTransitionTo(JobStatus next) {
    if (isTerminal()) {
      return false;
    }
    if (next == ERROR) {
      return true;
    }
    return switch (this) {
      case QUEUED -> next == PROCESSING;
      case PROCESSING -> next == GENERATING_LYRICS || next == GENERATING_AUDIO;
      case GENERATING_LYRICS -> next == GENERATING_AUDIO;
      case GENERATING_AUDIO -> next == UPLOADING;
      case UPLOADING -> next == COMPLETE;
      default -> false;
    };
  }

  @Override
  public String toString() {
    return value;
  }
}
