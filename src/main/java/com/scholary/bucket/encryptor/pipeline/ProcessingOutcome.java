package com.scholary.bucket.encryptor.pipeline;

import java.util.Objects;

/**
 * Terminal result of one object key's trip through the pipeline.
 *
 * <p>{@code reason} is the underlying error message and is null only for {@link Status#SUCCESS}.
 */
public record ProcessingOutcome(String key, Status status, String reason) {

  public enum Status {
    SUCCESS,
    FETCH_FAILED,
    ENCRYPT_FAILED,
    STORE_FAILED,
    DELETE_FAILED
  }

  public ProcessingOutcome {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(status, "status");
    if (status == Status.SUCCESS && reason != null) {
      throw new IllegalArgumentException("A successful outcome has no failure reason");
    }
    if (status != Status.SUCCESS && reason == null) {
      throw new IllegalArgumentException("A failed outcome needs a reason");
    }
  }

  public static ProcessingOutcome success(String key) {
    return new ProcessingOutcome(key, Status.SUCCESS, null);
  }

  public static ProcessingOutcome failed(String key, PipelineStage stage, String reason) {
    return new ProcessingOutcome(key, stage.failureStatus(), reason);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }
}
