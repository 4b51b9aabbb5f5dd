package com.scholary.bucket.encryptor.pipeline;

/** The steps each object goes through, in order. */
public enum PipelineStage {
  FETCH(ProcessingOutcome.Status.FETCH_FAILED),
  ENCRYPT(ProcessingOutcome.Status.ENCRYPT_FAILED),
  STORE(ProcessingOutcome.Status.STORE_FAILED),
  DELETE(ProcessingOutcome.Status.DELETE_FAILED);

  private final ProcessingOutcome.Status failureStatus;

  PipelineStage(ProcessingOutcome.Status failureStatus) {
    this.failureStatus = failureStatus;
  }

  public ProcessingOutcome.Status failureStatus() {
    return failureStatus;
  }
}
