package com.scholary.bucket.encryptor.pipeline;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate of every outcome from one pipeline run.
 *
 * <p>Carries the run's key and nonce in hex whatever the outcomes were: objects that did succeed
 * were encrypted under that material and can only be recovered with it.
 */
public record BatchSummary(List<ProcessingOutcome> outcomes, String keyHex, String nonceHex) {

  public BatchSummary {
    outcomes = List.copyOf(outcomes);
  }

  public boolean hasFailures() {
    return outcomes.stream().anyMatch(outcome -> !outcome.isSuccess());
  }

  public int successCount() {
    return (int) outcomes.stream().filter(ProcessingOutcome::isSuccess).count();
  }

  public int failureCount() {
    return outcomes.size() - successCount();
  }

  public List<ProcessingOutcome> failures() {
    return outcomes.stream().filter(outcome -> !outcome.isSuccess()).collect(Collectors.toList());
  }

  /** Omits key material. */
  @Override
  public String toString() {
    return "BatchSummary[objects="
        + outcomes.size()
        + ", succeeded="
        + successCount()
        + ", failed="
        + failureCount()
        + "]";
  }
}
