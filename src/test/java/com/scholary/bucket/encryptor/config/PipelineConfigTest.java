package com.scholary.bucket.encryptor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class PipelineConfigTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void mdcPropagatingDecorator_restoresWorkerContextAfterTask() {
    MDC.put("correlationId", "cid-1");
    Runnable decorated =
        PipelineConfig.mdcPropagatingDecorator().decorate(() -> MDC.put("key", "a.txt"));

    MDC.clear();
    MDC.put("worker", "yes");
    decorated.run();

    assertThat(MDC.get("worker")).isEqualTo("yes");
    assertThat(MDC.get("key")).isNull();
    assertThat(MDC.get("correlationId")).isNull();
  }

  @Test
  void mdcPropagatingDecorator_taskSeesSubmitterContext() {
    MDC.put("correlationId", "cid-2");
    AtomicReference<String> seen = new AtomicReference<>();
    Runnable decorated =
        PipelineConfig.mdcPropagatingDecorator().decorate(() -> seen.set(MDC.get("correlationId")));

    MDC.clear();
    decorated.run();

    assertThat(seen.get()).isEqualTo("cid-2");
    assertThat(MDC.get("correlationId")).isNull();
  }

  @Test
  void pipelineExecutor_singleWorker_runsOnCallingThread() {
    Executor executor =
        new PipelineConfig()
            .pipelineExecutor(new EncryptionProperties("uploads", null, null, null, 1, null));

    assertThat(executor).isInstanceOf(SyncTaskExecutor.class);
  }

  @Test
  void pipelineExecutor_afterShutdown_rejectsInsteadOfDropping() {
    ThreadPoolTaskExecutor executor =
        (ThreadPoolTaskExecutor)
            new PipelineConfig()
                .pipelineExecutor(new EncryptionProperties("uploads", null, null, null, 2, 4));
    executor.shutdown();

    assertThatThrownBy(() -> executor.execute(() -> {}))
        .isInstanceOf(RejectedExecutionException.class);
  }

  @Test
  void callerRunsUntilShutdown_runsOverflowOnSubmitter() {
    ThreadPoolExecutor pool =
        new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS, new LinkedBlockingQueue<>());
    AtomicBoolean ran = new AtomicBoolean();
    try {
      PipelineConfig.callerRunsUntilShutdown().rejectedExecution(() -> ran.set(true), pool);
      assertThat(ran).isTrue();

      pool.shutdown();
      assertThatThrownBy(
              () -> PipelineConfig.callerRunsUntilShutdown().rejectedExecution(() -> {}, pool))
          .isInstanceOf(RejectedExecutionException.class);
    } finally {
      pool.shutdownNow();
    }
  }
}
