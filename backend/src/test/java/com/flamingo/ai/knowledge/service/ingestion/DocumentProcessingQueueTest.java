package com.flamingo.ai.knowledge.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentProcessingQueueTest {

  @Mock private DocumentProcessingService processingService;

  @Test
  void shouldJoinRunAlreadyInFlight() {
    ManualExecutor executor = new ManualExecutor();
    DocumentProcessingQueue queue = new DocumentProcessingQueue(processingService, executor);
    UUID documentId = UUID.randomUUID();
    when(processingService.process(documentId))
        .thenReturn(ProcessingOutcome.succeeded(documentId, 3, 42));

    CompletableFuture<ProcessingOutcome> first = queue.submit(documentId);
    CompletableFuture<ProcessingOutcome> second = queue.submit(documentId);

    assertThat(second).isSameAs(first);
    assertThat(queue.isInFlight(documentId)).isTrue();

    executor.runAll();

    assertThat(first.join().chunkCount()).isEqualTo(3);
    assertThat(queue.isInFlight(documentId)).isFalse();
    verify(processingService, times(1)).process(documentId);
  }

  @Test
  void shouldStartNewRun_afterPreviousCompleted() {
    ManualExecutor executor = new ManualExecutor();
    DocumentProcessingQueue queue = new DocumentProcessingQueue(processingService, executor);
    UUID documentId = UUID.randomUUID();
    when(processingService.process(documentId))
        .thenReturn(ProcessingOutcome.succeeded(documentId, 1, 1));

    queue.submit(documentId);
    executor.runAll();
    queue.submit(documentId);
    executor.runAll();

    verify(processingService, times(2)).process(documentId);
  }

  @Test
  void shouldRecordFailure_whenExecutorRejects() {
    Executor rejecting =
        command -> {
          throw new RejectedExecutionException("queue full");
        };
    DocumentProcessingQueue queue = new DocumentProcessingQueue(processingService, rejecting);
    UUID documentId = UUID.randomUUID();

    ProcessingOutcome outcome = queue.submit(documentId).join();

    assertThat(outcome.success()).isFalse();
    assertThat(outcome.error()).isEqualTo("Processing queue is full, retry later");
    assertThat(queue.isInFlight(documentId)).isFalse();
    verify(processingService).recordFailure(documentId, "Processing queue is full, retry later");
  }

  /** Holds submitted tasks until the test runs them. */
  private static class ManualExecutor implements Executor {

    private final List<Runnable> tasks = new ArrayList<>();

    @Override
    public void execute(Runnable command) {
      tasks.add(command);
    }

    void runAll() {
      List<Runnable> pending = new ArrayList<>(tasks);
      tasks.clear();
      pending.forEach(Runnable::run);
    }
  }
}
