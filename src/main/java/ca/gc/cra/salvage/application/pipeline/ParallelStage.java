package ca.gc.cra.salvage.application.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.slf4j.MDC;

/**
 * Runs one per-artifact task for every input on a worker pool and returns results in input order.
 *
 * <p>Each task runs with the MDC key {@code artifactId} set. On interruption the unfinished tasks are cancelled;
 * tasks that already completed keep their side effects.</p>
 */
final class ParallelStage {
  static final String MDC_ARTIFACT_ID = "artifactId";

  private ParallelStage() {}

  /** A per-artifact task that may halt the batch. */
  @FunctionalInterface
  interface Task<T, R> {
    R apply(T item) throws PipelineException;
  }

  static <T, R> List<R> map(ExecutorService workers, List<T> items, Function<T, String> idOf, Task<T, R> task)
      throws PipelineException, InterruptedException {
    Objects.requireNonNull(workers, "workers");
    List<Callable<R>> callables = new ArrayList<>(items.size());
    for (T item : items) {
      String id = idOf.apply(item);
      callables.add(() -> {
        MDC.put(MDC_ARTIFACT_ID, id);
        try {
          return task.apply(item);
        } finally {
          MDC.remove(MDC_ARTIFACT_ID);
        }
      });
    }
    List<Future<R>> futures = workers.invokeAll(callables);
    List<R> results = new ArrayList<>(futures.size());
    for (int i = 0; i < futures.size(); i++) {
      try {
        results.add(futures.get(i).get());
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof PipelineException pipelineFailure) {
          throw pipelineFailure;
        }
        throw new PipelineException("unexpected failure processing " + idOf.apply(items.get(i)), cause);
      } catch (CancellationException ex) {
        throw new InterruptedException("processing cancelled at " + idOf.apply(items.get(i)));
      }
    }
    return results;
  }
}
