package ca.gc.cra.salvage.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {
  @Test
  void workerThreadsCarryPrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(2, "classify", null);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertTrue(name.startsWith("classify-"), name);
    } finally {
      assertTrue(ExecutorFactories.shutdown(pool, 5_000));
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, " ", null);
    try {
      assertEquals("salvage-worker-0", pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS));
    } finally {
      ExecutorFactories.shutdown(pool, 5_000);
    }
  }

  @Test
  void shutdownInterruptsStragglers() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, "slow", null);
    pool.submit(() -> {
      Thread.sleep(10_000);
      return null;
    });

    boolean clean = ExecutorFactories.shutdown(pool, 50);

    assertFalse(clean);
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
  }

  @Test
  void sizeMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }
}
