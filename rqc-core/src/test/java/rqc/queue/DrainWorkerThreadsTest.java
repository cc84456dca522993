package rqc.queue;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DrainWorkerThreadsTest {

  @Test
  void namesThreadsPerBatch() {
    DrainWorkerThreads first = new DrainWorkerThreads();
    DrainWorkerThreads second = new DrainWorkerThreads();

    Thread a = first.newThread(() -> {});
    Thread b = first.newThread(() -> {});
    Thread c = second.newThread(() -> {});

    assertEquals("rqc-drain-" + first.batch() + "-1", a.getName());
    assertEquals("rqc-drain-" + first.batch() + "-2", b.getName());
    assertEquals("rqc-drain-" + second.batch() + "-1", c.getName());
    assertNotEquals(first.batch(), second.batch());
  }

  @Test
  void threadsAreDaemons() {
    assertTrue(new DrainWorkerThreads().newThread(() -> {}).isDaemon());
  }
}
