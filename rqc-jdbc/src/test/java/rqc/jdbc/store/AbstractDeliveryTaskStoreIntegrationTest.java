package rqc.jdbc.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rqc.model.DeliveryTask;
import rqc.model.TaskState;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior every dialect task store must share. Subclasses provide a database with the RQC
 * schema and the store under test.
 */
abstract class AbstractDeliveryTaskStoreIntegrationTest {
  static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");
  static final Instant LOCK_EXPIRY = T0.minus(Duration.ofMinutes(30));

  abstract DataSource dataSource();

  abstract AbstractJdbcDeliveryTaskStore store();

  @BeforeEach
  void clearTasks() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      conn.setAutoCommit(true);
      conn.createStatement().execute("DELETE FROM rqc_delivery_task");
    }
  }

  static DeliveryTask task(String submissionRef, String payload) {
    return new DeliveryTask(UUID.randomUUID().toString(), "J1:" + submissionRef, "J1", submissionRef,
        payload, 1, 1, T0.minusSeconds(60), T0, TaskState.PENDING, "HTTP 503", null, null, null);
  }

  @Test
  void upsertMergesIntoOutstandingRow() throws Exception {
    DeliveryTask first = task("S1", "{\"decision\":\"accept\"}");
    try (Connection conn = dataSource().getConnection()) {
      store().upsert(conn, first);
      store().upsert(conn, task("S1", "{\"decision\":\"reject\"}"));

      DeliveryTask merged = store().findOutstanding(conn, "J1:S1").orElseThrow();
      assertEquals(first.taskId(), merged.taskId());
      assertEquals("{\"decision\":\"reject\"}", merged.payload());
      assertEquals(2L, merged.revision());
      assertEquals(1, store().countOutstanding(conn));
    }
  }

  @Test
  void concurrentUpsertsLeaveOneRow() throws Exception {
    int writers = 4;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < writers; i++) {
        String payload = "{\"n\":" + i + "}";
        futures.add(pool.submit(() -> {
          start.await();
          try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, task("S1", payload));
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }

    try (Connection conn = dataSource().getConnection()) {
      assertEquals(1, store().countOutstanding(conn));
      assertEquals((long) writers, store().findOutstanding(conn, "J1:S1").orElseThrow().revision());
    }
  }

  @Test
  void insertIfAbsentKeepsOutstandingPayload() throws Exception {
    try (Connection conn = dataSource().getConnection()) {
      assertTrue(store().insertIfAbsent(conn, task("S1", "{\"decision\":\"reject\"}")));
      assertFalse(store().insertIfAbsent(conn, task("S1", "{\"decision\":\"accept\"}")));

      DeliveryTask kept = store().findOutstanding(conn, "J1:S1").orElseThrow();
      assertEquals("{\"decision\":\"reject\"}", kept.payload());
      assertEquals(1L, kept.revision());
    }
  }

  @Test
  void claimIsCompareAndSet() throws Exception {
    DeliveryTask task = task("S1", "{}");
    try (Connection conn = dataSource().getConnection()) {
      store().upsert(conn, task);

      assertEquals(1, store().findDue(conn, T0, LOCK_EXPIRY, 10).size());
      assertEquals(1, store().claim(conn, task.taskId(), "drain-a", T0, LOCK_EXPIRY));
      assertEquals(0, store().claim(conn, task.taskId(), "drain-b", T0, LOCK_EXPIRY));
      assertTrue(store().findDue(conn, T0, LOCK_EXPIRY, 10).isEmpty());
      assertEquals("drain-a", store().findOutstanding(conn, "J1:S1").orElseThrow().lockedBy());
    }
  }

  @Test
  void staleRevisionIsNotDeleted() throws Exception {
    DeliveryTask task = task("S1", "{}");
    try (Connection conn = dataSource().getConnection()) {
      store().upsert(conn, task);
      store().claim(conn, task.taskId(), "drain-a", T0, LOCK_EXPIRY);
      store().upsert(conn, task("S1", "{\"newer\":true}"));

      assertEquals(0, store().markDelivered(conn, task.taskId(), 1L));
      assertEquals(1, store().markDelivered(conn, task.taskId(), 2L));
      assertEquals(0, store().countOutstanding(conn));
    }
  }

  @Test
  void abandonFreesKeyForNextDecision() throws Exception {
    DeliveryTask task = task("S1", "{}");
    try (Connection conn = dataSource().getConnection()) {
      store().upsert(conn, task);
      store().claim(conn, task.taskId(), "drain-a", T0, LOCK_EXPIRY);

      assertEquals(0, store().markAbandoned(conn, task.taskId(), "drain-b", 7, T0, "gone"));
      assertEquals(1, store().markAbandoned(conn, task.taskId(), "drain-a", 7, T0, "gone"));
      assertTrue(store().findOutstanding(conn, "J1:S1").isEmpty());

      DeliveryTask next = task("S1", "{\"decision\":\"accept\"}");
      store().upsert(conn, next);

      assertEquals(next.taskId(), store().findOutstanding(conn, "J1:S1").orElseThrow().taskId());
      assertEquals(1, store().countAbandoned(conn, "J1"));
      assertEquals(7, store().queryAbandoned(conn, null, 10).get(0).attempts());
    }
  }
}
