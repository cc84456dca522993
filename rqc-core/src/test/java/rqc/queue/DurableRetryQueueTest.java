package rqc.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rqc.DrainSummary;
import rqc.codec.PayloadCodec;
import rqc.credential.CredentialService;
import rqc.delivery.DeliveryOutcome;
import rqc.model.DecisionEvent;
import rqc.model.DecisionKind;
import rqc.model.DeliveryTask;
import rqc.model.TaskState;
import rqc.stub.InMemoryCredentialStore;
import rqc.stub.InMemoryDeliveryTaskStore;
import rqc.stub.MutableClock;
import rqc.stub.RecordingNotifier;
import rqc.stub.ScriptedDeliveryClient;
import rqc.stub.Stubs;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static rqc.stub.Fixtures.*;

class DurableRetryQueueTest {
  private static final Duration DAY = Duration.ofDays(1);

  private MutableClock clock;
  private InMemoryCredentialStore credentials;
  private InMemoryDeliveryTaskStore tasks;
  private ScriptedDeliveryClient client;
  private RecordingNotifier notifier;
  private List<DecisionEvent> delivered;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    credentials = new InMemoryCredentialStore().withValidated(JOURNAL, "key");
    tasks = new InMemoryDeliveryTaskStore();
    client = new ScriptedDeliveryClient();
    notifier = new RecordingNotifier();
    delivered = Collections.synchronizedList(new ArrayList<>());
  }

  private DurableRetryQueue.Builder queueBuilder() {
    return DurableRetryQueue.builder()
        .connectionProvider(Stubs.connectionProvider())
        .taskStore(tasks)
        .deliveryClient(client)
        .credentialService(new CredentialService(Stubs.connectionProvider(), credentials, client, clock))
        .notifier(notifier)
        .onDelivered(delivered::add)
        .clock(clock);
  }

  private DurableRetryQueue queue() {
    return queueBuilder().build();
  }

  @Test
  void firstFailureIsScheduledOneIntervalLater() {
    queue().enqueue(event("S1"), 1, "HTTP 503");

    DeliveryTask task = tasks.only();
    assertEquals(1, task.attempts());
    assertEquals(1L, task.revision());
    assertEquals(TaskState.PENDING, task.state());
    assertEquals(T0.plus(DAY), task.nextAttemptAt());
    assertEquals("J1:S1", task.taskKey());
  }

  @Test
  void reEnqueueReplacesPayloadWithoutGrowingQueue() {
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    DecisionEvent newer = new DecisionEvent(JOURNAL, "S1", "Retitled", T0, DecisionKind.REJECT,
        List.of(), List.of(), List.of(), T0);

    queue.enqueue(newer, 0, "merged");
    queue.enqueue(newer, 0, "merged");

    DeliveryTask task = tasks.only();
    assertEquals(3L, task.revision());
    assertEquals(DecisionKind.REJECT, PayloadCodec.getDefault().decodeEvent(task.payload()).decisionKind());
    assertTrue(queue.hasOutstanding("J1:S1"));
  }

  @Test
  void failedAttemptLeavesNewerQueuedDecisionAlone() {
    DurableRetryQueue queue = queue();
    DecisionEvent newer = new DecisionEvent(JOURNAL, "S1", "Retitled", T0, DecisionKind.REJECT,
        List.of(), List.of(), List.of(), T0);
    queue.enqueue(newer, 0, "busy");

    assertFalse(queue.enqueueIfAbsent(event("S1"), 1, "HTTP 503"));

    DeliveryTask task = tasks.only();
    assertEquals(1L, task.revision());
    assertEquals(0, task.attempts());
    assertEquals(T0, task.nextAttemptAt());
    assertEquals(DecisionKind.REJECT, PayloadCodec.getDefault().decodeEvent(task.payload()).decisionKind());

    assertTrue(queue.enqueueIfAbsent(event("S2"), 1, "HTTP 503"));
    assertEquals(2, tasks.tasks.size());
  }

  @Test
  void nothingIsAttemptedBeforeItIsDue() {
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 1, "HTTP 503");

    assertEquals(DrainSummary.EMPTY, queue.drain(clock.instant()));
    assertTrue(client.reports.isEmpty());
  }

  @Test
  void successfulAttemptRemovesTask() {
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    clock.advance(DAY);

    DrainSummary summary = queue.drain(clock.instant());

    assertEquals(new DrainSummary(1, 1, 0, 0), summary);
    assertTrue(tasks.tasks.isEmpty());
    assertEquals(1, delivered.size());
    assertFalse(queue.hasOutstanding("J1:S1"));
  }

  @Test
  void transientFailureCountsAttemptAndReschedules() {
    client.thenUnavailable(1);
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    clock.advance(DAY);

    DrainSummary summary = queue.drain(clock.instant());

    assertEquals(new DrainSummary(1, 0, 0, 0), summary);
    DeliveryTask task = tasks.only();
    assertEquals(2, task.attempts());
    assertEquals(TaskState.PENDING, task.state());
    assertEquals(clock.instant().plus(DAY), task.nextAttemptAt());
    assertTrue(task.lastError().contains("503"));
  }

  @Test
  void exhaustedTaskIsAbandonedAndReportedOnce() {
    client.thenUnavailable(10);
    DurableRetryQueue queue = queueBuilder().maxAttempts(3).build();
    queue.enqueue(event("S1"), 1, "HTTP 503");

    clock.advance(DAY);
    queue.drain(clock.instant());
    clock.advance(DAY);
    DrainSummary last = queue.drain(clock.instant());

    assertEquals(1, last.abandoned());
    DeliveryTask task = tasks.only();
    assertEquals(TaskState.ABANDONED, task.state());
    assertEquals(3, task.attempts());
    assertEquals(1, notifier.abandoned.size());
    assertEquals(2, client.reports.size());

    clock.advance(DAY);
    assertEquals(DrainSummary.EMPTY, queue.drain(clock.instant()));
    assertEquals(2, client.reports.size(), "abandoned tasks are never attempted again");
    assertEquals(1, notifier.abandoned.size());
    assertFalse(queue.hasOutstanding("J1:S1"));
  }

  @Test
  void tooOldTaskIsAbandonedWithoutAttempt() {
    DurableRetryQueue queue = queueBuilder().maxAge(Duration.ofDays(2)).build();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    clock.advance(Duration.ofDays(2));

    DrainSummary summary = queue.drain(clock.instant());

    assertEquals(new DrainSummary(0, 0, 1, 0), summary);
    assertTrue(client.reports.isEmpty());
    assertEquals(1, notifier.abandoned.size());
  }

  @Test
  void tasksOfUnconfiguredJournalAreDeferred() {
    credentials.credentials.clear();
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    clock.advance(DAY);

    DrainSummary summary = queue.drain(clock.instant());

    assertEquals(new DrainSummary(0, 0, 0, 1), summary);
    DeliveryTask task = tasks.only();
    assertEquals(1, task.attempts(), "deferral does not count as an attempt");
    assertEquals(clock.instant().plus(DAY), task.nextAttemptAt());
    assertTrue(client.reports.isEmpty());
  }

  @Test
  void deferredTaskIsAbandonedAtAgeCeiling() {
    credentials.credentials.clear();
    DurableRetryQueue queue = queueBuilder().maxAge(Duration.ofDays(3)).build();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    for (int day = 0; day < 3; day++) {
      clock.advance(DAY);
      queue.drain(clock.instant());
    }
    assertEquals(TaskState.ABANDONED, tasks.only().state());
    assertEquals(1, notifier.abandoned.size());
  }

  @Test
  void credentialRejectionAbandonsAndInvalidates() {
    client.then(new DeliveryOutcome.CredentialInvalid(JOURNAL, 401, "Unauthorized"));
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    clock.advance(DAY);

    DrainSummary summary = queue.drain(clock.instant());

    assertEquals(new DrainSummary(1, 0, 1, 0), summary);
    assertFalse(credentials.credentials.get(JOURNAL).validated());
    assertEquals(List.of(JOURNAL), notifier.credentialInvalid);
    assertEquals(TaskState.ABANDONED, tasks.only().state());
  }

  @Test
  void permanentRejectionAbandons() {
    client.then(new DeliveryOutcome.PermanentReject(422, "bad payload"));
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    clock.advance(DAY);

    assertEquals(1, queue.drain(clock.instant()).abandoned());
    assertEquals(1, notifier.abandoned.size());
  }

  @Test
  void newDecisionAfterAbandonmentOpensFreshTask() {
    client.then(new DeliveryOutcome.PermanentReject(422, "bad payload"));
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    clock.advance(DAY);
    queue.drain(clock.instant());

    queue.enqueue(event("S1"), 1, "HTTP 503");

    assertEquals(2, tasks.tasks.size());
    assertTrue(queue.hasOutstanding("J1:S1"));
  }

  @Test
  void mergeDuringDeliveryKeepsTaskDueImmediately() {
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 1, "HTTP 503");
    clock.advance(DAY);
    ScriptedDeliveryClient merging = new ScriptedDeliveryClient() {
      @Override
      public synchronized DeliveryOutcome reportDecision(rqc.model.JournalCredential credential, DecisionEvent event) {
        queue.enqueue(event, 0, "merged");
        return super.reportDecision(credential, event);
      }
    };
    DurableRetryQueue racing = queueBuilder().deliveryClient(merging).build();

    racing.drain(clock.instant());

    DeliveryTask task = tasks.only();
    assertEquals(TaskState.PENDING, task.state());
    assertEquals(2L, task.revision());
    assertEquals(clock.instant(), task.nextAttemptAt());
  }

  @Test
  void staleInFlightTaskIsReclaimed() {
    DurableRetryQueue queue = queue();
    queue.enqueue(event("S1"), 0, "busy");
    String taskId = tasks.only().taskId();
    assertEquals(1, tasks.claim(null, taskId, "crashed-drain", clock.instant(), clock.instant()));

    assertEquals(DrainSummary.EMPTY, queue.drain(clock.instant()));

    clock.advance(Duration.ofMinutes(31));
    assertEquals(1, queue.drain(clock.instant()).succeeded());
    assertTrue(tasks.tasks.isEmpty());
  }

  @Test
  void parallelDrainAttemptsEachTaskOnce() {
    DurableRetryQueue queue = queueBuilder().drainWorkers(4).batchSize(3).build();
    for (int i = 0; i < 10; i++) {
      queue.enqueue(event("S" + i), 0, "busy");
      clock.advance(Duration.ofMillis(1));
    }

    DrainSummary summary = queue.drain(clock.instant());

    assertEquals(10, summary.succeeded());
    assertEquals(10, client.reports.size());
    assertTrue(tasks.tasks.isEmpty());
  }

  @Test
  void busySubmissionIsSkipped() {
    InFlightTracker tracker = new DefaultInFlightTracker();
    DurableRetryQueue queue = queueBuilder().inFlightTracker(tracker).build();
    queue.enqueue(event("S1"), 0, "busy");
    tracker.tryAcquire("J1:S1");

    assertEquals(DrainSummary.EMPTY, queue.drain(clock.instant()));
    assertEquals(TaskState.PENDING, tasks.only().state());
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () -> DurableRetryQueue.builder().build());
    assertThrows(IllegalArgumentException.class, () -> queueBuilder().maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class, () -> queueBuilder().batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> queueBuilder().drainWorkers(0).build());
    assertThrows(IllegalArgumentException.class, () -> queueBuilder().maxAge(Duration.ZERO).build());
  }
}
