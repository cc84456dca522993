package rqc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rqc.codec.PayloadCodec;
import rqc.consent.ConsentLookup;
import rqc.delivery.CredentialCheck;
import rqc.delivery.CredentialInvalidException;
import rqc.delivery.DeliveryOutcome;
import rqc.delivery.GradingResponse;
import rqc.delivery.PermanentRejectException;
import rqc.host.HostDecisionKind;
import rqc.host.HostEditorAssignment;
import rqc.host.HostEditorRole;
import rqc.host.Review;
import rqc.model.ConsentRecord;
import rqc.model.DecisionEvent;
import rqc.model.DecisionKind;
import rqc.model.DeliveryTask;
import rqc.model.EditorLevel;
import rqc.model.JournalCredential;
import rqc.model.ReviewPayload;
import rqc.model.TaskState;
import rqc.queue.DefaultInFlightTracker;
import rqc.stub.InMemoryConsentStore;
import rqc.stub.InMemoryCredentialStore;
import rqc.stub.InMemoryDeliveryRecordStore;
import rqc.stub.InMemoryDeliveryTaskStore;
import rqc.stub.MutableClock;
import rqc.stub.RecordingNotifier;
import rqc.stub.ScriptedDeliveryClient;
import rqc.stub.Stubs;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static rqc.stub.Fixtures.*;

class RqcAdapterTest {
  private static final Duration DAY = Duration.ofDays(1);

  private MutableClock clock;
  private InMemoryCredentialStore credentials;
  private InMemoryConsentStore consents;
  private InMemoryDeliveryTaskStore tasks;
  private InMemoryDeliveryRecordStore records;
  private ScriptedDeliveryClient client;
  private RecordingNotifier notifier;
  private DefaultInFlightTracker tracker;
  private RqcAdapter adapter;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    credentials = new InMemoryCredentialStore().withValidated(JOURNAL, "key");
    consents = new InMemoryConsentStore();
    tasks = new InMemoryDeliveryTaskStore();
    records = new InMemoryDeliveryRecordStore();
    client = new ScriptedDeliveryClient();
    notifier = new RecordingNotifier();
    tracker = new DefaultInFlightTracker();
    adapter = adapterWith(client);
  }

  private RqcAdapter adapterWith(ScriptedDeliveryClient deliveryClient) {
    return RqcAdapter.builder()
        .connectionProvider(Stubs.connectionProvider())
        .credentialStore(credentials)
        .consentStore(consents)
        .taskStore(tasks)
        .recordStore(records)
        .deliveryClient(deliveryClient)
        .notifier(notifier)
        .inFlightTracker(tracker)
        .clock(clock)
        .build();
  }

  private ReportStatus decide(String submissionRef, List<Review> reviews) {
    return adapter.onEditorialDecisionMade(submission(submissionRef), "accept", editors(), reviews);
  }

  @Test
  void unauthenticatedFirstReviewIsReportedAnonymously() {
    Review oneClick = review("r1", false, T0);

    ConsentLookup lookup = adapter.onReviewSubmitted("r1", JOURNAL, "S1", 2026, false);
    ReportStatus status = decide("S1", List.of(oneClick));

    assertFalse(lookup.promptRequired(), "one-click reviewers are not prompted");
    assertEquals(ReportStatus.DELIVERED, status);
    ReviewPayload payload = client.reports.get(0).reviews().get(0);
    assertTrue(payload.anonymous());
    assertTrue(payload.reviewer().email().endsWith("@example.edu"));
    assertEquals("", payload.reviewer().lastName());
    assertEquals("", payload.content());

    decide("S1", List.of(oneClick));
    assertEquals(payload.reviewer().email(), client.reports.get(1).reviews().get(0).reviewer().email(),
        "token is stable within a submission");
  }

  @Test
  void optedInReviewerIsIdentified() {
    assertTrue(adapter.onReviewSubmitted("r1", JOURNAL, "S1", 2026, true).promptRequired());
    ConsentRecord answer = adapter.onConsentAnswered("r1", JOURNAL, 2026, true);
    assertTrue(answer.optedIn());
    assertFalse(adapter.onReviewSubmitted("r1", JOURNAL, "S1", 2026, true).promptRequired());

    decide("S1", List.of(review("r1", true, T0)));

    ReviewPayload payload = client.reports.get(0).reviews().get(0);
    assertFalse(payload.anonymous());
    assertEquals("r1@uni.example", payload.reviewer().email());
  }

  @Test
  void secondConsentAnswerIsIgnored() {
    adapter.onConsentAnswered("r1", JOURNAL, 2026, false);
    ConsentRecord second = adapter.onConsentAnswered("r1", JOURNAL, 2026, true);
    assertFalse(second.optedIn());
  }

  @Test
  void unavailableServiceThenRecovery() {
    client.thenUnavailable(3);

    assertEquals(ReportStatus.QUEUED, decide("S1", List.of()));
    assertEquals(1, tasks.only().attempts());

    clock.advance(DAY);
    assertEquals(new DrainSummary(1, 0, 0, 0), adapter.drainDueTasks(clock.instant()));
    clock.advance(DAY);
    assertEquals(new DrainSummary(1, 0, 0, 0), adapter.drainDueTasks(clock.instant()));
    clock.advance(DAY);
    assertEquals(new DrainSummary(1, 1, 0, 0), adapter.drainDueTasks(clock.instant()));

    assertTrue(tasks.tasks.isEmpty());
    assertEquals(4, client.reports.size());
    assertTrue(records.find(null, JOURNAL, "S1").isPresent());
    assertTrue(notifier.abandoned.isEmpty());
  }

  @Test
  void credentialRejectionOnFirstAttemptBlocksUntilRevalidated() {
    client.then(new DeliveryOutcome.CredentialInvalid(JOURNAL, 401, "Unauthorized"));

    assertEquals(ReportStatus.CREDENTIAL_INVALID, decide("S1", List.of()));
    assertTrue(tasks.tasks.isEmpty());
    assertEquals(List.of(JOURNAL), notifier.credentialInvalid);
    assertFalse(credentials.credentials.get(JOURNAL).validated());

    assertEquals(ReportStatus.NOT_CONFIGURED, decide("S2", List.of()));
    assertEquals(1, client.reports.size());

    assertTrue(adapter.validateCredentials(JOURNAL).ok());
    assertEquals(ReportStatus.DELIVERED, decide("S2", List.of()));
  }

  @Test
  void permanentRejectionIsNotQueued() {
    client.then(new DeliveryOutcome.PermanentReject(400, "Bad Request"));
    assertEquals(ReportStatus.REJECTED, decide("S1", List.of()));
    assertTrue(tasks.tasks.isEmpty());
    assertEquals(List.of("S1"), notifier.permanentRejects);
  }

  @Test
  void unconfiguredJournalSendsNothing() {
    credentials.credentials.clear();
    assertEquals(ReportStatus.NOT_CONFIGURED, decide("S1", List.of()));
    assertTrue(client.reports.isEmpty());
    assertEquals(List.of(JOURNAL), notifier.configurationErrors);
  }

  @Test
  void unknownDecisionIsReportedToOperators() {
    ReportStatus status = adapter.onEditorialDecisionMade(submission("S1"), "withdrawn", editors(), List.of());
    assertEquals(ReportStatus.MAPPING_FAILED, status);
    assertEquals(List.of("S1"), notifier.mappingFailures);
    assertTrue(client.reports.isEmpty());
  }

  @Test
  void conditionalAcceptIsReportedAsMinorRevision() {
    adapter.onEditorialDecisionMade(submission("S1"), HostDecisionKind.CONDITIONAL_ACCEPT, editors(), List.of());
    assertEquals(DecisionKind.MINOR_REVISION, client.reports.get(0).decisionKind());
  }

  @Test
  void laterDecisionMergesIntoOutstandingTask() {
    client.thenUnavailable(1);
    assertEquals(ReportStatus.QUEUED, decide("S1", List.of()));

    ReportStatus second = adapter.onEditorialDecisionMade(submission("S1"), "reject", editors(), List.of());

    assertEquals(ReportStatus.MERGED_INTO_PENDING, second);
    assertEquals(1, client.reports.size(), "no synchronous attempt while a task is outstanding");
    DeliveryTask task = tasks.only();
    assertEquals(2L, task.revision());
    assertEquals(1, task.attempts());
  }

  @Test
  void busySubmissionIsQueuedWithoutAttempt() {
    tracker.tryAcquire("J1:S1");

    assertEquals(ReportStatus.QUEUED, decide("S1", List.of()));

    assertTrue(client.reports.isEmpty());
    DeliveryTask task = tasks.only();
    assertEquals(0, task.attempts());
    assertEquals(clock.instant(), task.nextAttemptAt());
  }

  @Test
  void failedAttemptDoesNotOverwriteDecisionQueuedMeanwhile() {
    List<ReportStatus> inner = new ArrayList<>();
    RqcAdapter[] racing = new RqcAdapter[1];
    ScriptedDeliveryClient slow = new ScriptedDeliveryClient() {
      @Override
      public synchronized DeliveryOutcome reportDecision(JournalCredential credential, DecisionEvent event) {
        if (reports.isEmpty()) {
          inner.add(racing[0].onEditorialDecisionMade(submission("S1"), "reject", editors(), List.of()));
          reports.add(event);
          return new DeliveryOutcome.TransientFailure(503, "Service Unavailable");
        }
        return super.reportDecision(credential, event);
      }
    };
    racing[0] = adapterWith(slow);

    ReportStatus outer = racing[0].onEditorialDecisionMade(submission("S1"), "accept", editors(), List.of());

    assertEquals(List.of(ReportStatus.QUEUED), inner);
    assertEquals(ReportStatus.QUEUED, outer);
    DeliveryTask task = tasks.only();
    assertEquals(DecisionKind.REJECT, PayloadCodec.getDefault().decodeEvent(task.payload()).decisionKind());
    assertEquals(0, task.attempts());

    assertEquals(new DrainSummary(1, 1, 0, 0), racing[0].drainDueTasks(clock.instant()));
    assertEquals(DecisionKind.REJECT, slow.reports.get(1).decisionKind());
  }

  @Test
  void editorSetIsFrozenAfterFirstDelivery() {
    decide("S1", List.of());
    List<HostEditorAssignment> changed = List.of(
        new HostEditorAssignment(person("newcomer"), HostEditorRole.EDITOR));

    adapter.onEditorialDecisionMade(submission("S1"), "accept", changed, List.of());

    DecisionEvent second = client.reports.get(1);
    assertEquals(client.reports.get(0).editors(), second.editors());
    assertEquals(EditorLevel.SECTION_EDITOR, second.editors().get(0).level());
  }

  @Test
  void abandonedTaskIsVisibleToOperators() {
    client.thenUnavailable(10);
    decide("S1", List.of());
    for (int day = 0; day < 7; day++) {
      clock.advance(DAY);
      adapter.drainDueTasks(clock.instant());
    }

    assertEquals(1, notifier.abandoned.size());
    assertEquals(7, notifier.abandoned.get(0).attempts());
    assertEquals(1, adapter.abandonedTasks().count(JOURNAL));
    assertEquals(TaskState.ABANDONED, adapter.abandonedTasks().query(JOURNAL, 10).get(0).state());
  }

  @Test
  void gradeButtonReturnsRedirect() {
    client.gradingResponse = new GradingResponse(true, "https://rqc.example/grade/1", 303, null);

    GradingResult result = adapter.onGradeButtonPressed(submission("S1"), "ed@uni.example", "https://host/return");

    assertTrue(result.hasRedirect());
    assertEquals("https://rqc.example/grade/1", result.redirectUrl());
    assertEquals("https://host/return", client.gradingRequests.get(0).returnUrl());
    assertTrue(tasks.tasks.isEmpty());
  }

  @Test
  void gradeButtonFailuresAreThrown() {
    client.gradingResponse = new GradingResponse(false, null, 200, "submission unknown");
    assertThrows(PermanentRejectException.class, () -> adapter.onGradeButtonPressed(submission("S1")));

    client.gradingFailure = new CredentialInvalidException(JOURNAL, "HTTP 403");
    assertThrows(CredentialInvalidException.class, () -> adapter.onGradeButtonPressed(submission("S1")));
    assertFalse(credentials.credentials.get(JOURNAL).validated());

    assertThrows(ConfigurationException.class, () -> adapter.onGradeButtonPressed(submission("S1")));
    assertTrue(tasks.tasks.isEmpty());
  }

  @Test
  void saveCredentialsChecksFormatFirst() {
    assertFalse(adapter.saveCredentials("J2", "has space").ok());
    client.credentialCheck = CredentialCheck.failed("unknown");
    assertFalse(adapter.saveCredentials("J2", "abc123").ok());
    assertFalse(credentials.credentials.get("J2").validated());
  }
}
