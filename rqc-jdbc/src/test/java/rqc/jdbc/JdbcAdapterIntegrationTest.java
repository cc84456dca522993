package rqc.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rqc.DrainSummary;
import rqc.ReportStatus;
import rqc.RqcAdapter;
import rqc.delivery.CredentialCheck;
import rqc.delivery.DeliveryClient;
import rqc.delivery.DeliveryOutcome;
import rqc.delivery.GradingRequest;
import rqc.delivery.GradingResponse;
import rqc.host.HostEditorAssignment;
import rqc.host.HostEditorRole;
import rqc.host.Person;
import rqc.host.Review;
import rqc.host.Submission;
import rqc.jdbc.store.JdbcDeliveryTaskStores;
import rqc.model.DecisionEvent;
import rqc.model.JournalCredential;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the adapter against pooled H2 connections with the JDBC stores.
 */
class JdbcAdapterIntegrationTest {
  private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

  private HikariDataSource hikariDs;
  private FakeRqc rqc;
  private RqcAdapter adapter;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("rqc-test-pool");
    hikariDs = new HikariDataSource(config);

    try (Connection conn = hikariDs.getConnection()) {
      RqcSchema.create(conn, "h2");
    }

    rqc = new FakeRqc();
    adapter = RqcAdapter.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .credentialStore(new JdbcCredentialStore())
        .consentStore(new JdbcConsentStore())
        .taskStore(JdbcDeliveryTaskStores.detect(hikariDs))
        .recordStore(new JdbcDeliveryRecordStore())
        .deliveryClient(rqc)
        .clock(Clock.fixed(T0, ZoneOffset.UTC))
        .build();
    assertTrue(adapter.saveCredentials("J1", "abc123").ok());
  }

  @AfterEach
  void teardown() {
    if (hikariDs != null) {
      hikariDs.close();
    }
  }

  private static Person person(String id) {
    return new Person(id, id + "@uni.example", "First", "Last" + id, null);
  }

  private static Submission submission(String ref) {
    return new Submission(ref, "J1", "A study of " + ref, T0.minus(Duration.ofDays(40)), List.of(person("a1")));
  }

  private static List<HostEditorAssignment> editors() {
    return List.of(new HostEditorAssignment(person("ed"), HostEditorRole.EDITOR));
  }

  private static Review review(String reviewerId, boolean authenticated) {
    Instant asked = T0.minus(Duration.ofDays(30));
    return new Review(person(reviewerId), true, authenticated, "Solid work.", asked,
        asked.plus(Duration.ofDays(1)), asked.plus(Duration.ofDays(21)), asked.plus(Duration.ofDays(14)),
        "accept", 2026);
  }

  @Test
  void deliveredDecisionFreezesEditors() {
    adapter.onConsentAnswered("r1", "J1", 2026, true);

    ReportStatus status = adapter.onEditorialDecisionMade(submission("S1"), "accept", editors(),
        List.of(review("r1", true), review("r2", false)));

    assertEquals(ReportStatus.DELIVERED, status);
    DecisionEvent sent = rqc.reports.get(0);
    assertEquals("r1@uni.example", sent.reviews().get(0).reviewer().email());
    assertTrue(sent.reviews().get(1).anonymous());

    adapter.onEditorialDecisionMade(submission("S1"), "accept",
        List.of(new HostEditorAssignment(person("other"), HostEditorRole.EDITOR)), List.of());
    assertEquals(sent.editors(), rqc.reports.get(1).editors());
  }

  @Test
  void unavailableRqcIsRetriedFromTheDatabase() {
    rqc.outcomes.add(new DeliveryOutcome.TransientFailure(503, "Service Unavailable"));
    rqc.outcomes.add(new DeliveryOutcome.TransientFailure(0, "ConnectException: refused"));

    assertEquals(ReportStatus.QUEUED,
        adapter.onEditorialDecisionMade(submission("S1"), "minor_revisions", editors(), List.of()));
    assertEquals(ReportStatus.MERGED_INTO_PENDING,
        adapter.onEditorialDecisionMade(submission("S1"), "accept", editors(), List.of()));

    DrainSummary first = adapter.drainDueTasks(T0.plus(Duration.ofDays(1)));
    assertEquals(new DrainSummary(1, 0, 0, 0), first);
    DrainSummary second = adapter.drainDueTasks(T0.plus(Duration.ofDays(2)));
    assertEquals(new DrainSummary(1, 1, 0, 0), second);

    assertEquals("ACCEPT", rqc.reports.get(rqc.reports.size() - 1).decisionKind().wireName());
    assertEquals(0, adapter.abandonedTasks().count(null));
  }

  private static final class FakeRqc implements DeliveryClient {
    final Deque<DeliveryOutcome> outcomes = new ArrayDeque<>();
    final List<DecisionEvent> reports = new CopyOnWriteArrayList<>();

    @Override
    public CredentialCheck validateCredentials(JournalCredential credential) {
      return CredentialCheck.passed();
    }

    @Override
    public GradingResponse triggerGrading(JournalCredential credential, GradingRequest request) {
      return new GradingResponse(true, null, 200, "ok");
    }

    @Override
    public synchronized DeliveryOutcome reportDecision(JournalCredential credential, DecisionEvent event) {
      reports.add(event);
      DeliveryOutcome next = outcomes.poll();
      return next != null ? next : new DeliveryOutcome.Delivered(200);
    }
  }
}
