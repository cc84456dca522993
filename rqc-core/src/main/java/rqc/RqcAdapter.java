package rqc;

import rqc.codec.PayloadCodec;
import rqc.consent.AlreadyAnsweredException;
import rqc.consent.ConsentLookup;
import rqc.consent.ConsentService;
import rqc.credential.CredentialService;
import rqc.delivery.CredentialCheck;
import rqc.delivery.CredentialInvalidException;
import rqc.delivery.DeliveryClient;
import rqc.delivery.DeliveryOutcome;
import rqc.delivery.GradingRequest;
import rqc.delivery.GradingResponse;
import rqc.delivery.OutcomeClassifier;
import rqc.delivery.PermanentRejectException;
import rqc.host.HostDecisionKind;
import rqc.host.HostEditorAssignment;
import rqc.host.Review;
import rqc.host.Submission;
import rqc.model.ConsentRecord;
import rqc.model.DecisionEvent;
import rqc.model.DecisionKind;
import rqc.model.DeliveryRecord;
import rqc.model.EditorAssignment;
import rqc.model.JournalCredential;
import rqc.normalize.EventNormalizer;
import rqc.normalize.ReviewerPseudonymizer;
import rqc.normalize.UnmappableDecisionException;
import rqc.queue.AbandonedTaskManager;
import rqc.queue.DefaultInFlightTracker;
import rqc.queue.DurableRetryQueue;
import rqc.queue.FixedIntervalRetryPolicy;
import rqc.queue.InFlightTracker;
import rqc.queue.RetryPolicy;
import rqc.spi.ConnectionProvider;
import rqc.spi.ConsentStore;
import rqc.spi.CredentialStore;
import rqc.spi.DeliveryRecordStore;
import rqc.spi.DeliveryTaskStore;
import rqc.spi.MetricsExporter;
import rqc.spi.OperatorNotifier;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Host-facing entry point of the RQC adapter.
 *
 * <p>The host workflow calls one method per event: a review was submitted, a reviewer answered
 * the consent question, an editor made a decision or pressed the grading button. An external
 * scheduler calls {@link #drainDueTasks(Instant)} periodically (daily by default) to replay
 * decision reports that could not be delivered at decision time.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RqcAdapter rqc = RqcAdapter.builder()
 *     .connectionProvider(connectionProvider)
 *     .credentialStore(new JdbcCredentialStore())
 *     .consentStore(new JdbcConsentStore())
 *     .taskStore(JdbcDeliveryTaskStores.detect(dataSource))
 *     .recordStore(new JdbcDeliveryRecordStore())
 *     .deliveryClient(HttpDeliveryClient.builder().baseUrl(rqcUrl).build())
 *     .build();
 *
 * ReportStatus status = rqc.onEditorialDecisionMade(submission, "accept", editors, reviews);
 * }</pre>
 *
 * @see RqcAdapter.Builder
 */
public final class RqcAdapter {
  private static final Logger logger = Logger.getLogger(RqcAdapter.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryRecordStore recordStore;
  private final DeliveryClient deliveryClient;
  private final ConsentService consentService;
  private final CredentialService credentialService;
  private final EventNormalizer normalizer;
  private final DurableRetryQueue queue;
  private final AbandonedTaskManager abandonedTasks;
  private final InFlightTracker inFlightTracker;
  private final PayloadCodec codec;
  private final MetricsExporter metrics;
  private final OperatorNotifier notifier;
  private final Clock clock;

  private RqcAdapter(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    CredentialStore credentialStore = Objects.requireNonNull(builder.credentialStore, "credentialStore");
    ConsentStore consentStore = Objects.requireNonNull(builder.consentStore, "consentStore");
    DeliveryTaskStore taskStore = Objects.requireNonNull(builder.taskStore, "taskStore");
    this.recordStore = Objects.requireNonNull(builder.recordStore, "recordStore");
    this.deliveryClient = Objects.requireNonNull(builder.deliveryClient, "deliveryClient");
    this.codec = builder.codec != null ? builder.codec : PayloadCodec.getDefault();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.notifier = builder.notifier != null ? builder.notifier : OperatorNotifier.LOGGING;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();

    this.consentService = new ConsentService(connectionProvider, consentStore, clock);
    this.credentialService = new CredentialService(connectionProvider, credentialStore, deliveryClient, clock);
    this.normalizer = new EventNormalizer(builder.withholdAnonymousContent);
    this.queue = DurableRetryQueue.builder()
        .connectionProvider(connectionProvider)
        .taskStore(taskStore)
        .deliveryClient(deliveryClient)
        .credentialService(credentialService)
        .codec(codec)
        .notifier(notifier)
        .metrics(metrics)
        .inFlightTracker(inFlightTracker)
        .retryPolicy(builder.retryPolicy != null
            ? builder.retryPolicy : new FixedIntervalRetryPolicy(builder.retryInterval))
        .onDelivered(this::recordDelivery)
        .clock(clock)
        .maxAttempts(builder.maxAttempts)
        .maxAge(builder.maxAge)
        .lockTimeout(builder.lockTimeout)
        .batchSize(builder.batchSize)
        .drainWorkers(builder.drainWorkers)
        .build();
    this.abandonedTasks = new AbandonedTaskManager(connectionProvider, taskStore);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * A reviewer completed a review. Creates the reviewer's consent record for the grading year
   * if needed and tells the host whether to ask the consent question.
   *
   * <p>Reviewers using one-click access are never prompted; their reviews are always reported
   * anonymously.
   */
  public ConsentLookup onReviewSubmitted(String reviewerId, String journalId, String submissionRef,
      int gradingYear, boolean authenticated) {
    ConsentLookup lookup = consentService.getOrCreateConsent(reviewerId, journalId, gradingYear);
    boolean prompt = lookup.promptRequired() && authenticated;
    logger.log(Level.FINE, "Review of {0} by {1}: consent prompt {2}",
        new Object[]{submissionRef, reviewerId, prompt ? "required" : "not required"});
    return prompt == lookup.promptRequired() ? lookup : new ConsentLookup(lookup.record(), prompt);
  }

  /**
   * A reviewer answered the consent question. A second answer for the same journal-year is
   * ignored and the first answer returned.
   */
  public ConsentRecord onConsentAnswered(String reviewerId, String journalId, int gradingYear, boolean optedIn) {
    try {
      return consentService.recordAnswer(reviewerId, journalId, gradingYear, optedIn);
    } catch (AlreadyAnsweredException e) {
      logger.log(Level.INFO, e.getMessage());
      return consentService.getOrCreateConsent(reviewerId, journalId, gradingYear).record();
    }
  }

  /**
   * An editorial decision was made. Normalizes it and makes one delivery attempt; never throws
   * for delivery or mapping problems, which are reported to the {@link OperatorNotifier}.
   *
   * @param decisionCode host decision code, e.g. {@code accept} or {@code conditional_accept}
   * @throws RqcException only if the adapter's own storage fails
   */
  public ReportStatus onEditorialDecisionMade(Submission submission, String decisionCode,
      List<HostEditorAssignment> editors, List<Review> reviews) {
    DecisionKind kind;
    try {
      kind = normalizer.mapDecision(decisionCode);
    } catch (UnmappableDecisionException e) {
      notifier.onMappingFailed(submission.journalId(), submission.submissionRef(), e);
      return ReportStatus.MAPPING_FAILED;
    }
    return report(submission, kind, editors, reviews);
  }

  /**
   * Typed variant of {@link #onEditorialDecisionMade(Submission, String, List, List)}.
   */
  public ReportStatus onEditorialDecisionMade(Submission submission, HostDecisionKind decision,
      List<HostEditorAssignment> editors, List<Review> reviews) {
    return report(submission, normalizer.mapDecision(decision), editors, reviews);
  }

  private ReportStatus report(Submission submission, DecisionKind kind,
      List<HostEditorAssignment> editors, List<Review> reviews) {
    String journalId = submission.journalId();
    Optional<JournalCredential> credential = credentialService.find(journalId);
    if (credential.isEmpty() || !credential.get().validated()) {
      notifier.onConfigurationError(journalId, credential.isEmpty()
          ? "no credentials saved" : "credentials not validated");
      return ReportStatus.NOT_CONFIGURED;
    }

    DecisionEvent event = buildEvent(submission, kind, editors, reviews);
    String taskKey = event.taskKey();
    if (!inFlightTracker.tryAcquire(taskKey)) {
      queue.enqueue(event, 0, "Submission busy with another delivery");
      metrics.incrementQueued();
      return ReportStatus.QUEUED;
    }
    try {
      if (queue.hasOutstanding(taskKey)) {
        queue.enqueue(event, 0, "Merged into outstanding task");
        metrics.incrementMerged();
        return ReportStatus.MERGED_INTO_PENDING;
      }
      DeliveryOutcome outcome = send(credential.get(), event);
      if (outcome instanceof DeliveryOutcome.Delivered) {
        recordDelivery(event);
        metrics.incrementDelivered();
        return ReportStatus.DELIVERED;
      }
      if (outcome instanceof DeliveryOutcome.TransientFailure) {
        // a decision queued during the attempt is newer than this one and must survive
        if (queue.enqueueIfAbsent(event, 1, outcome.describe())) {
          metrics.incrementQueued();
        } else {
          metrics.incrementMerged();
        }
        return ReportStatus.QUEUED;
      }
      metrics.incrementRejected();
      if (outcome instanceof DeliveryOutcome.CredentialInvalid) {
        credentialService.markInvalid(journalId);
        notifier.onCredentialInvalid(journalId, outcome.describe());
        return ReportStatus.CREDENTIAL_INVALID;
      }
      notifier.onPermanentReject(journalId, submission.submissionRef(), outcome.describe());
      return ReportStatus.REJECTED;
    } finally {
      inFlightTracker.release(taskKey);
    }
  }

  private DecisionEvent buildEvent(Submission submission, DecisionKind kind,
      List<HostEditorAssignment> editors, List<Review> reviews) {
    String journalId = submission.journalId();
    List<EditorAssignment> mappedEditors = findDeliveryRecord(journalId, submission.submissionRef())
        .map(DeliveryRecord::editors)
        .orElseGet(() -> normalizer.mapEditors(editors));
    ReviewerPseudonymizer pseudonymizer = ReviewerPseudonymizer.forSubmission(
        credentialService.getOrCreateSalt(journalId), submission.submissionRef());

    Map<Review, ConsentRecord> consents = new HashMap<>();
    for (Review review : normalizer.selectReviews(reviews)) {
      consents.put(review, consentService.getOrCreateConsent(
          review.reviewer().personId(), journalId, review.gradingYear()).record());
    }
    return normalizer.normalize(submission, kind, mappedEditors, reviews, consents::get,
        pseudonymizer, clock.instant());
  }

  private DeliveryOutcome send(JournalCredential credential, DecisionEvent event) {
    try {
      return deliveryClient.reportDecision(credential, event);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "RQC delivery client failed for " + event.taskKey(), e);
      return OutcomeClassifier.noResponse(e);
    }
  }

  /**
   * An editor pressed the grading button. Interactive: failures are thrown, nothing is queued.
   *
   * @param interactiveUser email of the editor, may be {@code null}
   * @param returnUrl       page RQC should send the editor back to, may be {@code null}
   * @throws ConfigurationException                   if the journal has no validated credentials
   * @throws CredentialInvalidException               if RQC refused the credentials
   * @throws PermanentRejectException                 if RQC refused the request
   * @throws rqc.delivery.TransientDeliveryException  if RQC could not be reached
   */
  public GradingResult onGradeButtonPressed(Submission submission, String interactiveUser, String returnUrl) {
    String journalId = submission.journalId();
    JournalCredential credential = credentialService.requireValidated(journalId);
    GradingResponse response;
    try {
      response = deliveryClient.triggerGrading(credential,
          new GradingRequest(submission.submissionRef(), interactiveUser, returnUrl));
    } catch (CredentialInvalidException e) {
      credentialService.markInvalid(journalId);
      notifier.onCredentialInvalid(journalId, e.getMessage());
      throw e;
    }
    if (!response.ok()) {
      throw new PermanentRejectException(response.statusCode(),
          "RQC declined grading of " + submission.submissionRef() + ": " + response.message());
    }
    return new GradingResult(response.redirectUrl(), response.message());
  }

  public GradingResult onGradeButtonPressed(Submission submission) {
    return onGradeButtonPressed(submission, null, null);
  }

  /**
   * Replays due decision reports. Called by the host's scheduler.
   */
  public DrainSummary drainDueTasks(Instant now) {
    return queue.drain(now);
  }

  /**
   * Saves and validates a journal's credentials.
   */
  public CredentialCheck saveCredentials(String journalId, String apiKey) {
    return credentialService.save(journalId, apiKey);
  }

  /**
   * Re-validates a journal's stored credentials, e.g. after RQC refused them.
   */
  public CredentialCheck validateCredentials(String journalId) {
    return credentialService.validate(journalId);
  }

  public AbandonedTaskManager abandonedTasks() {
    return abandonedTasks;
  }

  private Optional<DeliveryRecord> findDeliveryRecord(String journalId, String submissionRef) {
    return withConnection("load delivery record of " + submissionRef,
        conn -> recordStore.find(conn, journalId, submissionRef));
  }

  private void recordDelivery(DecisionEvent event) {
    DeliveryRecord record = new DeliveryRecord(event.journalId(), event.submissionRef(),
        event.editors(), clock.instant());
    withConnection("record delivery of " + event.submissionRef(),
        conn -> recordStore.insertIfAbsent(conn, record));
  }

  private <T> T withConnection(String action, ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new RqcException("Failed to " + action, e);
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }

  /** Builder for {@link RqcAdapter}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CredentialStore credentialStore;
    private ConsentStore consentStore;
    private DeliveryTaskStore taskStore;
    private DeliveryRecordStore recordStore;
    private DeliveryClient deliveryClient;
    private PayloadCodec codec;
    private MetricsExporter metrics;
    private OperatorNotifier notifier;
    private InFlightTracker inFlightTracker;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private Duration retryInterval = FixedIntervalRetryPolicy.DEFAULT_INTERVAL;
    private int maxAttempts = 7;
    private Duration maxAge = Duration.ofDays(10);
    private Duration lockTimeout = Duration.ofMinutes(30);
    private int batchSize = 100;
    private int drainWorkers = 1;
    private boolean withholdAnonymousContent = true;

    private Builder() {}

    /**
     * Sets the connection provider used by every store.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder credentialStore(CredentialStore credentialStore) {
      this.credentialStore = credentialStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder consentStore(ConsentStore consentStore) {
      this.consentStore = consentStore;
      return this;
    }

    /**
     * Sets the retry queue's persistence backend.
     *
     * <p><b>Required.</b>
     */
    public Builder taskStore(DeliveryTaskStore taskStore) {
      this.taskStore = taskStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder recordStore(DeliveryRecordStore recordStore) {
      this.recordStore = recordStore;
      return this;
    }

    /**
     * Sets the transport to RQC.
     *
     * <p><b>Required.</b>
     */
    public Builder deliveryClient(DeliveryClient deliveryClient) {
      this.deliveryClient = deliveryClient;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link PayloadCodec#getDefault()}.
     */
    public Builder codec(PayloadCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link OperatorNotifier#LOGGING}.
     */
    public Builder notifier(OperatorNotifier notifier) {
      this.notifier = notifier;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link DefaultInFlightTracker}.
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets a custom retry policy. Takes precedence over {@link #retryInterval(Duration)}.
     *
     * <p>Optional.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to one day.
     */
    public Builder retryInterval(Duration retryInterval) {
      this.retryInterval = Objects.requireNonNull(retryInterval, "retryInterval");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 7}, counting the synchronous attempt.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * <p>Optional. Defaults to 10 days.
     */
    public Builder maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    /**
     * <p>Optional. Defaults to 30 minutes.
     */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 100}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 1}.
     */
    public Builder drainWorkers(int drainWorkers) {
      this.drainWorkers = drainWorkers;
      return this;
    }

    /**
     * Whether the review text of anonymously reported reviewers is withheld.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder withholdAnonymousContent(boolean withholdAnonymousContent) {
      this.withholdAnonymousContent = withholdAnonymousContent;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @throws NullPointerException     if a required parameter is missing
     * @throws IllegalArgumentException if a numeric parameter is out of range
     */
    public RqcAdapter build() {
      return new RqcAdapter(this);
    }
  }
}
