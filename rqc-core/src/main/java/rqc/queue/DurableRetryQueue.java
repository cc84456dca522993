package rqc.queue;

import com.github.f4b6a3.ulid.UlidCreator;
import rqc.DrainSummary;
import rqc.RqcException;
import rqc.codec.PayloadCodec;
import rqc.credential.CredentialService;
import rqc.delivery.DeliveryClient;
import rqc.delivery.DeliveryOutcome;
import rqc.delivery.OutcomeClassifier;
import rqc.model.DecisionEvent;
import rqc.model.DeliveryTask;
import rqc.model.JournalCredential;
import rqc.model.TaskState;
import rqc.spi.ConnectionProvider;
import rqc.spi.DeliveryTaskStore;
import rqc.spi.MetricsExporter;
import rqc.spi.OperatorNotifier;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists decision reports that could not be delivered and replays them when
 * {@link #drain(Instant)} is called by an external scheduler. The queue never schedules itself.
 *
 * <p>Task lifecycle: {@code PENDING → IN_FLIGHT →} deleted on success, back to {@code PENDING}
 * on a transient failure, or {@code ABANDONED} once the attempt or age ceiling is reached or RQC
 * refuses the report. Abandoned tasks are kept for audit and reported to the
 * {@link OperatorNotifier} exactly once.
 *
 * <p>Each task is claimed with a compare-and-set update, so concurrent drains, in this process
 * or another, never attempt the same task twice. In-flight tasks whose claim is older than the
 * lock timeout are treated as orphaned and reclaimed.
 *
 * @see DurableRetryQueue.Builder
 */
public final class DurableRetryQueue {
  private static final Logger logger = Logger.getLogger(DurableRetryQueue.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryTaskStore taskStore;
  private final DeliveryClient deliveryClient;
  private final CredentialService credentialService;
  private final PayloadCodec codec;
  private final OperatorNotifier notifier;
  private final MetricsExporter metrics;
  private final InFlightTracker inFlightTracker;
  private final RetryPolicy retryPolicy;
  private final Consumer<DecisionEvent> onDelivered;
  private final Clock clock;
  private final int maxAttempts;
  private final Duration maxAge;
  private final Duration lockTimeout;
  private final int batchSize;
  private final int drainWorkers;
  private final String ownerId;

  private DurableRetryQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.taskStore = Objects.requireNonNull(builder.taskStore, "taskStore");
    this.deliveryClient = Objects.requireNonNull(builder.deliveryClient, "deliveryClient");
    this.credentialService = Objects.requireNonNull(builder.credentialService, "credentialService");
    this.codec = builder.codec != null ? builder.codec : PayloadCodec.getDefault();
    this.notifier = builder.notifier != null ? builder.notifier : OperatorNotifier.LOGGING;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new FixedIntervalRetryPolicy();
    this.onDelivered = builder.onDelivered != null ? builder.onDelivered : event -> { };
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.maxAge = Objects.requireNonNull(builder.maxAge, "maxAge");
    this.lockTimeout = Objects.requireNonNull(builder.lockTimeout, "lockTimeout");

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    if (builder.drainWorkers < 1) {
      throw new IllegalArgumentException("drainWorkers must be >= 1");
    }
    if (maxAge.isNegative() || maxAge.isZero() || lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalArgumentException("maxAge and lockTimeout must be > 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.batchSize = builder.batchSize;
    this.drainWorkers = builder.drainWorkers;
    this.ownerId = "rqc-" + UlidCreator.getMonotonicUlid();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Parks a decision report. If the submission already has an outstanding task, that task's
   * payload is replaced and its revision bumped instead; the queue never holds two tasks for
   * one submission.
   *
   * @param attemptsMade delivery attempts already made for this payload (0 or 1); a report that
   *                     was never attempted is due immediately
   * @param error        why the report is being queued
   */
  public void enqueue(DecisionEvent event, int attemptsMade, String error) {
    DeliveryTask task = newTask(event, attemptsMade, error);
    try (Connection conn = connectionProvider.getConnection()) {
      taskStore.upsert(conn, task);
    } catch (SQLException e) {
      throw new RqcException("Failed to queue decision report for " + event.taskKey(), e);
    }
    logger.log(Level.INFO, "Queued RQC decision report for {0}: {1}", new Object[]{event.taskKey(), error});
  }

  /**
   * Parks a report whose synchronous attempt failed, unless the submission already has an
   * outstanding task. Such a task was queued while the attempt was running and carries a newer
   * decision, so it is kept as is.
   *
   * @return true if queued, false if a newer report is already outstanding
   */
  public boolean enqueueIfAbsent(DecisionEvent event, int attemptsMade, String error) {
    DeliveryTask task = newTask(event, attemptsMade, error);
    boolean inserted;
    try (Connection conn = connectionProvider.getConnection()) {
      inserted = taskStore.insertIfAbsent(conn, task);
    } catch (SQLException e) {
      throw new RqcException("Failed to queue decision report for " + event.taskKey(), e);
    }
    if (inserted) {
      logger.log(Level.INFO, "Queued RQC decision report for {0}: {1}", new Object[]{event.taskKey(), error});
    } else {
      logger.log(Level.INFO, "Dropped failed RQC report for {0}; a newer decision is already queued",
          event.taskKey());
    }
    return inserted;
  }

  private DeliveryTask newTask(DecisionEvent event, int attemptsMade, String error) {
    Instant now = clock.instant();
    Instant nextAttemptAt = attemptsMade == 0
        ? now : now.plus(retryPolicy.delayAfter(attemptsMade));
    return new DeliveryTask(
        UlidCreator.getMonotonicUlid().toString(),
        event.taskKey(),
        event.journalId(),
        event.submissionRef(),
        codec.encodeEvent(event),
        1L,
        attemptsMade,
        now,
        nextAttemptAt,
        TaskState.PENDING,
        error,
        null,
        null,
        null);
  }

  public Optional<DeliveryTask> findOutstanding(String taskKey) {
    try (Connection conn = connectionProvider.getConnection()) {
      return taskStore.findOutstanding(conn, taskKey);
    } catch (SQLException e) {
      throw new RqcException("Failed to look up outstanding task " + taskKey, e);
    }
  }

  public boolean hasOutstanding(String taskKey) {
    return findOutstanding(taskKey).isPresent();
  }

  /**
   * Attempts every task due at {@code now}, each independently. A failure on one task is
   * logged and does not stop the sweep.
   *
   * @return counts for this sweep
   */
  public DrainSummary drain(Instant now) {
    Instant lockExpiry = now.minus(lockTimeout);
    Set<String> seen = new HashSet<>();
    DrainSummary total = DrainSummary.EMPTY;
    while (true) {
      List<DeliveryTask> batch = loadDue(now, lockExpiry);
      List<DeliveryTask> fresh = batch.stream().filter(t -> seen.add(t.taskId())).toList();
      if (fresh.isEmpty()) {
        break;
      }
      total = total.plus(processBatch(fresh, now, lockExpiry));
      if (batch.size() < batchSize || Thread.currentThread().isInterrupted()) {
        break;
      }
    }
    recordDepth();
    if (total.attempted() > 0 || total.deferred() > 0 || total.abandoned() > 0) {
      logger.log(Level.INFO, "RQC drain finished: {0}", total);
    }
    return total;
  }

  private List<DeliveryTask> loadDue(Instant now, Instant lockExpiry) {
    try (Connection conn = connectionProvider.getConnection()) {
      return taskStore.findDue(conn, now, lockExpiry, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load due RQC tasks", e);
      return List.of();
    }
  }

  private DrainSummary processBatch(List<DeliveryTask> tasks, Instant now, Instant lockExpiry) {
    if (drainWorkers == 1 || tasks.size() == 1) {
      DrainSummary summary = DrainSummary.EMPTY;
      for (DeliveryTask task : tasks) {
        summary = summary.plus(process(task, now, lockExpiry));
      }
      return summary;
    }
    ExecutorService pool = Executors.newFixedThreadPool(
        Math.min(drainWorkers, tasks.size()), new DrainWorkerThreads());
    try {
      List<Future<DrainSummary>> futures = new ArrayList<>();
      for (DeliveryTask task : tasks) {
        futures.add(pool.submit(() -> process(task, now, lockExpiry)));
      }
      DrainSummary summary = DrainSummary.EMPTY;
      for (Future<DrainSummary> future : futures) {
        try {
          summary = summary.plus(future.get());
        } catch (ExecutionException e) {
          logger.log(Level.SEVERE, "RQC drain worker failed", e.getCause());
        }
      }
      return summary;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return DrainSummary.EMPTY;
    } finally {
      pool.shutdownNow();
    }
  }

  private DrainSummary process(DeliveryTask task, Instant now, Instant lockExpiry) {
    if (!inFlightTracker.tryAcquire(task.taskKey())) {
      return DrainSummary.EMPTY;
    }
    try (Connection conn = connectionProvider.getConnection()) {
      if (taskStore.claim(conn, task.taskId(), ownerId, now, lockExpiry) == 0) {
        return DrainSummary.EMPTY;
      }
      return attempt(conn, task, now);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to process RQC task " + task.taskId(), e);
      return DrainSummary.EMPTY;
    } finally {
      inFlightTracker.release(task.taskKey());
    }
  }

  private DrainSummary attempt(Connection conn, DeliveryTask task, Instant now) {
    if (isExpired(task, now)) {
      return abandon(conn, task, task.attempts(), now, false,
          new QueueExhaustedException("Task older than " + maxAge));
    }

    Optional<JournalCredential> credential = credentialService.find(task.journalId());
    if (credential.isEmpty() || !credential.get().validated()) {
      Instant nextAt = now.plus(retryPolicy.delayAfter(Math.max(1, task.attempts())));
      taskStore.markDeferred(conn, task.taskId(), nextAt, "Credentials missing or not validated");
      metrics.incrementDeferred();
      return new DrainSummary(0, 0, 0, 1);
    }

    DecisionEvent event;
    try {
      event = codec.decodeEvent(task.payload());
    } catch (RqcException e) {
      return abandon(conn, task, task.attempts(), now, false,
          new QueueExhaustedException("Queued payload cannot be decoded", e));
    }

    DeliveryOutcome outcome = send(credential.get(), event);
    int attempts = task.attempts() + 1;

    if (outcome instanceof DeliveryOutcome.Delivered) {
      if (taskStore.markDelivered(conn, task.taskId(), task.revision()) == 0) {
        taskStore.markDeferred(conn, task.taskId(), now, "A newer decision was merged during delivery");
      }
      metrics.incrementDelivered();
      onDelivered.accept(event);
      logger.log(Level.INFO, "Delivered queued RQC report for {0} on attempt {1}",
          new Object[]{task.taskKey(), attempts});
      return new DrainSummary(1, 1, 0, 0);
    }
    if (outcome instanceof DeliveryOutcome.TransientFailure) {
      if (attempts >= maxAttempts) {
        return abandon(conn, task, attempts, now, true, new QueueExhaustedException(
            "Gave up after " + attempts + " attempts", outcome.toException()));
      }
      Instant nextAt = now.plus(retryPolicy.delayAfter(attempts));
      taskStore.markRetry(conn, task.taskId(), nextAt, outcome.describe());
      metrics.incrementRetried();
      logger.log(Level.WARNING, "RQC report for {0} failed on attempt {1}, retrying at {2}: {3}",
          new Object[]{task.taskKey(), attempts, nextAt, outcome.describe()});
      return new DrainSummary(1, 0, 0, 0);
    }
    if (outcome instanceof DeliveryOutcome.CredentialInvalid) {
      credentialService.markInvalid(task.journalId());
      notifier.onCredentialInvalid(task.journalId(), outcome.describe());
    }
    metrics.incrementRejected();
    return abandon(conn, task, attempts, now, true,
        new QueueExhaustedException("RQC refused the report", outcome.toException()));
  }

  private DeliveryOutcome send(JournalCredential credential, DecisionEvent event) {
    try {
      return deliveryClient.reportDecision(credential, event);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "RQC delivery client failed for " + event.taskKey(), e);
      return OutcomeClassifier.noResponse(e);
    }
  }

  private DrainSummary abandon(Connection conn, DeliveryTask task, int attempts, Instant now,
      boolean attempted, QueueExhaustedException reason) {
    String error = reason.getCause() != null
        ? reason.getMessage() + ": " + reason.getCause().getMessage() : reason.getMessage();
    int updated = taskStore.markAbandoned(conn, task.taskId(), ownerId, attempts, now, error);
    if (updated == 0) {
      return new DrainSummary(attempted ? 1 : 0, 0, 0, 0);
    }
    DeliveryTask abandoned = new DeliveryTask(task.taskId(), task.taskKey(), task.journalId(),
        task.submissionRef(), task.payload(), task.revision(), attempts, task.createdAt(),
        task.nextAttemptAt(), TaskState.ABANDONED, error, null, null, now);
    metrics.incrementAbandoned();
    notifier.onAbandoned(abandoned, reason);
    return new DrainSummary(attempted ? 1 : 0, 0, 1, 0);
  }

  private boolean isExpired(DeliveryTask task, Instant now) {
    return Duration.between(task.createdAt(), now).compareTo(maxAge) >= 0;
  }

  private void recordDepth() {
    try (Connection conn = connectionProvider.getConnection()) {
      metrics.recordOutstandingDepth(taskStore.countOutstanding(conn));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to count outstanding RQC tasks", e);
    }
  }

  /** Builder for {@link DurableRetryQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DeliveryTaskStore taskStore;
    private DeliveryClient deliveryClient;
    private CredentialService credentialService;
    private PayloadCodec codec;
    private OperatorNotifier notifier;
    private MetricsExporter metrics;
    private InFlightTracker inFlightTracker;
    private RetryPolicy retryPolicy;
    private Consumer<DecisionEvent> onDelivered;
    private Clock clock;
    private int maxAttempts = 7;
    private Duration maxAge = Duration.ofDays(10);
    private Duration lockTimeout = Duration.ofMinutes(30);
    private int batchSize = 100;
    private int drainWorkers = 1;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the persistence backend of the queue.
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
    public Builder deliveryClient(DeliveryClient deliveryClient) {
      this.deliveryClient = deliveryClient;
      return this;
    }

    /**
     * Sets the source of journal credentials; tasks of journals without validated credentials
     * are deferred.
     *
     * <p><b>Required.</b>
     */
    public Builder credentialService(CredentialService credentialService) {
      this.credentialService = credentialService;
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
     * <p>Optional. Defaults to {@link OperatorNotifier#LOGGING}.
     */
    public Builder notifier(OperatorNotifier notifier) {
      this.notifier = notifier;
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
     * Sets the tracker shared with the synchronous report path.
     *
     * <p>Optional. Defaults to a private {@link DefaultInFlightTracker}.
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link FixedIntervalRetryPolicy} with a one-day interval.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets a callback invoked with every event delivered from the queue.
     *
     * <p>Optional.
     */
    public Builder onDelivered(Consumer<DecisionEvent> onDelivered) {
      this.onDelivered = onDelivered;
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
     * Sets the total number of attempts, including the synchronous one, before a task is
     * abandoned.
     *
     * <p>Optional. Defaults to {@code 7}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the age at which a task is abandoned regardless of attempts.
     *
     * <p>Optional. Defaults to 10 days.
     */
    public Builder maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    /**
     * Sets how long an in-flight claim is honored before another drain may reclaim the task.
     *
     * <p>Optional. Defaults to 30 minutes.
     */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 100}. Must be &ge; 1.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets how many tasks a drain attempts in parallel. Values above 1 use a short-lived pool
     * of daemon threads per batch.
     *
     * <p>Optional. Defaults to {@code 1}.
     */
    public Builder drainWorkers(int drainWorkers) {
      this.drainWorkers = drainWorkers;
      return this;
    }

    /**
     * @throws NullPointerException     if a required parameter is missing
     * @throws IllegalArgumentException if a numeric parameter is out of range
     */
    public DurableRetryQueue build() {
      return new DurableRetryQueue(this);
    }
  }
}
