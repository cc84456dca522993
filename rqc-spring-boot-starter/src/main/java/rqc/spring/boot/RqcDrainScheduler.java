package rqc.spring.boot;

import rqc.DrainSummary;
import rqc.RqcAdapter;

import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains the RQC retry queue on a cron schedule, by default once a day at 08:00 UTC.
 *
 * <p>Enabled with {@code rqc.drain.schedule.enabled=true}. Deployments with several nodes can
 * enable it everywhere: tasks are claimed individually, so overlapping drains never deliver
 * the same task twice.
 */
public class RqcDrainScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RqcDrainScheduler.class.getName());

  private final RqcAdapter adapter;
  private final CronTrigger trigger;
  private final Clock clock;
  private final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();

  public RqcDrainScheduler(RqcAdapter adapter, String cron, String zone) {
    this.adapter = Objects.requireNonNull(adapter, "adapter");
    ZoneId zoneId = ZoneId.of(Objects.requireNonNull(zone, "zone"));
    this.trigger = new CronTrigger(Objects.requireNonNull(cron, "cron"), zoneId);
    this.clock = Clock.system(zoneId);
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("rqc-drain-scheduler-");
    scheduler.setDaemon(true);
  }

  public void start() {
    scheduler.initialize();
    scheduler.schedule(this::drainNow, trigger);
    logger.log(Level.INFO, "RQC drain scheduled with cron \"{0}\"", trigger.getExpression());
  }

  /**
   * Runs one drain immediately. Failures are logged, never thrown, so the schedule survives.
   */
  public DrainSummary drainNow() {
    try {
      return adapter.drainDueTasks(clock.instant());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "RQC drain failed", e);
      return DrainSummary.EMPTY;
    }
  }

  @Override
  public void close() {
    scheduler.shutdown();
  }
}
