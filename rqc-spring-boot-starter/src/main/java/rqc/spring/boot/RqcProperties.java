package rqc.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the RQC adapter.
 *
 * @see RqcAutoConfiguration
 */
@ConfigurationProperties(prefix = "rqc")
public class RqcProperties {

  /**
   * Base URL of the RQC API. Required unless a {@code DeliveryClient} bean is defined.
   */
  private String baseUrl;

  private Duration connectTimeout = Duration.ofSeconds(10);

  /**
   * Timeout of a single request to RQC.
   */
  private Duration requestTimeout = Duration.ofSeconds(15);

  private final Retry retry = new Retry();
  private final Drain drain = new Drain();
  private final Privacy privacy = new Privacy();
  private final Jdbc jdbc = new Jdbc();
  private final Metrics metrics = new Metrics();

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }

  public Retry getRetry() {
    return retry;
  }

  public Drain getDrain() {
    return drain;
  }

  public Privacy getPrivacy() {
    return privacy;
  }

  public Jdbc getJdbc() {
    return jdbc;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Retry {
    /**
     * Fixed wait between delivery attempts.
     */
    private Duration interval = Duration.ofDays(1);

    /**
     * Total attempts, the synchronous one included, before a task is abandoned.
     */
    private int maxAttempts = 7;

    /**
     * Age after which a queued task is abandoned regardless of attempts.
     */
    private Duration maxAge = Duration.ofDays(10);

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getMaxAge() {
      return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
      this.maxAge = maxAge;
    }
  }

  public static class Drain {
    private int batchSize = 100;
    private int workers = 1;

    /**
     * How long a claimed task stays locked before another drain may take it over.
     */
    private Duration lockTimeout = Duration.ofMinutes(30);

    private final Schedule schedule = new Schedule();

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getWorkers() {
      return workers;
    }

    public void setWorkers(int workers) {
      this.workers = workers;
    }

    public Duration getLockTimeout() {
      return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
    }

    public Schedule getSchedule() {
      return schedule;
    }
  }

  public static class Schedule {
    /**
     * Run the built-in drain scheduler. Off by default; hosts usually drive draining from
     * their own scheduler.
     */
    private boolean enabled = false;

    private String cron = "0 0 8 * * *";

    private String zone = "UTC";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }

    public String getZone() {
      return zone;
    }

    public void setZone(String zone) {
      this.zone = zone;
    }
  }

  public static class Privacy {
    /**
     * Send an empty review text for reviews reported anonymously.
     */
    private boolean withholdAnonymousContent = true;

    public boolean isWithholdAnonymousContent() {
      return withholdAnonymousContent;
    }

    public void setWithholdAnonymousContent(boolean withholdAnonymousContent) {
      this.withholdAnonymousContent = withholdAnonymousContent;
    }
  }

  public static class Jdbc {
    /**
     * Create the adapter's tables at startup if they do not exist.
     */
    private boolean initializeSchema = false;

    public boolean isInitializeSchema() {
      return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
      this.initializeSchema = initializeSchema;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "rqc";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
