package io.notify4j.config;

import io.notify4j.core.SchedulerOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for the notification scheduler.
 */
@ConfigurationProperties(prefix = "notify")
public class NotifyProperties {

    public enum StoreType {
        MONGO,
        MEMORY
    }

    private StoreType store = StoreType.MONGO;
    private Duration pollEvery = Duration.ofSeconds(1);
    private int workerConcurrency = 4;
    private int maxRetainedFailures = 100;
    private boolean strictScheduleRange = false; // HH:mm shape only unless enabled
    private String timezone; // null = system default
    private boolean ensureIndexesOnStartup = false;

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Duration getPollEvery() {
        return pollEvery;
    }

    public void setPollEvery(Duration pollEvery) {
        this.pollEvery = pollEvery;
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public int getMaxRetainedFailures() {
        return maxRetainedFailures;
    }

    public void setMaxRetainedFailures(int maxRetainedFailures) {
        this.maxRetainedFailures = maxRetainedFailures;
    }

    public boolean isStrictScheduleRange() {
        return strictScheduleRange;
    }

    public void setStrictScheduleRange(boolean strictScheduleRange) {
        this.strictScheduleRange = strictScheduleRange;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    /**
     * Zone used to interpret HH:mm schedules.
     *
     * @throws java.time.DateTimeException if {@code notify.timezone} is not a valid zone id
     */
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timezone);
    }

    public SchedulerOptions toOptions() {
        return new SchedulerOptions(pollEvery, workerConcurrency, maxRetainedFailures, strictScheduleRange);
    }
}
