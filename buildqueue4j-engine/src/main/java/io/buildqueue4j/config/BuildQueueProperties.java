package io.buildqueue4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the build queue.
 */
@ConfigurationProperties(prefix = "buildqueue")
public class BuildQueueProperties {
    private boolean enabled = true;
    private int workerCount = 4;
    private int subprocessSlotsPerWorker = 2;
    private boolean expandOnStartup = false;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private String jobLoggerName = "buildqueue.jobs";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public int getSubprocessSlotsPerWorker() {
        return subprocessSlotsPerWorker;
    }

    public void setSubprocessSlotsPerWorker(int subprocessSlotsPerWorker) {
        this.subprocessSlotsPerWorker = subprocessSlotsPerWorker;
    }

    public boolean isExpandOnStartup() {
        return expandOnStartup;
    }

    public void setExpandOnStartup(boolean expandOnStartup) {
        this.expandOnStartup = expandOnStartup;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getJobLoggerName() {
        return jobLoggerName;
    }

    public void setJobLoggerName(String jobLoggerName) {
        this.jobLoggerName = jobLoggerName;
    }
}
