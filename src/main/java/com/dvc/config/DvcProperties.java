package com.dvc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Engine settings bound from {@code dvc.*}.
 */
@Component
@ConfigurationProperties(prefix = "dvc")
public class DvcProperties {

    private Orchestrator orchestrator = new Orchestrator();
    private Health health = new Health();
    private Flag flag = new Flag();
    private Catalog catalog = new Catalog();
    private Docker docker = new Docker();

    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }
    public Flag getFlag() { return flag; }
    public void setFlag(Flag flag) { this.flag = flag; }
    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }
    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }

    public static class Orchestrator {
        private int maxConcurrentSessions = 5;
        private Duration sessionTimeout = Duration.ofHours(1);
        private Duration minSessionTimeout = Duration.ofMinutes(1);
        private Duration maxSessionTimeout = Duration.ofHours(2);
        private Duration gracePeriod = Duration.ofSeconds(30);
        private Duration cleanupInterval = Duration.ofSeconds(60);
        private Duration provisionTimeout = Duration.ofMinutes(2);
        private int engineThreads = 4;
        private int tombstoneCapacity = 200;

        public int getMaxConcurrentSessions() { return maxConcurrentSessions; }
        public void setMaxConcurrentSessions(int maxConcurrentSessions) { this.maxConcurrentSessions = maxConcurrentSessions; }
        public Duration getSessionTimeout() { return sessionTimeout; }
        public void setSessionTimeout(Duration sessionTimeout) { this.sessionTimeout = sessionTimeout; }
        public Duration getMinSessionTimeout() { return minSessionTimeout; }
        public void setMinSessionTimeout(Duration minSessionTimeout) { this.minSessionTimeout = minSessionTimeout; }
        public Duration getMaxSessionTimeout() { return maxSessionTimeout; }
        public void setMaxSessionTimeout(Duration maxSessionTimeout) { this.maxSessionTimeout = maxSessionTimeout; }
        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
        public Duration getProvisionTimeout() { return provisionTimeout; }
        public void setProvisionTimeout(Duration provisionTimeout) { this.provisionTimeout = provisionTimeout; }
        public int getEngineThreads() { return engineThreads; }
        public void setEngineThreads(int engineThreads) { this.engineThreads = engineThreads; }
        public int getTombstoneCapacity() { return tombstoneCapacity; }
        public void setTombstoneCapacity(int tombstoneCapacity) { this.tombstoneCapacity = tombstoneCapacity; }
    }

    public static class Health {
        private Duration interval = Duration.ofSeconds(30);
        private Duration checkTimeout = Duration.ofSeconds(10);
        private int failureThreshold = 3;
        private Duration backoffBase = Duration.ofSeconds(5);
        private Duration backoffMax = Duration.ofMinutes(2);
        private int workerThreads = 4;

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getCheckTimeout() { return checkTimeout; }
        public void setCheckTimeout(Duration checkTimeout) { this.checkTimeout = checkTimeout; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public Duration getBackoffMax() { return backoffMax; }
        public void setBackoffMax(Duration backoffMax) { this.backoffMax = backoffMax; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    public static class Flag {
        public static final String DEV_SECRET = "dvc-dev-secret-change-me";

        private String secret = DEV_SECRET;
        private int digestLength = 16;

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
        public int getDigestLength() { return digestLength; }
        public void setDigestLength(int digestLength) { this.digestLength = digestLength; }
    }

    public static class Catalog {
        private String location = "classpath:catalog/challenges.json";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    public static class Docker {
        private String host = "unix:///var/run/docker.sock";
        private String accessHost = "localhost";
        private String network = "bridge";
        private Duration stopTimeout = Duration.ofSeconds(10);
        private Duration pullTimeout = Duration.ofMinutes(5);

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public String getAccessHost() { return accessHost; }
        public void setAccessHost(String accessHost) { this.accessHost = accessHost; }
        public String getNetwork() { return network; }
        public void setNetwork(String network) { this.network = network; }
        public Duration getStopTimeout() { return stopTimeout; }
        public void setStopTimeout(Duration stopTimeout) { this.stopTimeout = stopTimeout; }
        public Duration getPullTimeout() { return pullTimeout; }
        public void setPullTimeout(Duration pullTimeout) { this.pullTimeout = pullTimeout; }
    }
}
