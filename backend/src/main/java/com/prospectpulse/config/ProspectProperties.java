package com.prospectpulse.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "prospect")
public class ProspectProperties {
    private static final String DEFAULT_WORKSPACE_ID = "default";

    private String defaultWorkspaceId;
    private Queue queue = new Queue();
    private Worker worker = new Worker();
    private Retry retry = new Retry();
    private Stream stream = new Stream();
    private RateLimit rateLimit = new RateLimit();
    private Stages stages = new Stages();

    public String getDefaultWorkspaceId() {
        return normalizeWorkspaceId(defaultWorkspaceId);
    }

    public void setDefaultWorkspaceId(String defaultWorkspaceId) {
        this.defaultWorkspaceId = normalizeWorkspaceId(defaultWorkspaceId);
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Stages getStages() {
        return stages;
    }

    public void setStages(Stages stages) {
        this.stages = stages;
    }

    public static String normalizeWorkspaceId(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_WORKSPACE_ID;
        }
        return candidate.trim();
    }

    public static class Queue {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int workerCount = 2;
        private int pollIntervalMs = 500;
        private int dequeueTimeoutMs = 2000;
        private long leaseTtlSeconds = 600;
        private int staleJobMinutes = 15;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return Math.max(10, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(10, pollIntervalMs);
        }

        public int getDequeueTimeoutMs() {
            return Math.max(0, dequeueTimeoutMs);
        }

        public void setDequeueTimeoutMs(int dequeueTimeoutMs) {
            this.dequeueTimeoutMs = Math.max(0, dequeueTimeoutMs);
        }

        public long getLeaseTtlSeconds() {
            return Math.max(1, leaseTtlSeconds);
        }

        public void setLeaseTtlSeconds(long leaseTtlSeconds) {
            this.leaseTtlSeconds = Math.max(1, leaseTtlSeconds);
        }

        public int getStaleJobMinutes() {
            return Math.max(1, staleJobMinutes);
        }

        public void setStaleJobMinutes(int staleJobMinutes) {
            this.staleJobMinutes = Math.max(1, staleJobMinutes);
        }
    }

    public static class Retry {
        private int maxAttempts = 5;
        private List<Long> backoffMs = new ArrayList<>(List.of(1000L, 5000L, 30000L, 120000L));
        private long jitterMs = 250;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public List<Long> getBackoffMs() {
            if (backoffMs == null || backoffMs.isEmpty()) {
                return List.of(1000L);
            }
            return backoffMs;
        }

        public void setBackoffMs(List<Long> backoffMs) {
            this.backoffMs = backoffMs;
        }

        public long getJitterMs() {
            return Math.max(0, jitterMs);
        }

        public void setJitterMs(long jitterMs) {
            this.jitterMs = Math.max(0, jitterMs);
        }
    }

    public static class Stream {
        private int pollIntervalMs = 500;
        private int defaultTimeoutSeconds = 60;
        private int maxTimeoutSeconds = 600;

        public int getPollIntervalMs() {
            return Math.max(10, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(10, pollIntervalMs);
        }

        public int getDefaultTimeoutSeconds() {
            return Math.max(1, Math.min(defaultTimeoutSeconds, getMaxTimeoutSeconds()));
        }

        public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
            this.defaultTimeoutSeconds = Math.max(1, defaultTimeoutSeconds);
        }

        public int getMaxTimeoutSeconds() {
            return Math.max(1, maxTimeoutSeconds);
        }

        public void setMaxTimeoutSeconds(int maxTimeoutSeconds) {
            this.maxTimeoutSeconds = Math.max(1, maxTimeoutSeconds);
        }
    }

    public static class RateLimit {
        private Provider defaults = new Provider();
        private Map<String, Provider> providers = new LinkedHashMap<>();

        public Provider getDefaults() {
            return defaults;
        }

        public void setDefaults(Provider defaults) {
            this.defaults = defaults;
        }

        public Map<String, Provider> getProviders() {
            return providers;
        }

        public void setProviders(Map<String, Provider> providers) {
            this.providers = providers == null ? new LinkedHashMap<>() : providers;
        }

        public Provider forProvider(String provider) {
            if (provider == null) {
                return defaults;
            }
            Provider configured = providers.get(provider.trim().toLowerCase(Locale.ROOT));
            return configured == null ? defaults : configured;
        }
    }

    public static class Provider {
        private double ratePerSecond = 5.0;
        private int capacity = 10;
        private long acquireTimeoutMs = 0;

        public double getRatePerSecond() {
            return ratePerSecond <= 0 ? 0.001 : ratePerSecond;
        }

        public void setRatePerSecond(double ratePerSecond) {
            this.ratePerSecond = ratePerSecond;
        }

        public int getCapacity() {
            return Math.max(1, capacity);
        }

        public void setCapacity(int capacity) {
            this.capacity = Math.max(1, capacity);
        }

        public long getAcquireTimeoutMs() {
            return Math.max(0, acquireTimeoutMs);
        }

        public void setAcquireTimeoutMs(long acquireTimeoutMs) {
            this.acquireTimeoutMs = Math.max(0, acquireTimeoutMs);
        }
    }

    public static class Stages {
        private String minerProvider = "search";
        private String validatorProvider = "enrichment";
        private String synthesizerProvider = "llm";

        public String getMinerProvider() {
            return minerProvider;
        }

        public void setMinerProvider(String minerProvider) {
            this.minerProvider = minerProvider;
        }

        public String getValidatorProvider() {
            return validatorProvider;
        }

        public void setValidatorProvider(String validatorProvider) {
            this.validatorProvider = validatorProvider;
        }

        public String getSynthesizerProvider() {
            return synthesizerProvider;
        }

        public void setSynthesizerProvider(String synthesizerProvider) {
            this.synthesizerProvider = synthesizerProvider;
        }
    }
}
