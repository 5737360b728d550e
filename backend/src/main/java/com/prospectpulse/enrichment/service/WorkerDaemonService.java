package com.prospectpulse.enrichment.service;

import com.prospectpulse.config.ProspectProperties;
import com.prospectpulse.enrichment.model.JobQueueStats;
import com.prospectpulse.enrichment.model.WorkerDrainResponse;
import com.prospectpulse.enrichment.model.WorkerStatusResponse;
import com.prospectpulse.enrichment.persistence.JobQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class WorkerDaemonService {
    private static final Logger log = LoggerFactory.getLogger(WorkerDaemonService.class);

    private final JobQueueRepository queueRepository;
    private final EnrichmentWorker worker;
    private final ProspectProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;
    private int activeWorkerCount;

    public WorkerDaemonService(JobQueueRepository queueRepository, EnrichmentWorker worker, ProspectProperties properties) {
        this.queueRepository = queueRepository;
        this.worker = worker;
        this.properties = properties;
        this.instanceId = "worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled() && properties.getQueue().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public WorkerStatusResponse getStatus() {
        JobQueueStats stats;
        try {
            stats = queueRepository.fetchQueueStats();
        } catch (Exception e) {
            log.warn("Failed to load job queue stats", e);
            stats = new JobQueueStats(0, 0, 0, null);
        }
        return new WorkerStatusResponse(properties.getQueue().isEnabled(), running.get(), activeWorkerCount, stats);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            if (!properties.getQueue().isEnabled()) {
                log.info("Queue delivery disabled, enrichment workers not started");
                return;
            }
            int workerCount = properties.getWorker().getWorkerCount();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("enrichment-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex));
            }
            log.info("Started {} enrichment workers as {}", workerCount, instanceId);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Stopped enrichment workers");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Processes up to {@code maxMessages} due messages on the calling thread.
     */
    public WorkerDrainResponse drain(int maxMessages) {
        int limit = Math.max(1, Math.min(maxMessages, 1000));
        String owner = instanceId + "-drain";
        long lockTtlSeconds = properties.getWorker().getLeaseTtlSeconds();
        int processed = 0;
        int retried = 0;
        while (processed < limit) {
            String jobId = queueRepository.claimNext(owner, lockTtlSeconds);
            if (jobId == null) {
                break;
            }
            processed++;
            if (!handle(jobId, owner)) {
                retried++;
            }
        }
        return new WorkerDrainResponse(processed, retried, queueRepository.fetchQueueStats());
    }

    private void workerLoop(int workerIndex) {
        Thread.currentThread().setName("enrichment-worker-" + workerIndex);
        String owner = instanceId + "-" + workerIndex;
        long lockTtlSeconds = properties.getWorker().getLeaseTtlSeconds();
        Duration timeout = Duration.ofMillis(properties.getWorker().getDequeueTimeoutMs());
        Duration pollInterval = Duration.ofMillis(properties.getWorker().getPollIntervalMs());
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            String jobId;
            try {
                jobId = queueRepository.dequeue(owner, lockTtlSeconds, timeout, pollInterval);
            } catch (Exception e) {
                log.warn("Enrichment worker {} failed to claim queue item", workerIndex, e);
                sleep(properties.getWorker().getPollIntervalMs());
                continue;
            }
            if (jobId == null) {
                continue;
            }
            handle(jobId, owner);
        }
    }

    /**
     * Returns {@code true} when the message was acknowledged, {@code false} when it was put back with a delay.
     */
    private boolean handle(String jobId, String owner) {
        WorkerDisposition disposition;
        try {
            disposition = worker.process(jobId, owner);
        } catch (Exception e) {
            log.warn("Enrichment worker {} failed while processing job {}", owner, jobId, e);
            disposition = WorkerDisposition.retryAfter(Duration.ofMillis(properties.getRetry().getBackoffMs().get(0)));
        }
        try {
            if (disposition.isDone()) {
                queueRepository.ack(jobId);
                return true;
            }
            queueRepository.nack(jobId, disposition.delay());
        } catch (Exception e) {
            log.warn("Failed to settle queue message for job {}, lock will expire", jobId, e);
        }
        return false;
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(10, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
