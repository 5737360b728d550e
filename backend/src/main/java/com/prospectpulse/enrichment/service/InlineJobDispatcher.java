package com.prospectpulse.enrichment.service;

import com.prospectpulse.enrichment.model.DeliveryMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.util.concurrent.TimeUnit;

public class InlineJobDispatcher implements JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(InlineJobDispatcher.class);

    private final EnrichmentWorker worker;
    private final String instanceId;

    public InlineJobDispatcher(EnrichmentWorker worker) {
        this.worker = worker;
        this.instanceId = "inline-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @Override
    public DeliveryMode dispatch(String jobId) {
        String owner = instanceId + "-" + Thread.currentThread().getName();
        WorkerDisposition disposition = worker.process(jobId, owner);
        while (!disposition.isDone()) {
            if (disposition.kind() == WorkerDisposition.Kind.DEFERRED) {
                log.info("Job {} is leased by another owner, leaving it to them", jobId);
                return DeliveryMode.INLINE;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(disposition.delay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Inline execution of job {} interrupted, leaving it for recovery", jobId);
                return DeliveryMode.INLINE;
            }
            disposition = worker.process(jobId, owner);
        }
        return DeliveryMode.INLINE;
    }
}
