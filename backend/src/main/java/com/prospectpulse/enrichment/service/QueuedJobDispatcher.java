package com.prospectpulse.enrichment.service;

import com.prospectpulse.enrichment.model.DeliveryMode;
import com.prospectpulse.enrichment.persistence.JobQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class QueuedJobDispatcher implements JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(QueuedJobDispatcher.class);

    private final JobQueueRepository queueRepository;
    private final JobDispatcher fallback;

    public QueuedJobDispatcher(JobQueueRepository queueRepository, JobDispatcher fallback) {
        this.queueRepository = queueRepository;
        this.fallback = fallback;
    }

    @Override
    public DeliveryMode dispatch(String jobId) {
        try {
            queueRepository.enqueue(jobId);
            return DeliveryMode.QUEUED;
        } catch (QueueUnavailableException e) {
            log.warn("Queue unavailable for job {}, running inline instead", jobId, e);
            return fallback.dispatch(jobId);
        }
    }
}
