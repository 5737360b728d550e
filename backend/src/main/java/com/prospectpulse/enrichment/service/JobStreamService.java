package com.prospectpulse.enrichment.service;

import com.prospectpulse.config.ProspectProperties;
import com.prospectpulse.enrichment.model.Job;
import com.prospectpulse.enrichment.model.JobStatus;
import com.prospectpulse.enrichment.persistence.EnrichmentJdbcRepository;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Polls the store and yields a job snapshot each time its status changes. The stream ends after the terminal
 * snapshot or when the timeout elapses.
 */
@Service
public class JobStreamService {
    private final EnrichmentJdbcRepository repository;
    private final ProspectProperties properties;

    public JobStreamService(EnrichmentJdbcRepository repository, ProspectProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public Duration resolveTimeout(Integer timeoutSeconds) {
        ProspectProperties.Stream config = properties.getStream();
        if (timeoutSeconds == null) {
            return Duration.ofSeconds(config.getDefaultTimeoutSeconds());
        }
        return Duration.ofSeconds(Math.max(1, Math.min(timeoutSeconds, config.getMaxTimeoutSeconds())));
    }

    public Stream<Job> stream(String jobId, Duration timeout) {
        return stream(jobId, timeout, () -> false);
    }

    /**
     * Fails fast with {@link JobNotFoundException}; polling starts lazily once the stream is consumed. The stream
     * also ends once {@code cancelled} reports true, checked before every poll.
     */
    public Stream<Job> stream(String jobId, Duration timeout, BooleanSupplier cancelled) {
        repository.getJob(jobId);
        Iterator<Job> iterator = new StatusChangeIterator(jobId, Instant.now().plus(timeout), cancelled);
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false
        );
    }

    private final class StatusChangeIterator implements Iterator<Job> {
        private final String jobId;
        private final Instant deadline;
        private final BooleanSupplier cancelled;
        private JobStatus lastEmitted;
        private Job pending;
        private boolean finished;

        private StatusChangeIterator(String jobId, Instant deadline, BooleanSupplier cancelled) {
            this.jobId = jobId;
            this.deadline = deadline;
            this.cancelled = cancelled;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            while (!finished) {
                if (cancelled.getAsBoolean()) {
                    finished = true;
                    break;
                }
                Job current = repository.getJob(jobId);
                if (!current.status().equals(lastEmitted)) {
                    lastEmitted = current.status();
                    pending = current;
                    finished = current.isTerminal();
                    return true;
                }
                if (!Instant.now().isBefore(deadline)) {
                    finished = true;
                    break;
                }
                try {
                    TimeUnit.MILLISECONDS.sleep(properties.getStream().getPollIntervalMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    finished = true;
                }
            }
            return false;
        }

        @Override
        public Job next() {
            if (!hasNext()) {
                throw new NoSuchElementException("stream for job " + jobId + " is closed");
            }
            Job next = pending;
            pending = null;
            return next;
        }
    }
}
