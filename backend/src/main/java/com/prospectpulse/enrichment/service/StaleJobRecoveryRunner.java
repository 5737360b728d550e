package com.prospectpulse.enrichment.service;

import com.prospectpulse.config.ProspectProperties;
import com.prospectpulse.enrichment.model.Job;
import com.prospectpulse.enrichment.persistence.EnrichmentJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
public class StaleJobRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StaleJobRecoveryRunner.class);
    private static final int RECOVERY_BATCH = 200;

    private final EnrichmentJdbcRepository repository;
    private final JobDispatcher dispatcher;
    private final ProspectProperties properties;

    public StaleJobRecoveryRunner(
        EnrichmentJdbcRepository repository,
        JobDispatcher dispatcher,
        ProspectProperties properties
    ) {
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        recover();
    }

    public int recover() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping stale job recovery because database is unreachable");
            return 0;
        }

        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getWorker().getStaleJobMinutes()));
        List<Job> stale = repository.findStaleActiveJobs(cutoff, RECOVERY_BATCH);
        int recovered = 0;
        for (Job job : stale) {
            try {
                dispatcher.dispatch(job.id());
                recovered++;
                log.info("Re-dispatched stale job {} status={} updatedAt={}", job.id(), job.status(), job.updatedAt());
            } catch (Exception e) {
                log.warn("Failed to re-dispatch stale job {}", job.id(), e);
            }
        }
        return recovered;
    }
}
