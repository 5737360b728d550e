package com.prospectpulse.enrichment.api;

import com.prospectpulse.enrichment.model.BatchSubmissionItem;
import com.prospectpulse.enrichment.model.HealthResponse;
import com.prospectpulse.enrichment.model.Job;
import com.prospectpulse.enrichment.model.JobHistoryEntry;
import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.LeadPage;
import com.prospectpulse.enrichment.model.SubmissionResult;
import com.prospectpulse.enrichment.service.InvalidLeadInputException;
import com.prospectpulse.enrichment.service.JobStreamService;
import com.prospectpulse.enrichment.service.LeadJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

@RestController
public class EnrichmentController {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentController.class);
    private static final String JOB_EVENT = "job";
    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(15);

    private final LeadJobService leadJobService;
    private final JobStreamService jobStreamService;
    private final ExecutorService streamExecutor;

    public EnrichmentController(
        LeadJobService leadJobService,
        JobStreamService jobStreamService,
        @Qualifier("streamExecutor") ExecutorService streamExecutor
    ) {
        this.leadJobService = leadJobService;
        this.jobStreamService = jobStreamService;
        this.streamExecutor = streamExecutor;
    }

    @PostMapping("/enqueue")
    public ResponseEntity<SubmissionResult> enqueue(@RequestBody(required = false) EnqueueRequest request) {
        if (request == null || request.leadInput() == null) {
            throw new InvalidLeadInputException("lead_input is required");
        }
        boolean force = request.force() != null && request.force();
        SubmissionResult result = leadJobService.submit(request.leadInput(), request.workspaceId(), force);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }

    @PostMapping("/enqueue/batch")
    public ResponseEntity<List<BatchSubmissionItem>> enqueueBatch(@RequestBody(required = false) BatchEnqueueRequest request) {
        if (request == null) {
            throw new InvalidLeadInputException("leads are required");
        }
        boolean force = request.force() != null && request.force();
        List<BatchSubmissionItem> items = leadJobService.submitBatch(request.leads(), request.workspaceId(), force);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(items);
    }

    @GetMapping("/status/{jobId}")
    public Job status(@PathVariable("jobId") String jobId) {
        return leadJobService.getStatus(jobId);
    }

    @GetMapping("/status/{jobId}/history")
    public List<JobHistoryEntry> history(@PathVariable("jobId") String jobId) {
        return leadJobService.getHistory(jobId);
    }

    @GetMapping("/leads")
    public LeadPage leads(
        @RequestParam(name = "workspace_id", required = false) String workspaceId,
        @RequestParam(name = "page", required = false) Integer page,
        @RequestParam(name = "size", required = false) Integer size
    ) {
        return leadJobService.listLeads(workspaceId, page, size);
    }

    @GetMapping("/leads/{leadId}")
    public Lead lead(@PathVariable("leadId") String leadId) {
        return leadJobService.getLead(leadId);
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return leadJobService.health();
    }

    @GetMapping("/stream/{jobId}")
    public SseEmitter stream(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "timeout_seconds", required = false) Integer timeoutSeconds
    ) {
        Duration timeout = jobStreamService.resolveTimeout(timeoutSeconds);
        SseEmitter emitter = new SseEmitter(timeout.plusSeconds(5).toMillis());
        AtomicBoolean closed = new AtomicBoolean(false);
        emitter.onCompletion(() -> closed.set(true));
        emitter.onTimeout(() -> closed.set(true));
        emitter.onError(error -> closed.set(true));
        Stream<Job> updates = jobStreamService.stream(jobId, timeout, disconnectCheck(emitter, closed, HEARTBEAT_INTERVAL));

        streamExecutor.submit(() -> {
            try (updates) {
                Iterator<Job> iterator = updates.iterator();
                while (!closed.get() && iterator.hasNext()) {
                    emitter.send(SseEmitter.event().name(JOB_EVENT).id(jobId).data(iterator.next()));
                }
                emitter.complete();
            } catch (IOException e) {
                log.debug("Stream client for job {} disconnected", jobId);
                emitter.completeWithError(e);
            } catch (RuntimeException e) {
                log.warn("Stream for job {} failed", jobId, e);
                emitter.completeWithError(e);
            }
        });
        return emitter;
    }

    /**
     * Idle streams only learn about a gone client by writing, so a keepalive comment goes out every
     * {@code heartbeatInterval} while polling.
     */
    static BooleanSupplier disconnectCheck(SseEmitter emitter, AtomicBoolean closed, Duration heartbeatInterval) {
        AtomicLong lastHeartbeat = new AtomicLong(System.nanoTime());
        return () -> {
            if (closed.get()) {
                return true;
            }
            long now = System.nanoTime();
            if (now - lastHeartbeat.get() >= heartbeatInterval.toNanos()) {
                lastHeartbeat.set(now);
                try {
                    emitter.send(SseEmitter.event().comment("keepalive"));
                } catch (IOException | IllegalStateException e) {
                    log.debug("Keepalive failed, closing stream: {}", e.getMessage());
                    closed.set(true);
                }
            }
            return closed.get();
        };
    }
}
