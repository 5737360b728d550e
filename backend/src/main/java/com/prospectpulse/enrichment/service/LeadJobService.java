package com.prospectpulse.enrichment.service;

import com.prospectpulse.config.ProspectProperties;
import com.prospectpulse.enrichment.model.BatchSubmissionItem;
import com.prospectpulse.enrichment.model.DeliveryMode;
import com.prospectpulse.enrichment.model.HealthResponse;
import com.prospectpulse.enrichment.model.Job;
import com.prospectpulse.enrichment.model.JobHistoryEntry;
import com.prospectpulse.enrichment.model.Lead;
import com.prospectpulse.enrichment.model.LeadPage;
import com.prospectpulse.enrichment.model.SubmissionResult;
import com.prospectpulse.enrichment.persistence.EnrichmentJdbcRepository;
import com.prospectpulse.enrichment.persistence.JobQueueRepository;
import com.prospectpulse.enrichment.util.LeadKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class LeadJobService {
    private static final Logger log = LoggerFactory.getLogger(LeadJobService.class);
    private static final int MAX_BATCH_SIZE = 500;
    private static final int DEFAULT_PAGE_SIZE = 50;
    private static final int MAX_PAGE_SIZE = 200;

    private final EnrichmentJdbcRepository repository;
    private final JobQueueRepository queueRepository;
    private final JobDispatcher dispatcher;
    private final ProspectProperties properties;

    public LeadJobService(
        EnrichmentJdbcRepository repository,
        JobQueueRepository queueRepository,
        JobDispatcher dispatcher,
        ProspectProperties properties
    ) {
        this.repository = repository;
        this.queueRepository = queueRepository;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    public SubmissionResult submit(Map<String, String> leadInput, String workspaceId, boolean force) {
        Map<String, String> input = LeadKeys.cleanInput(leadInput);
        if (input.isEmpty()) {
            throw new InvalidLeadInputException("lead_input must contain at least one non-blank field");
        }
        if (!LeadKeys.hasIdentity(input)) {
            throw new InvalidLeadInputException("lead_input needs a company, name, contact or email");
        }
        String workspace = resolveWorkspace(workspaceId);
        String leadId = LeadKeys.leadId(workspace, input);
        if (repository.upsertLead(leadId, workspace, input)) {
            log.debug("Created lead {} in workspace {}", leadId, workspace);
        }
        String jobId = repository.createJob(leadId, workspace);
        if (force) {
            repository.resetLeadResults(leadId);
            log.info("Cleared stored results for lead {} before forced job {}", leadId, jobId);
        }
        DeliveryMode delivery = dispatcher.dispatch(jobId);
        log.info("Submitted job {} for lead {} workspace={} delivery={}", jobId, leadId, workspace, delivery.key());
        return new SubmissionResult(jobId, leadId, workspace, delivery);
    }

    public List<BatchSubmissionItem> submitBatch(List<Map<String, String>> leads, String workspaceId, boolean force) {
        if (leads == null || leads.isEmpty()) {
            throw new InvalidLeadInputException("leads must not be empty");
        }
        if (leads.size() > MAX_BATCH_SIZE) {
            throw new InvalidLeadInputException("at most " + MAX_BATCH_SIZE + " leads per batch");
        }
        List<BatchSubmissionItem> items = new ArrayList<>();
        for (int i = 0; i < leads.size(); i++) {
            try {
                SubmissionResult result = submit(leads.get(i), workspaceId, force);
                items.add(new BatchSubmissionItem(i, result.jobId(), result.leadId(), null));
            } catch (DuplicateActiveJobException e) {
                items.add(new BatchSubmissionItem(i, e.getActiveJobId(), e.getLeadId(), "duplicate_active_job"));
            } catch (InvalidLeadInputException e) {
                items.add(new BatchSubmissionItem(i, null, null, "invalid_input"));
            }
        }
        return items;
    }

    public Job getStatus(String jobId) {
        return repository.getJob(jobId);
    }

    public List<JobHistoryEntry> getHistory(String jobId) {
        repository.getJob(jobId);
        return repository.findJobHistory(jobId);
    }

    public LeadPage listLeads(String workspaceId, Integer page, Integer size) {
        String workspace = resolveWorkspace(workspaceId);
        int safePage = page == null ? 0 : Math.max(0, page);
        int safeSize = size == null ? DEFAULT_PAGE_SIZE : Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        List<Lead> items = repository.findLeadsByWorkspace(workspace, safeSize, (long) safePage * safeSize);
        long total = repository.countLeadsByWorkspace(workspace);
        return new LeadPage(workspace, items, safePage, safeSize, total);
    }

    public Lead getLead(String leadId) {
        return repository.getLead(leadId);
    }

    public HealthResponse health() {
        boolean storeReachable;
        try {
            storeReachable = repository.isDbReachable();
        } catch (Exception ignored) {
            storeReachable = false;
        }
        boolean queueEnabled = properties.getQueue().isEnabled();
        boolean queueReachable = false;
        if (queueEnabled) {
            try {
                queueReachable = queueRepository.isReachable();
            } catch (Exception ignored) {
                queueReachable = false;
            }
        }
        String status;
        if (!storeReachable) {
            status = "down";
        } else if (queueEnabled && !queueReachable) {
            status = "degraded";
        } else {
            status = "ok";
        }
        return new HealthResponse(status, storeReachable, queueEnabled, queueReachable);
    }

    private String resolveWorkspace(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            return properties.getDefaultWorkspaceId();
        }
        return ProspectProperties.normalizeWorkspaceId(workspaceId);
    }
}
