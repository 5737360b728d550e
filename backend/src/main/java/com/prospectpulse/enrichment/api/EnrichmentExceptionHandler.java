package com.prospectpulse.enrichment.api;

import com.prospectpulse.enrichment.service.DuplicateActiveJobException;
import com.prospectpulse.enrichment.service.InvalidLeadInputException;
import com.prospectpulse.enrichment.service.JobNotFoundException;
import com.prospectpulse.enrichment.service.LeadNotFoundException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class EnrichmentExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(EnrichmentExceptionHandler.class);

  @ExceptionHandler(DuplicateActiveJobException.class)
  public ResponseEntity<Map<String, String>> handleDuplicate(DuplicateActiveJobException ex) {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("error", "duplicate_active_job");
    body.put("message", ex.getMessage());
    body.put("job_id", ex.getActiveJobId());
    body.put("lead_id", ex.getLeadId());
    body.put("workspace_id", ex.getWorkspaceId());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleJobNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage(), "job_id", ex.getJobId()));
  }

  @ExceptionHandler(LeadNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleLeadNotFound(LeadNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "lead_not_found", "message", ex.getMessage(), "lead_id", ex.getLeadId()));
  }

  @ExceptionHandler(InvalidLeadInputException.class)
  public ResponseEntity<Map<String, String>> handleInvalidInput(InvalidLeadInputException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_input", "message", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_input", "message", "request body is not valid JSON"));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, String>> handleStore(DataAccessException ex) {
    log.warn("Store unavailable while serving request", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "store_unavailable", "message", "job store is unreachable"));
  }
}
