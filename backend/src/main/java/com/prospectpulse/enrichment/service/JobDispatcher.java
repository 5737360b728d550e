package com.prospectpulse.enrichment.service;

import com.prospectpulse.enrichment.model.DeliveryMode;

/**
 * Hands a freshly created job to whatever will run it and reports how it was delivered.
 */
public interface JobDispatcher {

    DeliveryMode dispatch(String jobId);
}
