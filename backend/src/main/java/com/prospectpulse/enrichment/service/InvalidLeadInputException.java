package com.prospectpulse.enrichment.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidLeadInputException extends RuntimeException {
    public InvalidLeadInputException(String message) {
        super(message);
    }
}
