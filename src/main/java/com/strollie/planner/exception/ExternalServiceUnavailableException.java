package com.strollie.planner.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ExternalServiceUnavailableException extends RoutePlanningException {

    private final String service;

    public ExternalServiceUnavailableException(String service, String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
        this.service = service;
    }
}
