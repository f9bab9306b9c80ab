package com.strollie.planner.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Root of the planning failures that reach the client. Each subtype fixes the HTTP status it is rendered with.
 */
@Getter
public abstract class RoutePlanningException extends RuntimeException {

    private final HttpStatus status;

    protected RoutePlanningException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected RoutePlanningException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
