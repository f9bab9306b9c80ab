package com.strollie.planner.exception;

import org.springframework.http.HttpStatus;

public class NoCandidatesFoundException extends RoutePlanningException {

    public NoCandidatesFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
