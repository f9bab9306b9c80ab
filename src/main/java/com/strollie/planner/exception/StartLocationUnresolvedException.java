package com.strollie.planner.exception;

import org.springframework.http.HttpStatus;

public class StartLocationUnresolvedException extends RoutePlanningException {

    public StartLocationUnresolvedException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
