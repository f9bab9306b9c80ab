package com.strollie.planner.exception;

import org.springframework.http.HttpStatus;

public class RouteInfeasibleException extends RoutePlanningException {

    public RouteInfeasibleException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, message);
    }
}
