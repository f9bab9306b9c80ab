package com.strollie.planner.exception;

/**
 * Thrown by the opening-hours parser for text it cannot read. Never leaves the resolver.
 */
public class InvalidScheduleExpressionException extends IllegalArgumentException {

    public InvalidScheduleExpressionException(String expression, String reason) {
        super("Cannot parse opening hours '" + expression + "': " + reason);
    }
}
