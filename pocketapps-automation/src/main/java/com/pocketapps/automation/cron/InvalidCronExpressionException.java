package com.pocketapps.automation.cron;

/**
 * Thrown when a cron expression cannot be parsed or fires too often.
 */
public class InvalidCronExpressionException extends IllegalArgumentException {

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
    }
}
