package com.expansion.leads.core;

/**
 * Base unchecked exception for the leads pipeline.
 */
public class LeadsException extends RuntimeException {

    public LeadsException(String message) {
        super(message);
    }

    public LeadsException(String message, Throwable cause) {
        super(message, cause);
    }
}
