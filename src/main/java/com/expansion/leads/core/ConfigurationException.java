package com.expansion.leads.core;

/**
 * Thrown when the process cannot run with the configuration it was given.
 * This is the only failure that aborts a run.
 */
public class ConfigurationException extends LeadsException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
