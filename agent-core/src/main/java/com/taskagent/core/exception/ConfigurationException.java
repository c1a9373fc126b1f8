package com.taskagent.core.exception;

/**
 * Thrown when the engine is missing a collaborator or has invalid settings.
 */
public class ConfigurationException extends AgentException {

    public static final String ERROR_CODE = "CONFIGURATION_ERROR";

    public ConfigurationException(String message) {
        super(ERROR_CODE, message);
    }
}
