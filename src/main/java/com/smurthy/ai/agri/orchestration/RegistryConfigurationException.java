package com.smurthy.ai.agri.orchestration;

/**
 * The specialist table is incomplete. Raised while the application context starts, never
 * while serving a request.
 */
public class RegistryConfigurationException extends RuntimeException {

    public RegistryConfigurationException(String message) {
        super(message);
    }
}
