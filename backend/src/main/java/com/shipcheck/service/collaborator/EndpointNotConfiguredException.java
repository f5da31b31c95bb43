package com.shipcheck.service.collaborator;

/**
 * A collaborator endpoint is missing from configuration. Fatal to the task
 * that needed it, not to the service.
 */
public class EndpointNotConfiguredException extends RuntimeException {

    public EndpointNotConfiguredException(String property) {
        super("Collaborator endpoint not configured: " + property);
    }
}
