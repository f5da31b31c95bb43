package com.shipcheck.service.collaborator;

/**
 * The publisher could not push or expose the artifact.
 */
public class PublishException extends RuntimeException {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
