package com.shipcheck.service.collaborator;

/**
 * The generator could not produce files (provider error, quota, bad response).
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
