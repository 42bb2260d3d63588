package com.openforge.memoryengine.resilience;

/** A guarded collaborator call did not finish within its time budget. */
public class CollaboratorTimeoutException extends RuntimeException {

    public CollaboratorTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
