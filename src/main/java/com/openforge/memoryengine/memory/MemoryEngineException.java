package com.openforge.memoryengine.memory;

/**
 * Base of the failures the engine surfaces to callers. Anything not derived
 * from this type is degraded internally and never reaches the caller.
 */
public class MemoryEngineException extends RuntimeException {

    public MemoryEngineException(String message) {
        super(message);
    }

    public MemoryEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
