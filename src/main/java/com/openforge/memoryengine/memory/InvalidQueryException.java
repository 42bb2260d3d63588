package com.openforge.memoryengine.memory;

public class InvalidQueryException extends MemoryEngineException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
