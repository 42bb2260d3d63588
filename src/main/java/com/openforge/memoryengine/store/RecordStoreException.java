package com.openforge.memoryengine.store;

import com.openforge.memoryengine.memory.MemoryEngineException;

/** The authoritative store could not complete a read or write. */
public class RecordStoreException extends MemoryEngineException {

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
