package com.openforge.memoryengine.memory;

/**
 * Well-known metadata keys. Scope and kind are mirrored here so the vector
 * index can filter on them like any other field.
 */
public final class MetadataKeys {

    public static final String USER_ID         = "user_id";
    public static final String SESSION_ID      = "session_id";
    public static final String CONVERSATION_ID = "conversation_id";
    public static final String TAGS            = "tags";
    public static final String SCOPE           = "scope";
    public static final String KIND            = "kind";

    private MetadataKeys() {
    }
}
