package com.openforge.memoryengine.memory;

import java.util.List;
import java.util.Map;

/**
 * Size caps on the fields copied out of metadata into their own columns, both
 * in the record store and in the vector index schema.
 *
 * Checked at store time, so an oversized value is refused up front instead of
 * failing the index insert and leaving the record reachable only by the
 * fallback scan.
 */
public final class FieldLimits {

    public static final int MAX_ID_LENGTH    = 64;
    public static final int MAX_SCOPE_LENGTH = 128;
    public static final int MAX_KIND_LENGTH  = 64;
    public static final int MAX_TAGS         = 64;
    public static final int MAX_TAG_LENGTH   = 128;

    private FieldLimits() {}

    /**
     * @throws InvalidQueryException naming the first field that exceeds its cap
     */
    public static void check(String scope, String kind, Map<String, MetadataValue> metadata) {
        maxLength(MetadataKeys.SCOPE, scope, MAX_SCOPE_LENGTH);
        maxLength(MetadataKeys.KIND, kind, MAX_KIND_LENGTH);
        if (metadata == null) return;

        for (String key : List.of(MetadataKeys.USER_ID, MetadataKeys.SESSION_ID, MetadataKeys.CONVERSATION_ID)) {
            MetadataValue v = metadata.get(key);
            if (v != null) maxLength(key, v.asText(), MAX_ID_LENGTH);
        }

        MetadataValue tags = metadata.get(MetadataKeys.TAGS);
        if (tags == null) return;
        List<String> values = tags.asTextList();
        if (values.size() > MAX_TAGS) {
            throw new InvalidQueryException("at most %d tags allowed, got %d".formatted(MAX_TAGS, values.size()));
        }
        for (String tag : values) maxLength("tag", tag, MAX_TAG_LENGTH);
    }

    private static void maxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new InvalidQueryException("%s longer than %d chars (%d)".formatted(field, max, value.length()));
        }
    }
}
