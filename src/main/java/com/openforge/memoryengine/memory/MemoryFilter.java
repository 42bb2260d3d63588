package com.openforge.memoryengine.memory;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Declarative conjunction of record constraints.
 *
 * The same filter is pushed down to the vector index (when it can express it),
 * applied by the fallback scanner before scoring, and re-applied in memory to
 * every fetched record. All non-null fields must hold; every tag must be present.
 *
 * @param activeAt when set, records whose TTL has passed at this instant are excluded
 */
@Builder
public record MemoryFilter(
        String                     userId,
        String                     sessionId,
        String                     conversationId,
        Set<String>                tags,
        String                     scope,
        String                     kind,
        Map<String, MetadataValue> metadataEquals,
        TimeRange                  timeRange,
        Instant                    activeAt
) {

    public MemoryFilter {
        tags           = tags == null ? Set.of() : Set.copyOf(tags);
        metadataEquals = metadataEquals == null ? Map.of() : Map.copyOf(metadataEquals);
    }

    public static MemoryFilter fromQuery(MemoryQuery query, Instant now) {
        return MemoryFilter.builder()
                .userId(blankToNull(query.userId()))
                .sessionId(blankToNull(query.sessionId()))
                .conversationId(blankToNull(query.conversationId()))
                .tags(query.tags())
                .scope(blankToNull(query.scope()))
                .kind(blankToNull(query.kind()))
                .metadataEquals(query.metadataFilter())
                .timeRange(query.timeRange())
                .activeAt(now)
                .build();
    }

    /** Restricts a lookup to one (scope, kind) partition. */
    public static MemoryFilter partition(String scope, String kind) {
        return MemoryFilter.builder()
                .scope(blankToNull(scope))
                .kind(blankToNull(kind))
                .build();
    }

    public boolean matches(MemoryRecord record) {
        if (!equalsIfSet(userId, record.text(MetadataKeys.USER_ID))) return false;
        if (!equalsIfSet(sessionId, record.text(MetadataKeys.SESSION_ID))) return false;
        if (!equalsIfSet(conversationId, record.text(MetadataKeys.CONVERSATION_ID))) return false;
        if (!equalsIfSet(scope, record.scope())) return false;
        if (!equalsIfSet(kind, record.kind())) return false;

        if (!tags.isEmpty() && !record.tags().containsAll(tags)) return false;

        for (Map.Entry<String, MetadataValue> e : metadataEquals.entrySet()) {
            if (!e.getValue().equals(record.metadata().get(e.getKey()))) return false;
        }

        if (timeRange != null && !timeRange.contains(record.createdAt())) return false;
        return activeAt == null || !record.isExpiredAt(activeAt);
    }

    private static boolean equalsIfSet(String expected, String actual) {
        return expected == null || expected.equals(actual);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
