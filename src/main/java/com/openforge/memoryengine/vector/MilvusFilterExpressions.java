package com.openforge.memoryengine.vector;

import com.openforge.memoryengine.memory.MemoryFilter;
import com.openforge.memoryengine.memory.MetadataValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Translates a {@link MemoryFilter} into a Milvus boolean expression.
 *
 * List-valued metadata equality is not pushed down; the engine re-checks every
 * hit in memory, so omitting a clause only widens the candidate set.
 */
public final class MilvusFilterExpressions {

    private MilvusFilterExpressions() {
    }

    /** @return the expression, or null when the filter has no constraints */
    public static String toExpression(MemoryFilter filter) {
        if (filter == null) return null;
        List<String> parts = new ArrayList<>();

        eq(parts, "user_id", filter.userId());
        eq(parts, "session_id", filter.sessionId());
        eq(parts, "conversation_id", filter.conversationId());
        eq(parts, "scope", filter.scope());
        eq(parts, "kind", filter.kind());

        if (!filter.tags().isEmpty()) {
            String list = filter.tags().stream().sorted()
                    .map(MilvusFilterExpressions::quote)
                    .collect(Collectors.joining(", ", "[", "]"));
            parts.add("array_contains_all(tags, %s)".formatted(list));
        }

        for (Map.Entry<String, MetadataValue> e : new TreeMap<>(filter.metadataEquals()).entrySet()) {
            String field = "metadata[%s]".formatted(quote(e.getKey()));
            if (e.getValue() instanceof MetadataValue.Text t) {
                parts.add("%s == %s".formatted(field, quote(t.value())));
            } else if (e.getValue() instanceof MetadataValue.Number n) {
                parts.add("%s == %s".formatted(field, n.value()));
            }
        }

        if (filter.timeRange() != null) {
            if (filter.timeRange().start() != null)
                parts.add("created_at_ms >= " + filter.timeRange().start().toEpochMilli());
            if (filter.timeRange().end() != null)
                parts.add("created_at_ms <= " + filter.timeRange().end().toEpochMilli());
        }

        if (filter.activeAt() != null) {
            parts.add("(expires_at_ms == 0 or expires_at_ms > %d)".formatted(filter.activeAt().toEpochMilli()));
        }

        return parts.isEmpty() ? null : String.join(" and ", parts);
    }

    static String quote(String raw) {
        return "\"" + raw.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static void eq(List<String> parts, String field, String value) {
        if (value != null) parts.add("%s == %s".formatted(field, quote(value)));
    }
}
