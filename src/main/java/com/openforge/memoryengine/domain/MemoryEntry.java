package com.openforge.memoryengine.domain;

import com.openforge.memoryengine.memory.FieldLimits;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Row of the authoritative memory table.
 *
 * One table serves every tenant; {@code collection_name} is the partition key.
 * user/session/conversation ids, scope and kind are copied out of the metadata
 * JSON into their own columns so stats can group on them without parsing JSON.
 *
 * embedding:    little-endian float32 array
 * metadataJson: the full open metadata map, tags included
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "memory_entries",
    uniqueConstraints = @UniqueConstraint(name = "uq_collection_memory",
            columnNames = {"collection_name", "memory_id"}),
    indexes = {
        @Index(name = "idx_collection_created", columnList = "collection_name, created_at_ms"),
        @Index(name = "idx_collection_expires", columnList = "collection_name, expires_at_ms")
    }
)
public class MemoryEntry extends BaseEntity {

    @Column(name = "collection_name", nullable = false, length = 128)
    private String collectionName;

    @Column(name = "memory_id", nullable = false, length = 64)
    private String memoryId;

    @Lob
    @Column(name = "content", nullable = false)
    private String content;

    @Column(name = "scope", length = FieldLimits.MAX_SCOPE_LENGTH)
    private String scope;

    @Column(name = "kind", length = FieldLimits.MAX_KIND_LENGTH)
    private String kind;

    @Column(name = "user_id", length = FieldLimits.MAX_ID_LENGTH)
    private String userId;

    @Column(name = "session_id", length = FieldLimits.MAX_ID_LENGTH)
    private String sessionId;

    @Column(name = "conversation_id", length = FieldLimits.MAX_ID_LENGTH)
    private String conversationId;

    @Lob
    @Column(name = "metadata_json")
    private String metadataJson;

    @Lob
    @Column(name = "embedding")
    private byte[] embedding;

    @Column(name = "created_at_ms", nullable = false)
    private long createdAtMs;

    /** Null when the record never expires. */
    @Column(name = "expires_at_ms")
    private Long expiresAtMs;
}
