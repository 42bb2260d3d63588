package com.openforge.memoryengine.memory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Maps tenant ids to collection names: {@code tenant_{sanitized id}_{hash}_memories}.
 *
 * Every character outside [A-Za-z0-9] becomes an underscore, so the name is
 * valid as a Milvus collection. Sanitizing alone is lossy ("acme-1" and "acme_1"
 * would collide), so the first 12 hex digits of the SHA-256 of the raw id are
 * appended; the readable part is capped at {@value #MAX_READABLE_LENGTH} chars.
 */
public final class TenantCollections {

    static final int MAX_READABLE_LENGTH = 48;
    static final int HASH_HEX_LENGTH     = 12;

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9]");

    private TenantCollections() {}

    public static String collectionName(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidQueryException("tenantId must not be blank");
        }
        String readable = UNSAFE.matcher(tenantId).replaceAll("_");
        if (readable.length() > MAX_READABLE_LENGTH) readable = readable.substring(0, MAX_READABLE_LENGTH);
        return "tenant_" + readable + "_" + shortHash(tenantId) + "_memories";
    }

    private static String shortHash(String tenantId) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(tenantId.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
