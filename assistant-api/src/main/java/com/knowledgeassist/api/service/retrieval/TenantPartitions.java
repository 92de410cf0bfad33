package com.knowledgeassist.api.service.retrieval;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * Maps a tenant id to the name of its dedicated partition. The name depends on that id alone.
 * <p>
 * Ids already safe as collection names are used verbatim ({@code tenant_<id>_documents}); any other id is hashed
 * ({@code tenant-<sha256 prefix>_documents}). The two forms differ at the separator, so no verbatim id can produce a
 * hashed name.
 */
public final class TenantPartitions {

    private static final Pattern SAFE_ID = Pattern.compile("[a-z0-9_-]{1,64}");

    private TenantPartitions() {
    }

    public static String partitionFor(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant id is required");
        }
        if (SAFE_ID.matcher(tenantId).matches()) {
            return "tenant_" + tenantId + "_documents";
        }
        return "tenant-" + sha256Prefix(tenantId) + "_documents";
    }

    private static String sha256Prefix(String value) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < 16; i++) {
                builder.append(String.format("%02x", hash[i]));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
