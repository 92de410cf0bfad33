package com.knowledgeassist.api.security;

/**
 * The authenticated caller. Every tenant-scoped operation takes its tenant id from here and nowhere else.
 */
public record TenantPrincipal(String tenantId, String tenantName) {
}
