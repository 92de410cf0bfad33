package com.knowledgeassist.api.service.tenant;

public record TenantAccount(String id, String name, boolean active) {
}
