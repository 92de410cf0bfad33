package com.knowledgeassist.api.service.query;

public class TenantIsolationViolationException extends QueryException {

    private final String tenantId;
    private final String partition;
    private final String observedTenantId;

    public TenantIsolationViolationException(String tenantId, String partition, String observedTenantId) {
        super(QueryFailureKind.SECURITY_VIOLATION, "Tenant isolation violation detected in partition " + partition);
        this.tenantId = tenantId;
        this.partition = partition;
        this.observedTenantId = observedTenantId;
    }

    public String tenantId() {
        return tenantId;
    }

    public String partition() {
        return partition;
    }

    /**
     * The tenant id stored on the offending record; {@code null} when the record had none.
     */
    public String observedTenantId() {
        return observedTenantId;
    }
}
