package com.vulnscan.backend.exception;

public class QuotaExceededException extends RuntimeException {

    private final Long organizationId;
    private final int limit;

    public QuotaExceededException(Long organizationId, int limit) {
        super("Monthly scan limit reached (" + limit + "). Upgrade your plan.");
        this.organizationId = organizationId;
        this.limit = limit;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public int getLimit() {
        return limit;
    }
}
