package com.tenantbill.backend.services.billing;

import lombok.Value;

/**
 * Outcome of applying one provider event. {@code updated} is true whenever the
 * event resolved to an organization, even if no stored value changed.
 */
@Value
public class ReconcileResult {

    private static final ReconcileResult IGNORED = new ReconcileResult(false, null);

    boolean updated;
    Long organizationId;

    public static ReconcileResult ignored() {
        return IGNORED;
    }

    public static ReconcileResult updated(Long organizationId) {
        return new ReconcileResult(true, organizationId);
    }
}
