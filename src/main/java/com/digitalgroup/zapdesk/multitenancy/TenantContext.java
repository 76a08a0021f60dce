package com.digitalgroup.zapdesk.multitenancy;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the tenant of the gateway currently being served.
 * Set by the webhook and send paths once the gateway config is known.
 */
@Slf4j
public class TenantContext {

    private static final ThreadLocal<Long> currentTenant = new ThreadLocal<>();

    private TenantContext() {}

    public static void setCurrentTenant(Long tenantId) {
        log.debug("Setting tenant context to tenant: {}", tenantId);
        currentTenant.set(tenantId);
    }

    public static Long getCurrentTenant() {
        return currentTenant.get();
    }

    public static void clear() {
        currentTenant.remove();
    }

    public static boolean hasTenant() {
        return currentTenant.get() != null;
    }
}
