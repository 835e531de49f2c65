package com.platform.provisioner.reconciliation;

/**
 * What reconciliation did to a single resource.
 */
public enum ReconciliationAction {
    INSERT,
    PATCH,
    UNCHANGED,
    ADOPT,
    NOT_FOUND,
    SKIPPED
}
