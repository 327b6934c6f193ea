package com.warden.authz.audit;

/**
 * Receives every audited decision. Delivery and persistence are up to the implementation;
 * a failing sink never changes a decision.
 */
@FunctionalInterface
public interface DecisionAuditSink {

    void record(AuthorizationAuditEvent event);
}
