package com.warden.observability;

/**
 * Identifiers of the authorization call currently being decided on this thread.
 * <p>
 * Pushed into the SLF4J MDC by {@link DecisionLogContextHolder} so every log line written
 * while a decision is in flight carries the tenant, user and request it belongs to.
 *
 * @param tenantId  tenant of the subject
 * @param userId    subject user id
 * @param requestId caller-supplied request id (nullable)
 * @param sessionId session id (nullable)
 */
public record DecisionLogContext(String tenantId, String userId, String requestId, String sessionId) {

    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SESSION_ID = "sessionId";
}
