package com.warden.authz.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.observability.MetadataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events as single-line JSON to the {@value #LOGGER_NAME} logger.
 * <p>
 * ALLOW is logged at INFO, DENY at WARN and ERROR at ERROR, so the audit stream can be routed
 * and filtered by level. Metadata keys that look sensitive are masked.
 */
public class LoggingDecisionAuditSink implements DecisionAuditSink {

    public static final String LOGGER_NAME = "AUTHZ_AUDIT";

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private final ObjectMapper objectMapper;
    private final MetadataRedactor redactor;

    public LoggingDecisionAuditSink() {
        this(new ObjectMapper(), new MetadataRedactor());
    }

    public LoggingDecisionAuditSink(ObjectMapper objectMapper, MetadataRedactor redactor) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper must not be null");
        }
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.objectMapper = objectMapper;
        this.redactor = redactor;
    }

    @Override
    public void record(AuthorizationAuditEvent event) {
        String line = render(event);
        switch (event.outcome()) {
            case ALLOW -> AUDIT_LOG.info(line);
            case DENY -> AUDIT_LOG.warn(line);
            case ERROR -> AUDIT_LOG.error(line);
        }
    }

    /** The JSON line for {@code event}; falls back to a plain summary if serialization fails. */
    String render(AuthorizationAuditEvent event) {
        try {
            return objectMapper.writeValueAsString(event.toStructuredLog(redactor.redact(event.metadata())));
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", e.getOriginalMessage());
            return "AuthZ %s tenant=%s user=%s action=%s resource=%s/%s policy=%s".formatted(
                    event.outcome(), event.tenantId(), event.userId(), event.action(),
                    event.resourceType(), event.resourceId(), event.decidingPolicyId());
        }
    }
}
