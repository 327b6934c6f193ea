package com.warden.authz.audit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.authz.policy.PolicyEffect;
import com.warden.authz.policy.PolicyEvaluationResult;
import com.warden.observability.MetadataRedactor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.warden.authz.testing.AuthorizationFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoggingDecisionAuditSink")
class LoggingDecisionAuditSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final LoggingDecisionAuditSink sink = new LoggingDecisionAuditSink(mapper, new MetadataRedactor());

    private Logger auditLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        auditLogger = (Logger) LoggerFactory.getLogger(LoggingDecisionAuditSink.LOGGER_NAME);
        auditLogger.setLevel(Level.INFO);
        appender = new ListAppender<>();
        appender.start();
        auditLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        auditLogger.detachAppender(appender);
        auditLogger.setLevel(null);
    }

    private static AuthorizationAuditEvent event(AuthorizationAuditEvent.Outcome outcome) {
        var trace = List.of(
                new PolicyEvaluationResult("system:tenant-isolation", "Tenant Isolation", Integer.MAX_VALUE, true,
                        true, false, null, null, Duration.ofNanos(4_000)),
                new PolicyEvaluationResult("staff-read", "Staff read", 100, false,
                        true, true, PolicyEffect.ALLOW, 0, Duration.ofNanos(12_000)));
        return new AuthorizationAuditEvent(NOW, outcome, "tenant-1", "user-1", "read", "property", "p-1",
                "org-1", "property:read", "staff-read", 0, "Allowed by policy 'Staff read' rule 0", trace,
                "req-1", "10.0.0.5",
                Map.of("context", Map.of("apiToken", "abc", "channel", "web")));
    }

    @Test
    @DisplayName("renders one JSON object with the decision, trace and redacted metadata")
    void rendersJson() throws Exception {
        JsonNode json = mapper.readTree(sink.render(event(AuthorizationAuditEvent.Outcome.ALLOW)));

        assertThat(json.get("eventType").asText()).isEqualTo("AUTHZ_DECISION");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(json.get("outcome").asText()).isEqualTo("ALLOW");
        assertThat(json.get("policyId").asText()).isEqualTo("staff-read");
        assertThat(json.get("ruleIndex").asInt()).isZero();
        assertThat(json.get("requiredPermission").asText()).isEqualTo("property:read");
        assertThat(json.get("trace")).hasSize(2);
        assertThat(json.get("trace").get(0).has("effect")).isFalse();
        assertThat(json.get("trace").get(1).get("effect").asText()).isEqualTo("ALLOW");
        assertThat(json.get("trace").get(1).get("micros").asLong()).isEqualTo(12);
        assertThat(json.at("/metadata/context/apiToken").asText()).isEqualTo(MetadataRedactor.REDACTED);
        assertThat(json.at("/metadata/context/channel").asText()).isEqualTo("web");
    }

    @Test
    @DisplayName("leaves out fields that are not set")
    void omitsNulls() throws Exception {
        var bare = new AuthorizationAuditEvent(NOW, AuthorizationAuditEvent.Outcome.DENY, "tenant-1", "user-1",
                "read", "property", null, null, null, null, null, "No matching policy; denied by default",
                null, null, null, null);

        JsonNode json = mapper.readTree(sink.render(bare));

        assertThat(json.has("resourceId")).isFalse();
        assertThat(json.has("policyId")).isFalse();
        assertThat(json.has("metadata")).isFalse();
        assertThat(json.get("trace")).isEmpty();
    }

    @Test
    @DisplayName("logs each outcome at its own level")
    void levels() {
        sink.record(event(AuthorizationAuditEvent.Outcome.ALLOW));
        sink.record(event(AuthorizationAuditEvent.Outcome.DENY));
        sink.record(event(AuthorizationAuditEvent.Outcome.ERROR));

        assertThat(appender.list).extracting(ILoggingEvent::getLevel)
                .containsExactly(Level.INFO, Level.WARN, Level.ERROR);
        assertThat(appender.list.get(0).getFormattedMessage()).startsWith("{\"eventType\":\"AUTHZ_DECISION\"");
    }
}
