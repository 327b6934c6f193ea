package com.warden.authz.condition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.warden.authz.condition.AttributeSource.CONTEXT;
import static com.warden.authz.condition.AttributeSource.RESOURCE;
import static com.warden.authz.condition.AttributeSource.SUBJECT;
import static com.warden.authz.condition.ConditionOperator.*;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConditionEvaluator")
class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final AttributeBags bags = new AttributeBags(
            Map.of(
                    "userId", "u-1",
                    "tenantId", "t-1",
                    "userType", "STAFF",
                    "roleIds", List.of("caretaker", "viewer"),
                    "organizationIds", List.of("org-1"),
                    "mfaVerified", true,
                    "metadata", Map.of("clearance", 3, "region", "eu-west")),
            Map.of("name", "read", "resourceType", "lease"),
            Map.of(
                    "type", "lease",
                    "tenantId", "t-1",
                    "ownerId", "u-1",
                    "organizationId", "org-1",
                    "metadata", Map.of("amount", new BigDecimal("1500.00"), "tags", List.of("vip", "late"))),
            Map.of(
                    "ipAddress", "10.1.2.3",
                    "timestamp", Instant.parse("2024-05-01T09:30:00Z"),
                    "userAgent", "Mozilla/5.0 (X11; Linux)"));

    private boolean eval(ConditionNode node) {
        return evaluator.evaluate(node, bags);
    }

    @Nested
    @DisplayName("groups")
    class Groups {

        @Test
        @DisplayName("empty AND and OR groups are vacuously true")
        void emptyGroups() {
            assertThat(eval(ConditionGroup.and())).isTrue();
            assertThat(eval(ConditionGroup.or())).isTrue();
        }

        @Test
        @DisplayName("AND requires every child, OR any child")
        void andOr() {
            var yes = PolicyCondition.of(SUBJECT, "userType", EQUALS, "STAFF");
            var no = PolicyCondition.of(SUBJECT, "userType", EQUALS, "CUSTOMER");

            assertThat(eval(ConditionGroup.and(yes, no))).isFalse();
            assertThat(eval(ConditionGroup.or(no, yes))).isTrue();
            assertThat(eval(ConditionGroup.or(no, ConditionGroup.and(yes, yes)))).isTrue();
        }

        @Test
        @DisplayName("group without logic evaluates to false")
        void missingLogic() {
            assertThat(eval(new ConditionGroup(null, List.of()))).isFalse();
        }
    }

    @Nested
    @DisplayName("comparison operators")
    class Comparisons {

        @Test
        @DisplayName("eq compares numbers numerically and strings textually")
        void equality() {
            assertThat(eval(PolicyCondition.of(SUBJECT, "metadata.clearance", EQUALS, 3L))).isTrue();
            assertThat(eval(PolicyCondition.of(RESOURCE, "metadata.amount", EQUALS, 1500))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "metadata.clearance", EQUALS, "3"))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "mfaVerified", EQUALS, true))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "userId", NOT_EQUALS, "u-2"))).isTrue();
        }

        @Test
        @DisplayName("ordering operators coerce numeric strings and reject non-numbers")
        void ordering() {
            assertThat(eval(PolicyCondition.of(SUBJECT, "metadata.clearance", GREATER_THAN, 2))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "metadata.clearance", GREATER_THAN_OR_EQUALS, "3"))).isTrue();
            assertThat(eval(PolicyCondition.of(RESOURCE, "metadata.amount", LESS_THAN, 1000))).isFalse();
            assertThat(eval(PolicyCondition.of(RESOURCE, "metadata.amount", LESS_THAN_OR_EQUALS, 1500.0))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "userType", GREATER_THAN, 1))).isFalse();
        }

        @Test
        @DisplayName("in and nin treat scalars as singletons and collections as any-of")
        void membership() {
            assertThat(eval(PolicyCondition.of(SUBJECT, "userType", IN, List.of("STAFF", "ADMIN")))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "userType", IN, "STAFF"))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "roleIds", IN, List.of("viewer")))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "roleIds", NOT_IN, List.of("admin")))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "roleIds", NOT_IN, List.of("caretaker")))).isFalse();
        }

        @Test
        @DisplayName("contains works on strings and collections")
        void contains() {
            assertThat(eval(PolicyCondition.of(CONTEXT, "userAgent", CONTAINS, "Linux"))).isTrue();
            assertThat(eval(PolicyCondition.of(RESOURCE, "metadata.tags", CONTAINS, "vip"))).isTrue();
            assertThat(eval(PolicyCondition.of(RESOURCE, "metadata.tags", NOT_CONTAINS, "vip"))).isFalse();
            assertThat(eval(PolicyCondition.of(RESOURCE, "metadata.tags", NOT_CONTAINS, "new"))).isTrue();
        }

        @Test
        @DisplayName("ncontains on a type mismatch is false")
        void notContainsMismatch() {
            assertThat(eval(PolicyCondition.of(SUBJECT, "metadata.clearance", NOT_CONTAINS, "x"))).isFalse();
        }

        @Test
        @DisplayName("starts, ends and matches apply to strings")
        void stringOperators() {
            assertThat(eval(PolicyCondition.of(CONTEXT, "userAgent", STARTS_WITH, "Mozilla"))).isTrue();
            assertThat(eval(PolicyCondition.of(CONTEXT, "userAgent", ENDS_WITH, "Linux)"))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "metadata.region", MATCHES, "^eu-"))).isTrue();
            assertThat(eval(PolicyCondition.of(SUBJECT, "metadata.clearance", STARTS_WITH, "3"))).isFalse();
        }

        @Test
        @DisplayName("invalid regex evaluates to false")
        void invalidRegex() {
            assertThat(eval(PolicyCondition.of(SUBJECT, "metadata.region", MATCHES, "(unclosed"))).isFalse();
        }
    }

    @Nested
    @DisplayName("presence and ownership")
    class Presence {

        @Test
        @DisplayName("exists defaults to presence, false asks for absence")
        void exists() {
            assertThat(eval(PolicyCondition.of(RESOURCE, "ownerId", EXISTS, null))).isTrue();
            assertThat(eval(PolicyCondition.of(RESOURCE, "ownerId", EXISTS, false))).isFalse();
            assertThat(eval(PolicyCondition.of(RESOURCE, "metadata.missing", EXISTS, false))).isTrue();
        }

        @Test
        @DisplayName("is_owner compares resource owner with subject")
        void isOwner() {
            assertThat(eval(PolicyCondition.of(null, null, IS_OWNER, null))).isTrue();

            var foreign = new AttributeBags(Map.of("userId", "u-2"), Map.of(), Map.of("ownerId", "u-1"), Map.of());
            assertThat(evaluator.evaluate(PolicyCondition.of(null, null, IS_OWNER, null), foreign)).isFalse();
        }
    }

    @Nested
    @DisplayName("references")
    class References {

        @Test
        @DisplayName("resolves the comparison value from another bag")
        void resolvesReference() {
            assertThat(eval(PolicyCondition.ref(SUBJECT, "userId", EQUALS, "resource.ownerId"))).isTrue();
            assertThat(eval(PolicyCondition.ref(SUBJECT, "tenantId", NOT_EQUALS, "resource.tenantId"))).isFalse();
            assertThat(eval(PolicyCondition.ref(RESOURCE, "organizationId", IN, "subject.organizationIds"))).isTrue();
        }

        @Test
        @DisplayName("unresolvable reference fails closed, even for neq")
        void unresolvedReference() {
            assertThat(eval(PolicyCondition.ref(SUBJECT, "userId", NOT_EQUALS, "resource.missing"))).isFalse();
            assertThat(eval(PolicyCondition.ref(SUBJECT, "userId", NOT_EQUALS, "nowhere.userId"))).isFalse();
        }
    }

    @Nested
    @DisplayName("fail-closed")
    class FailClosed {

        @Test
        @DisplayName("missing attribute is false for every operator, negative ones included")
        void missingAttribute() {
            for (ConditionOperator operator : List.of(EQUALS, NOT_EQUALS, NOT_IN, NOT_CONTAINS, GREATER_THAN)) {
                assertThat(eval(PolicyCondition.of(SUBJECT, "metadata.unknown", operator, "x")))
                        .as(operator.code())
                        .isFalse();
            }
        }

        @Test
        @DisplayName("unknown operator and missing source are false")
        void malformed() {
            assertThat(eval(PolicyCondition.of(SUBJECT, "userId", null, "u-1"))).isFalse();
            assertThat(eval(PolicyCondition.of(null, "userId", EQUALS, "u-1"))).isFalse();
        }

        @Test
        @DisplayName("path through a non-map value resolves to nothing")
        void pathThroughScalar() {
            assertThat(eval(PolicyCondition.of(SUBJECT, "userId.length", EXISTS, true))).isFalse();
        }
    }

    @Nested
    @DisplayName("organization hierarchy")
    class OrgHierarchy {

        @Test
        @DisplayName("matches the subject's own organization without a hierarchy")
        void flat() {
            assertThat(eval(PolicyCondition.ref(SUBJECT, "organizationIds", IN_ORG_HIERARCHY,
                    "resource.organizationId"))).isTrue();
        }

        @Test
        @DisplayName("matches descendants of the subject's organizations")
        void descendants() {
            var hierarchy = OrganizationHierarchy.fromParents(Map.of("estate-7", "region-2", "region-2", "org-1"));
            var withHierarchy = new ConditionEvaluator(hierarchy);
            var condition = PolicyCondition.of(SUBJECT, "organizationIds", IN_ORG_HIERARCHY, "estate-7");

            assertThat(withHierarchy.evaluate(condition, bags)).isTrue();
            assertThat(evaluator.evaluate(condition, bags)).isFalse();
            assertThat(withHierarchy.evaluate(
                    PolicyCondition.of(SUBJECT, "organizationIds", IN_ORG_HIERARCHY, "org-9"), bags)).isFalse();
        }
    }

    @Nested
    @DisplayName("time_between")
    class TimeBetween {

        @Test
        @DisplayName("clock window is start-inclusive and end-exclusive")
        void clockWindow() {
            assertThat(eval(PolicyCondition.of(CONTEXT, "timestamp", TIME_BETWEEN, List.of("09:00", "17:00")))).isTrue();
            assertThat(eval(PolicyCondition.of(CONTEXT, "timestamp", TIME_BETWEEN, List.of("09:30", "10:00")))).isTrue();
            assertThat(eval(PolicyCondition.of(CONTEXT, "timestamp", TIME_BETWEEN, List.of("08:00", "09:30")))).isFalse();
        }

        @Test
        @DisplayName("clock window may wrap past midnight")
        void overnight() {
            assertThat(eval(PolicyCondition.of(CONTEXT, "timestamp", TIME_BETWEEN, List.of("22:00", "10:00")))).isTrue();
            assertThat(eval(PolicyCondition.of(CONTEXT, "timestamp", TIME_BETWEEN, List.of("22:00", "06:00")))).isFalse();
        }

        @Test
        @DisplayName("instant window and malformed bounds")
        void instantWindow() {
            assertThat(eval(PolicyCondition.of(CONTEXT, "timestamp", TIME_BETWEEN,
                    List.of("2024-05-01T00:00:00Z", "2024-05-02T00:00:00Z")))).isTrue();
            assertThat(eval(PolicyCondition.of(CONTEXT, "timestamp", TIME_BETWEEN,
                    List.of("2024-06-01T00:00:00Z", "2024-06-02T00:00:00Z")))).isFalse();
            assertThat(eval(PolicyCondition.of(CONTEXT, "timestamp", TIME_BETWEEN, List.of("09:00")))).isFalse();
            assertThat(eval(PolicyCondition.of(CONTEXT, "timestamp", TIME_BETWEEN, List.of("nine", "five")))).isFalse();
        }
    }

    @Nested
    @DisplayName("ip_in_range")
    class IpInRange {

        @Test
        @DisplayName("matches IPv4 CIDR blocks and lists of blocks")
        void ipv4() {
            assertThat(eval(PolicyCondition.of(CONTEXT, "ipAddress", IP_IN_RANGE, "10.0.0.0/8"))).isTrue();
            assertThat(eval(PolicyCondition.of(CONTEXT, "ipAddress", IP_IN_RANGE, "10.1.3.0/24"))).isFalse();
            assertThat(eval(PolicyCondition.of(CONTEXT, "ipAddress", IP_IN_RANGE,
                    List.of("192.168.0.0/16", "10.1.2.3")))).isTrue();
        }

        @Test
        @DisplayName("malformed ranges and addresses never match")
        void malformed() {
            assertThat(eval(PolicyCondition.of(CONTEXT, "ipAddress", IP_IN_RANGE, "10.0.0.0/40"))).isFalse();
            assertThat(eval(PolicyCondition.of(CONTEXT, "ipAddress", IP_IN_RANGE, "example.com/8"))).isFalse();
            assertThat(eval(PolicyCondition.of(CONTEXT, "ipAddress", IP_IN_RANGE, "::1/128"))).isFalse();
        }
    }
}
