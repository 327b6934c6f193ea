package com.warden.authz.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.warden.authz.condition.AttributeReference;
import com.warden.authz.condition.AttributeSource;
import com.warden.authz.condition.ConditionGroup;
import com.warden.authz.condition.ConditionNode;
import com.warden.authz.condition.ConditionOperator;
import com.warden.authz.condition.PolicyCondition;
import com.warden.authz.policy.Policy;
import com.warden.authz.policy.PolicyEffect;
import com.warden.authz.policy.PolicyRule;
import com.warden.authz.policy.PolicyStatus;
import com.warden.authz.policy.PolicyTargets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads and writes policy documents as JSON.
 * <p>
 * A document is either an array of policies or an object with a {@code policies} array:
 * <pre>{@code
 * {"policies": [{
 *   "id": "p-1", "tenantId": "t-1", "name": "Staff read", "priority": 100,
 *   "targetPrincipals": {"userTypes": ["STAFF"]},
 *   "rules": [{
 *     "actions": ["read"], "resources": ["property"], "effect": "ALLOW",
 *     "conditions": {"logic": "AND", "conditions": [
 *       {"source": "resource", "attribute": "ownerId", "operator": "eq", "value": {"ref": "subject.userId"}}
 *     ]}
 *   }]
 * }]}
 * }</pre>
 * An unknown operator or attribute source does not fail the document; the condition is kept
 * and evaluates to false. Structural errors (missing id, unknown effect) throw
 * {@link PolicyDocumentException}.
 */
public final class PolicyDocumentCodec {

    private static final Logger log = LoggerFactory.getLogger(PolicyDocumentCodec.class);

    private static final ObjectMapper MAPPER = createMapper();

    private PolicyDocumentCodec() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static List<Policy> readPolicies(String json) {
        try {
            return readPolicies(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new PolicyDocumentException("Malformed policy document", e);
        }
    }

    public static List<Policy> readPolicies(InputStream json) {
        try {
            return readPolicies(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new PolicyDocumentException("Failed to read policy document", e);
        }
    }

    public static String writePolicies(List<Policy> policies) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode array = root.putArray("policies");
        policies.forEach(policy -> array.add(writePolicy(policy)));
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new PolicyDocumentException("Failed to write policy document", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    // ---- reading ----

    private static List<Policy> readPolicies(JsonNode root) {
        JsonNode array = root != null && root.isObject() ? root.get("policies") : root;
        if (array == null || !array.isArray()) {
            throw new PolicyDocumentException("Policy document must be an array or contain a 'policies' array");
        }
        List<Policy> policies = new ArrayList<>();
        for (JsonNode node : array) {
            policies.add(readPolicy(node));
        }
        return policies;
    }

    private static Policy readPolicy(JsonNode node) {
        String id = requiredText(node, "id", "policy");
        try {
            List<PolicyRule> rules = new ArrayList<>();
            int index = 0;
            for (JsonNode rule : node.path("rules")) {
                rules.add(readRule(rule, id, index++));
            }
            PolicyStatus status = node.hasNonNull("status")
                    ? PolicyStatus.fromString(node.get("status").asText()).orElseThrow(() ->
                    new PolicyDocumentException("Unknown status '%s' in policy %s"
                            .formatted(node.get("status").asText(), id)))
                    : PolicyStatus.ACTIVE;
            JsonNode targets = node.path("targetPrincipals");
            return new Policy(
                    id,
                    requiredText(node, "tenantId", "policy " + id),
                    textOrNull(node, "name"),
                    textOrNull(node, "description"),
                    status,
                    node.path("priority").asInt(0),
                    rules,
                    new PolicyTargets(
                            stringSet(targets.path("userIds")),
                            stringSet(targets.path("roleIds")),
                            stringSet(targets.path("userTypes"))),
                    stringSet(node.path("targetOrganizations")),
                    node.path("system").asBoolean(false),
                    instantOrNull(node, "deletedAt", id));
        } catch (IllegalArgumentException e) {
            throw new PolicyDocumentException("Invalid policy " + id + ": " + e.getMessage(), e);
        }
    }

    private static PolicyRule readRule(JsonNode node, String policyId, int index) {
        String effectText = node.path("effect").asText(null);
        PolicyEffect effect = PolicyEffect.fromString(effectText).orElseThrow(() ->
                new PolicyDocumentException("Rule %d of policy %s has unknown effect '%s'"
                        .formatted(index, policyId, effectText)));
        ConditionGroup conditions = null;
        if (node.hasNonNull("conditions")) {
            ConditionNode parsed = readCondition(node.get("conditions"));
            conditions = parsed instanceof ConditionGroup group ? group : new ConditionGroup(ConditionGroup.Logic.AND, List.of(parsed));
        }
        return new PolicyRule(stringList(node.path("actions")), stringList(node.path("resources")), conditions, effect);
    }

    private static ConditionNode readCondition(JsonNode node) {
        if (node.has("logic") || node.has("conditions")) {
            String logicText = node.path("logic").asText("AND").toUpperCase(Locale.ROOT);
            ConditionGroup.Logic logic = switch (logicText) {
                case "AND" -> ConditionGroup.Logic.AND;
                case "OR" -> ConditionGroup.Logic.OR;
                default -> {
                    log.warn("Unknown condition logic '{}'; group will evaluate to false", logicText);
                    yield null;
                }
            };
            List<ConditionNode> children = new ArrayList<>();
            for (JsonNode child : node.path("conditions")) {
                children.add(readCondition(child));
            }
            return new ConditionGroup(logic, children);
        }

        String sourceText = node.path("source").asText(null);
        AttributeSource source = AttributeSource.fromKey(sourceText).orElse(null);
        if (source == null) {
            log.warn("Unknown attribute source '{}'; condition will evaluate to false", sourceText);
        }
        String operatorText = node.path("operator").asText(null);
        ConditionOperator operator = ConditionOperator.fromCode(operatorText).orElse(null);
        if (operator == null) {
            log.warn("Unknown condition operator '{}'; condition will evaluate to false", operatorText);
        }
        return new PolicyCondition(source, textOrNull(node, "attribute"), operator, readValue(node.get("value")));
    }

    private static Object readValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject() && node.size() == 1 && node.hasNonNull("ref") && node.get("ref").isTextual()) {
            return new AttributeReference(node.get("ref").asText());
        }
        return MAPPER.convertValue(node, Object.class);
    }

    // ---- writing ----

    private static ObjectNode writePolicy(Policy policy) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", policy.id());
        node.put("tenantId", policy.tenantId());
        node.put("name", policy.name());
        if (policy.description() != null) {
            node.put("description", policy.description());
        }
        node.put("status", policy.status().name());
        node.put("priority", policy.priority());
        node.put("system", policy.system());
        if (!policy.targets().isEmpty()) {
            ObjectNode targets = node.putObject("targetPrincipals");
            writeStrings(targets.putArray("userIds"), policy.targets().userIds());
            writeStrings(targets.putArray("roleIds"), policy.targets().roleIds());
            writeStrings(targets.putArray("userTypes"), policy.targets().userTypes());
        }
        if (!policy.targetOrganizations().isEmpty()) {
            writeStrings(node.putArray("targetOrganizations"), policy.targetOrganizations());
        }
        if (policy.deletedAt() != null) {
            node.put("deletedAt", policy.deletedAt().toString());
        }
        ArrayNode rules = node.putArray("rules");
        for (PolicyRule rule : policy.rules()) {
            ObjectNode ruleNode = rules.addObject();
            writeStrings(ruleNode.putArray("actions"), rule.actions());
            writeStrings(ruleNode.putArray("resources"), rule.resources());
            ruleNode.put("effect", rule.effect().name());
            if (rule.conditions() != null) {
                ruleNode.set("conditions", writeCondition(rule.conditions()));
            }
        }
        return node;
    }

    private static ObjectNode writeCondition(ConditionNode condition) {
        ObjectNode node = MAPPER.createObjectNode();
        if (condition instanceof ConditionGroup group) {
            node.put("logic", group.logic() == null ? null : group.logic().name());
            ArrayNode children = node.putArray("conditions");
            group.conditions().forEach(child -> children.add(writeCondition(child)));
        } else if (condition instanceof PolicyCondition leaf) {
            node.put("source", leaf.source() == null ? null : leaf.source().key());
            node.put("attribute", leaf.attribute());
            node.put("operator", leaf.operator() == null ? null : leaf.operator().code());
            if (leaf.value() instanceof AttributeReference reference) {
                node.putObject("value").put("ref", reference.ref());
            } else {
                node.set("value", MAPPER.valueToTree(leaf.value()));
            }
        } else {
            throw new PolicyDocumentException("Unsupported condition node " + condition);
        }
        return node;
    }

    // ---- helpers ----

    private static String requiredText(JsonNode node, String field, String what) {
        String value = textOrNull(node, field);
        if (value == null || value.isBlank()) {
            throw new PolicyDocumentException("Missing '%s' in %s".formatted(field, what));
        }
        return value;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant instantOrNull(JsonNode node, String field, String policyId) {
        String text = textOrNull(node, field);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new PolicyDocumentException("Invalid '%s' in policy %s".formatted(field, policyId), e);
        }
    }

    private static List<String> stringList(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode value : array) {
            values.add(value.asText());
        }
        return values;
    }

    private static Set<String> stringSet(JsonNode array) {
        return new LinkedHashSet<>(stringList(array));
    }

    private static void writeStrings(ArrayNode array, Iterable<String> values) {
        values.forEach(array::add);
    }
}
