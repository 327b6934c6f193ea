package com.warden.authz.condition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates condition trees against {@link AttributeBags}.
 * <p>
 * AND groups stop at the first false child, OR groups at the first true child, and an empty
 * group is true. Leaves never throw: a missing attribute, an unresolvable reference, an unknown
 * operator or a value that cannot be coerced makes the leaf {@code false}, so a malformed
 * condition can only ever withhold a rule, never grant one. Malformed input is logged at WARN.
 * <p>
 * Instances are immutable apart from an internal regex cache and are safe to share.
 */
public final class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private static final Optional<Pattern> INVALID_PATTERN = Optional.empty();

    private final OrganizationHierarchy organizationHierarchy;
    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    /** Creates an evaluator with a flat organization hierarchy. */
    public ConditionEvaluator() {
        this(OrganizationHierarchy.flat());
    }

    public ConditionEvaluator(OrganizationHierarchy organizationHierarchy) {
        if (organizationHierarchy == null) {
            throw new IllegalArgumentException("organizationHierarchy must not be null");
        }
        this.organizationHierarchy = organizationHierarchy;
    }

    /**
     * Evaluates a condition node.
     *
     * @param node a {@link ConditionGroup} or {@link PolicyCondition}
     * @param bags the request attributes
     * @return whether the condition holds
     */
    public boolean evaluate(ConditionNode node, AttributeBags bags) {
        if (node instanceof ConditionGroup group) {
            return evaluateGroup(group, bags);
        }
        if (node instanceof PolicyCondition condition) {
            return evaluateCondition(condition, bags);
        }
        log.warn("Unsupported condition node {}, evaluating to false", node);
        return false;
    }

    private boolean evaluateGroup(ConditionGroup group, AttributeBags bags) {
        if (group.logic() == null) {
            log.warn("Condition group without logic, evaluating to false");
            return false;
        }
        if (group.logic() == ConditionGroup.Logic.AND) {
            for (ConditionNode child : group.conditions()) {
                if (!evaluate(child, bags)) {
                    return false;
                }
            }
            return true;
        }
        for (ConditionNode child : group.conditions()) {
            if (evaluate(child, bags)) {
                return true;
            }
        }
        return group.conditions().isEmpty();
    }

    private boolean evaluateCondition(PolicyCondition condition, AttributeBags bags) {
        ConditionOperator operator = condition.operator();
        if (operator == null) {
            log.warn("Condition on {}.{} has no known operator, evaluating to false",
                    condition.source(), condition.attribute());
            return false;
        }
        if (operator == ConditionOperator.IS_OWNER) {
            return isOwner(bags);
        }
        if (condition.source() == null || condition.attribute() == null || condition.attribute().isBlank()) {
            log.warn("Condition with operator {} has no attribute, evaluating to false", operator.code());
            return false;
        }

        Optional<Object> attribute = bags.lookup(condition.source(), condition.attribute());
        if (operator == ConditionOperator.EXISTS) {
            return attribute.isPresent() == expectedPresence(condition.value(), bags);
        }
        if (attribute.isEmpty()) {
            return false;
        }
        Optional<Object> comparison = resolveValue(condition.value(), bags);
        if (comparison.isEmpty()) {
            return false;
        }
        return apply(operator, attribute.get(), comparison.get());
    }

    private boolean apply(ConditionOperator operator, Object actual, Object expected) {
        return switch (operator) {
            case EQUALS -> valuesEqual(actual, expected);
            case NOT_EQUALS -> !valuesEqual(actual, expected);
            case GREATER_THAN -> compareNumbers(actual, expected).map(c -> c > 0).orElse(false);
            case GREATER_THAN_OR_EQUALS -> compareNumbers(actual, expected).map(c -> c >= 0).orElse(false);
            case LESS_THAN -> compareNumbers(actual, expected).map(c -> c < 0).orElse(false);
            case LESS_THAN_OR_EQUALS -> compareNumbers(actual, expected).map(c -> c <= 0).orElse(false);
            case IN -> anyIn(actual, asCollection(expected));
            case NOT_IN -> !anyIn(actual, asCollection(expected));
            case CONTAINS -> contains(actual, expected).orElse(false);
            case NOT_CONTAINS -> contains(actual, expected).map(c -> !c).orElse(false);
            case STARTS_WITH -> actual instanceof CharSequence s && expected instanceof CharSequence p
                    && s.toString().startsWith(p.toString());
            case ENDS_WITH -> actual instanceof CharSequence s && expected instanceof CharSequence p
                    && s.toString().endsWith(p.toString());
            case MATCHES -> matches(actual, expected);
            case IN_ORG_HIERARCHY -> inOrganizationHierarchy(actual, expected);
            case TIME_BETWEEN -> timeBetween(actual, expected);
            case IP_IN_RANGE -> ipInRange(actual, expected);
            case EXISTS, IS_OWNER -> false;
        };
    }

    private Optional<Object> resolveValue(Object value, AttributeBags bags) {
        if (value instanceof AttributeReference reference) {
            return bags.lookup(reference);
        }
        return Optional.ofNullable(value);
    }

    private boolean expectedPresence(Object value, AttributeBags bags) {
        Object resolved = resolveValue(value, bags).orElse(Boolean.TRUE);
        if (resolved instanceof Boolean flag) {
            return flag;
        }
        return !"false".equalsIgnoreCase(String.valueOf(resolved));
    }

    private static boolean isOwner(AttributeBags bags) {
        Optional<Object> owner = bags.lookup(AttributeSource.RESOURCE, "ownerId");
        Optional<Object> user = bags.lookup(AttributeSource.SUBJECT, "userId");
        return owner.isPresent() && user.isPresent() && valuesEqual(owner.get(), user.get());
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compareNumbers(left, right).map(c -> c == 0).orElse(false);
        }
        if (left instanceof CharSequence || right instanceof CharSequence
                || left instanceof Enum<?> || right instanceof Enum<?>) {
            return String.valueOf(left).equals(String.valueOf(right));
        }
        return Objects.equals(left, right);
    }

    private static Optional<Integer> compareNumbers(Object left, Object right) {
        Optional<BigDecimal> l = toDecimal(left);
        Optional<BigDecimal> r = toDecimal(right);
        if (l.isEmpty() || r.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(l.get().compareTo(r.get()));
    }

    private static Optional<BigDecimal> toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return Optional.empty();
        }
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return Optional.empty();
        }
        if (value instanceof Number || value instanceof CharSequence) {
            try {
                return Optional.of(new BigDecimal(value.toString().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Collection<?> asCollection(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        if (value instanceof Object[] array) {
            return List.of(array);
        }
        return List.of(value);
    }

    private static boolean anyIn(Object actual, Collection<?> candidates) {
        if (actual instanceof Collection<?> values) {
            for (Object value : values) {
                if (containsEqual(candidates, value)) {
                    return true;
                }
            }
            return false;
        }
        return containsEqual(candidates, actual);
    }

    private static boolean containsEqual(Collection<?> values, Object needle) {
        for (Object value : values) {
            if (value != null && valuesEqual(value, needle)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<Boolean> contains(Object actual, Object expected) {
        if (actual instanceof CharSequence haystack && expected instanceof CharSequence needle) {
            return Optional.of(haystack.toString().contains(needle));
        }
        if (actual instanceof Collection<?> values) {
            return Optional.of(containsEqual(values, expected));
        }
        return Optional.empty();
    }

    private boolean matches(Object actual, Object expected) {
        if (!(actual instanceof CharSequence input) || !(expected instanceof CharSequence regex)) {
            return false;
        }
        Optional<Pattern> pattern = patternCache.computeIfAbsent(regex.toString(), ConditionEvaluator::compile);
        return pattern.map(p -> p.matcher(input).find()).orElse(false);
    }

    private static Optional<Pattern> compile(String regex) {
        try {
            return Optional.of(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex in condition '{}': {}", regex, e.getDescription());
            return INVALID_PATTERN;
        }
    }

    /**
     * {@code actual} holds the principal's organization id(s); {@code expected} the target
     * organization id(s). A target is inside the hierarchy when it, or one of its ancestors,
     * is one of the principal's organizations.
     */
    private boolean inOrganizationHierarchy(Object actual, Object expected) {
        Set<String> memberships = new HashSet<>();
        for (Object value : asCollection(actual)) {
            if (value != null) {
                memberships.add(String.valueOf(value));
            }
        }
        if (memberships.isEmpty()) {
            return false;
        }
        for (Object target : asCollection(expected)) {
            if (target == null) {
                continue;
            }
            String organizationId = String.valueOf(target);
            if (memberships.contains(organizationId)) {
                return true;
            }
            for (String ancestor : organizationHierarchy.ancestorsOf(organizationId)) {
                if (memberships.contains(ancestor)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * {@code expected} is a two-element list: either {@code HH:mm[:ss]} UTC clock times
     * (start inclusive, end exclusive, may wrap past midnight) or ISO-8601 instants.
     */
    private static boolean timeBetween(Object actual, Object expected) {
        Optional<Instant> at = toInstant(actual);
        List<Object> bounds = new ArrayList<>(asCollection(expected));
        if (at.isEmpty() || bounds.size() != 2) {
            return false;
        }
        Optional<LocalTime> startTime = toLocalTime(bounds.get(0));
        Optional<LocalTime> endTime = toLocalTime(bounds.get(1));
        if (startTime.isPresent() && endTime.isPresent()) {
            LocalTime time = at.get().atOffset(ZoneOffset.UTC).toLocalTime();
            LocalTime start = startTime.get();
            LocalTime end = endTime.get();
            if (!start.isAfter(end)) {
                return !time.isBefore(start) && time.isBefore(end);
            }
            return !time.isBefore(start) || time.isBefore(end);
        }
        Optional<Instant> start = toInstant(bounds.get(0));
        Optional<Instant> end = toInstant(bounds.get(1));
        if (start.isEmpty() || end.isEmpty()) {
            return false;
        }
        return !at.get().isBefore(start.get()) && at.get().isBefore(end.get());
    }

    private static Optional<LocalTime> toLocalTime(Object value) {
        if (value instanceof LocalTime time) {
            return Optional.of(time);
        }
        if (value instanceof CharSequence text && text.length() <= 8) {
            try {
                return Optional.of(LocalTime.parse(text));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> toInstant(Object value) {
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.toInstant());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Long || value instanceof Integer) {
            return Optional.of(Instant.ofEpochMilli(((Number) value).longValue()));
        }
        if (value instanceof CharSequence text) {
            try {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(text);
                if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                    return Optional.of(OffsetDateTime.from(parsed).toInstant());
                }
                return Optional.empty();
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static boolean ipInRange(Object actual, Object expected) {
        if (!(actual instanceof CharSequence address)) {
            return false;
        }
        for (Object cidr : asCollection(expected)) {
            if (cidr == null) {
                continue;
            }
            Optional<IpRange> range = IpRange.parse(String.valueOf(cidr));
            if (range.isEmpty()) {
                log.warn("Ignoring malformed CIDR '{}' in ip_in_range condition", cidr);
                continue;
            }
            if (range.get().contains(address.toString())) {
                return true;
            }
        }
        return false;
    }
}
