package com.warden.authz.condition;

/**
 * A single attribute comparison.
 *
 * @param source    bag the attribute is read from
 * @param attribute dot-separated path inside the bag (e.g. {@code metadata.region})
 * @param operator  comparison operator; null when the document named an unknown operator
 * @param value     literal comparison value, or an {@link AttributeReference}
 */
public record PolicyCondition(
        AttributeSource source,
        String attribute,
        ConditionOperator operator,
        Object value) implements ConditionNode {

    public static PolicyCondition of(AttributeSource source, String attribute,
                                     ConditionOperator operator, Object value) {
        return new PolicyCondition(source, attribute, operator, value);
    }

    /** Shorthand for a condition whose value is a reference to another attribute. */
    public static PolicyCondition ref(AttributeSource source, String attribute,
                                      ConditionOperator operator, String reference) {
        return new PolicyCondition(source, attribute, operator, new AttributeReference(reference));
    }
}
