package com.warden.authz.condition;

import java.util.Optional;

/**
 * Comparison operators available to policy conditions, with their wire codes.
 */
public enum ConditionOperator {

    EQUALS("eq"),
    NOT_EQUALS("neq"),
    GREATER_THAN("gt"),
    GREATER_THAN_OR_EQUALS("gte"),
    LESS_THAN("lt"),
    LESS_THAN_OR_EQUALS("lte"),
    IN("in"),
    NOT_IN("nin"),
    CONTAINS("contains"),
    NOT_CONTAINS("ncontains"),
    STARTS_WITH("starts"),
    ENDS_WITH("ends"),
    MATCHES("matches"),
    EXISTS("exists"),
    IS_OWNER("is_owner"),
    IN_ORG_HIERARCHY("in_org_hierarchy"),
    TIME_BETWEEN("time_between"),
    IP_IN_RANGE("ip_in_range");

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    /** The code used in policy documents (e.g. "neq"). */
    public String code() {
        return code;
    }

    /**
     * Looks up an operator by its code.
     *
     * @return the operator, or empty if the code is unknown
     */
    public static Optional<ConditionOperator> fromCode(String code) {
        for (ConditionOperator operator : values()) {
            if (operator.code.equals(code)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
