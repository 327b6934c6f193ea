package com.warden.authz.tenant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A SQL WHERE fragment with positional ({@code $n}) parameters that always constrains the tenant.
 *
 * @param sql    the predicate
 * @param params parameter values, in position order; may contain nulls
 */
public record TenantScopedQuery(String sql, List<Object> params) {

    public TenantScopedQuery {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("sql must not be null or blank");
        }
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }

    static TenantScopedQuery where(String column, int paramIndex, String tenantId) {
        requireColumn(column);
        if (paramIndex < 1) {
            throw new IllegalArgumentException("paramIndex must be at least 1");
        }
        return new TenantScopedQuery(column + " = $" + paramIndex, List.of(tenantId));
    }

    static TenantScopedQuery append(String existingWhere, List<?> existingParams, String column, String tenantId) {
        requireColumn(column);
        List<Object> params = new ArrayList<>();
        if (existingParams != null) {
            params.addAll(existingParams);
        }
        String predicate = column + " = $" + (params.size() + 1);
        params.add(tenantId);
        String sql = existingWhere == null || existingWhere.isBlank()
                ? predicate
                : existingWhere + " AND " + predicate;
        return new TenantScopedQuery(sql, params);
    }

    private static void requireColumn(String column) {
        if (column == null || !column.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
            throw new IllegalArgumentException("column must be a plain identifier: " + column);
        }
    }
}
