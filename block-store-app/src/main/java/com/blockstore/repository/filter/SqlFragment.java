package com.blockstore.repository.filter;

import java.util.ArrayList;
import java.util.List;

/** A boolean SQL condition and the positional parameters it binds, in order. */
public record SqlFragment(String sql, List<Object> params) {

    private static final SqlFragment TRUE = new SqlFragment("1=1", List.of());

    public SqlFragment {
        params = List.copyOf(params);
    }

    public static SqlFragment alwaysTrue() {
        return TRUE;
    }

    public boolean isAlwaysTrue() {
        return TRUE.sql.equals(sql) && params.isEmpty();
    }

    public SqlFragment and(SqlFragment other) {
        if (isAlwaysTrue()) {
            return other;
        }
        if (other.isAlwaysTrue()) {
            return this;
        }
        List<Object> joined = new ArrayList<>(params);
        joined.addAll(other.params);
        return new SqlFragment(sql + " AND " + other.sql, joined);
    }
}
