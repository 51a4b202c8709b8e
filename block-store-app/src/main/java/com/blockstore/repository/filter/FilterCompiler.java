package com.blockstore.repository.filter;

import com.blockstore.db.SqlDialect;
import com.blockstore.model.BlockType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * Translates {@link WhereClause}s and filter expressions into SQL conditions
 * against a table alias. JSON access goes through the configured
 * {@link SqlDialect}; every value is bound as a parameter.
 */
@Component
public class FilterCompiler {

    private final SqlDialect dialect;

    public FilterCompiler(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public SqlFragment where(String alias, WhereClause where) {
        if (where == null || where.isEmpty()) {
            return SqlFragment.alwaysTrue();
        }
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        membership(alias + ".type", where.types().stream().map(BlockType::value).toList(), conditions, params);
        membership(alias + ".parent_id", uuids(where.parentIds()), conditions, params);
        membership(alias + ".root_id", uuids(where.rootIds()), conditions, params);
        membership(alias + ".workspace_id", uuids(where.workspaceIds()), conditions, params);
        return new SqlFragment(String.join(" AND ", conditions), params);
    }

    public SqlFragment expression(String alias, FilterExpression expression) {
        if (expression == null) {
            return SqlFragment.alwaysTrue();
        }
        if (expression instanceof PropertyFilter property) {
            return property(alias, property);
        }
        if (expression instanceof BooleanFilter bool) {
            return bool(alias, bool);
        }
        throw new IllegalArgumentException("Unsupported filter expression " + expression.getClass().getName());
    }

    /** Clause and expression of a parent or root filter, applied to the joined row. */
    public SqlFragment related(String alias, RelatedBlockFilter filter) {
        if (filter == null) {
            return SqlFragment.alwaysTrue();
        }
        return where(alias, filter.where()).and(expression(alias, filter.expression()));
    }

    private SqlFragment bool(String alias, BooleanFilter filter) {
        List<Object> params = new ArrayList<>();
        List<String> parts = new ArrayList<>();
        for (FilterExpression operand : filter.operands()) {
            SqlFragment compiled = expression(alias, operand);
            parts.add(compiled.sql());
            params.addAll(compiled.params());
        }
        String sql = switch (filter.operator()) {
            case AND -> "(" + String.join(" AND ", parts) + ")";
            case OR -> "(" + String.join(" OR ", parts) + ")";
            case NOT -> "NOT (" + parts.get(0) + ")";
        };
        return new SqlFragment(sql, params);
    }

    private SqlFragment property(String alias, PropertyFilter filter) {
        JsonPath target = filter.target();
        String text = dialect.jsonText(alias + "." + target.column().columnName());
        List<Object> params = new ArrayList<>();
        params.add(dialect.jsonPath(target.segments()));

        ValueKind kind = filter.kind();
        String sql = switch (filter.operator()) {
            case EQUALS -> {
                params.add(kind.normalize(filter.value()));
                yield cast(text, kind) + " = ?";
            }
            case NOT_EQUALS -> {
                params.add(kind.normalize(filter.value()));
                yield cast(text, kind) + " <> ?";
            }
            case IN -> {
                List<?> members = (List<?>) filter.value();
                for (Object member : members) {
                    params.add(kind.normalize(member));
                }
                yield cast(text, kind) + " IN (" + placeholders(members.size()) + ")";
            }
            case CONTAINS -> {
                params.add("%" + escapeLike((String) filter.value()) + "%");
                yield text + " LIKE ? ESCAPE '\\'";
            }
        };
        return new SqlFragment(sql, params);
    }

    private String cast(String expression, ValueKind kind) {
        if (kind == ValueKind.STRING) {
            return expression;
        }
        return "CAST(" + expression + " AS " + dialect.sqlType(kind) + ")";
    }

    private static void membership(String column, Collection<String> values, List<String> conditions, List<Object> params) {
        if (values.isEmpty()) {
            return;
        }
        if (values.size() == 1) {
            conditions.add(column + " = ?");
        } else {
            conditions.add(column + " IN (" + placeholders(values.size()) + ")");
        }
        params.addAll(values);
    }

    private static List<String> uuids(Collection<UUID> ids) {
        return ids.stream().map(UUID::toString).toList();
    }

    static String placeholders(int count) {
        StringJoiner joiner = new StringJoiner(", ");
        Collections.nCopies(count, "?").forEach(joiner::add);
        return joiner.toString();
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
