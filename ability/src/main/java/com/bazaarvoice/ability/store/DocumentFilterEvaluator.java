package com.bazaarvoice.ability.store;

import com.bazaarvoice.ability.condition.eval.JsonValues;
import com.bazaarvoice.ability.filter.FilterOperators;
import com.google.common.base.Splitter;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Evaluates filter documents in the format described by {@link FilterOperators} against JSON-style documents.
 * <p>
 * A dotted path is resolved one segment at a time.  When the value at an intermediate segment is a list, each
 * element is followed separately, so a path can resolve to several candidate values.  The value at the last segment
 * is never expanded.  A clause holds when one candidate satisfies all of its operators.
 */
public class DocumentFilterEvaluator {

    /** Stands in for a path that doesn't exist, which is different from a path whose value is {@code null}. */
    static final Object MISSING = new Object() {
        @Override
        public String toString() {
            return "~missing";
        }
    };

    private static final Splitter PATH_SPLITTER = Splitter.on('.');

    public static boolean matches(Map<String, Object> filter, @Nullable Object document) {
        checkNotNull(filter, "filter");
        for (Map.Entry<String, Object> clause : filter.entrySet()) {
            if (!matchesClause(clause.getKey(), clause.getValue(), document)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesClause(String path, @Nullable Object clause, @Nullable Object document) {
        if (path.isEmpty() || path.startsWith("$")) {
            throw new IllegalArgumentException("Invalid field path in filter: " + path);
        }
        Map<String, Object> operators = toOperators(path, clause);
        for (Object candidate : resolve(document, PATH_SPLITTER.splitToList(path))) {
            if (matchesAll(operators, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static List<Object> resolve(@Nullable Object document, List<String> segments) {
        List<Object> candidates = Collections.singletonList(document);
        for (int i = 0; i < segments.size(); i++) {
            boolean last = i == segments.size() - 1;
            List<Object> next = new ArrayList<>();
            for (Object candidate : candidates) {
                Object value = read(candidate, segments.get(i));
                if (!last && isList(value)) {
                    next.addAll(asList(value));
                } else {
                    next.add(value);
                }
            }
            candidates = next;
        }
        return candidates;
    }

    private static Object read(@Nullable Object document, String field) {
        if (!(document instanceof Map)) {
            return MISSING;
        }
        Map<?, ?> map = (Map<?, ?>) document;
        Object value = map.get(field);
        return (value != null || map.containsKey(field)) ? value : MISSING;
    }

    /**
     * A clause is either an object of operators or a literal meaning equality.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> toOperators(String path, @Nullable Object clause) {
        if (clause instanceof Map && !((Map<?, ?>) clause).isEmpty()) {
            Map<String, Object> map = (Map<String, Object>) clause;
            int operatorCount = 0;
            for (String key : map.keySet()) {
                if (key.startsWith("$")) {
                    operatorCount++;
                }
            }
            if (operatorCount == map.size()) {
                return map;
            }
            if (operatorCount != 0) {
                throw new IllegalArgumentException("Filter clause mixes operators and fields at " + path + ": " + clause);
            }
        }
        return Collections.singletonMap(FilterOperators.EQ, clause);
    }

    private static boolean matchesAll(Map<String, Object> operators, @Nullable Object value) {
        for (Map.Entry<String, Object> entry : operators.entrySet()) {
            if (!matchesOperator(entry.getKey(), entry.getValue(), value)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesOperator(String operator, @Nullable Object operand, @Nullable Object value) {
        switch (operator) {
            case FilterOperators.EQ:
                return JsonValues.equal(operand, present(value));
            case FilterOperators.IN:
                return JsonValues.contains(asList(checkOperand(operator, operand, isList(operand))), present(value));
            case FilterOperators.GT:
                return isOrdered(operator, operand, value) && JsonValues.compare(value, operand) > 0;
            case FilterOperators.GTE:
                return isOrdered(operator, operand, value) && JsonValues.compare(value, operand) >= 0;
            case FilterOperators.LT:
                return isOrdered(operator, operand, value) && JsonValues.compare(value, operand) < 0;
            case FilterOperators.LTE:
                return isOrdered(operator, operand, value) && JsonValues.compare(value, operand) <= 0;
            case FilterOperators.EXISTS:
                return (Boolean) checkOperand(operator, operand, operand instanceof Boolean) == (value != MISSING);
            case FilterOperators.TYPE:
                return hasType(value, (String) checkOperand(operator, operand, operand instanceof String));
            case FilterOperators.MATCH:
                return matchesNested(asFilter(checkOperand(operator, operand, operand instanceof Map)), value);
            default:
                throw new IllegalArgumentException("Unknown filter operator: " + operator);
        }
    }

    /**
     * Missing fields compare equal to {@code null}.
     */
    @Nullable
    private static Object present(@Nullable Object value) {
        return value == MISSING ? null : value;
    }

    /**
     * Comparisons of anything other than two numbers or two strings are false, including missing fields.
     */
    private static boolean isOrdered(String operator, @Nullable Object operand, @Nullable Object value) {
        checkOperand(operator, operand, operand instanceof Number || operand instanceof String);
        return JsonValues.isOrdered(value, operand);
    }

    private static boolean matchesNested(Map<String, Object> filter, @Nullable Object value) {
        if (isList(value)) {
            for (Object element : asList(value)) {
                if (matches(filter, element)) {
                    return true;
                }
            }
            return false;
        }
        return matches(filter, present(value));
    }

    private static boolean hasType(@Nullable Object value, String type) {
        switch (type) {
            case FilterOperators.TYPE_NULL:
                return value == null;
            case FilterOperators.TYPE_BOOL:
                return value instanceof Boolean;
            case FilterOperators.TYPE_NUM:
                return value instanceof Number;
            case FilterOperators.TYPE_STRING:
                return value instanceof String;
            case FilterOperators.TYPE_ARRAY:
                return isList(value);
            case FilterOperators.TYPE_OBJECT:
                return value instanceof Map;
            default:
                throw new IllegalArgumentException("Unknown type in filter: " + type);
        }
    }

    private static Object checkOperand(String operator, @Nullable Object operand, boolean valid) {
        if (!valid) {
            throw new IllegalArgumentException("Invalid operand for " + operator + ": " + operand);
        }
        return operand;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asFilter(Object operand) {
        return (Map<String, Object>) operand;
    }

    private static boolean isList(@Nullable Object value) {
        return value instanceof Collection || value instanceof Object[];
    }

    private static Collection<?> asList(Object value) {
        return (value instanceof Collection) ? (Collection<?>) value : Arrays.asList((Object[]) value);
    }
}
