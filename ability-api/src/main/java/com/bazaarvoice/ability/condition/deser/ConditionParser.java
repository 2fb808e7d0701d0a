package com.bazaarvoice.ability.condition.deser;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.condition.Conditions;
import com.bazaarvoice.ability.condition.MapCondition;
import com.bazaarvoice.ability.condition.MapConditionBuilder;
import com.bazaarvoice.ability.condition.eval.JsonValues;
import com.bazaarvoice.ability.json.JsonHelper;
import com.google.common.collect.BoundType;
import com.google.common.collect.Range;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

/**
 * Converts raw attribute mappings and their JSON text form into {@link Condition} trees.
 * <p>
 * The JSON form is the natural one: objects are nested conditions, arrays are membership tests and every other
 * value is compared for equality.  Two single-key objects are reserved for shapes JSON can't express directly:
 * <pre>
 *     {"$eq": [1, 2]}                   equality with a literal list or object
 *     {"$range": {"gte": 18, "lt": 65}} a range with closed ("gte", "lte") or open ("gt", "lt") bounds
 * </pre>
 */
public class ConditionParser {

    public static final String EQUAL = "$eq";
    public static final String RANGE = "$range";
    public static final String GT = "gt";
    public static final String GTE = "gte";
    public static final String LT = "lt";
    public static final String LTE = "lte";

    public static Condition parse(String json) {
        return toCondition(JsonHelper.fromJson(json, Object.class));
    }

    public static MapCondition fromMap(Map<String, ?> conditions) {
        MapConditionBuilder builder = Conditions.mapBuilder();
        for (Map.Entry<String, ?> entry : conditions.entrySet()) {
            builder.matches(entry.getKey(), toCondition(entry.getValue()));
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    public static Condition toCondition(@Nullable Object raw) {
        if (raw instanceof Condition) {
            return (Condition) raw;
        } else if (raw instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) raw;
            if (map.size() == 1) {
                Object key = map.keySet().iterator().next();
                if (key instanceof String && ((String) key).startsWith("$")) {
                    return toOperator((String) key, map.get(key));
                }
            }
            for (Object key : map.keySet()) {
                if (!(key instanceof String)) {
                    throw new IllegalArgumentException("Attribute names must be strings: " + key);
                }
            }
            return fromMap((Map<String, ?>) map);
        } else if (raw instanceof Collection) {
            return Conditions.in((Collection<?>) raw);
        } else if (raw instanceof Object[]) {
            return Conditions.in(Arrays.asList((Object[]) raw));
        } else if (raw instanceof Range) {
            return Conditions.oneOf((Range<?>) raw);
        } else {
            return Conditions.equal(raw);
        }
    }

    private static Condition toOperator(String operator, @Nullable Object argument) {
        if (EQUAL.equals(operator)) {
            return Conditions.equal(argument);
        } else if (RANGE.equals(operator)) {
            return Conditions.oneOf(toRange(argument));
        }
        throw new IllegalArgumentException("Unknown condition operator: " + operator);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Range<?> toRange(@Nullable Object argument) {
        if (!(argument instanceof Map) || ((Map<?, ?>) argument).isEmpty()) {
            throw new IllegalArgumentException("Range requires an object with at least one bound: " + argument);
        }
        Comparable lower = null, upper = null;
        BoundType lowerType = null, upperType = null;
        for (Map.Entry<?, ?> bound : ((Map<?, ?>) argument).entrySet()) {
            Object key = bound.getKey();
            Comparable endpoint = toEndpoint(bound.getValue());
            if (GT.equals(key) || GTE.equals(key)) {
                if (lower != null) {
                    throw new IllegalArgumentException("Range has more than one lower bound: " + argument);
                }
                lower = endpoint;
                lowerType = GT.equals(key) ? BoundType.OPEN : BoundType.CLOSED;
            } else if (LT.equals(key) || LTE.equals(key)) {
                if (upper != null) {
                    throw new IllegalArgumentException("Range has more than one upper bound: " + argument);
                }
                upper = endpoint;
                upperType = LT.equals(key) ? BoundType.OPEN : BoundType.CLOSED;
            } else {
                throw new IllegalArgumentException("Unknown range bound: " + key);
            }
        }
        if (lower instanceof Number && upper instanceof Number && lower.getClass() != upper.getClass()) {
            // Range compares its endpoints with compareTo(), which requires a common type.
            lower = commonType((Number) lower, (Number) upper);
            upper = commonType((Number) upper, (Number) lower);
        }
        if (lower != null && upper != null) {
            return Range.range(lower, lowerType, upper, upperType);
        } else if (lower != null) {
            return Range.downTo(lower, lowerType);
        } else {
            return Range.upTo(upper, upperType);
        }
    }

    private static Comparable<?> toEndpoint(@Nullable Object value) {
        if (!(value instanceof Number || value instanceof String)) {
            throw new IllegalArgumentException("Range only supports numbers and strings: " + value);
        }
        return (Comparable<?>) value;
    }

    /** Converts {@code number} without loss to a type it shares with {@code other}. */
    private static Comparable<?> commonType(Number number, Number other) {
        boolean floating = isFloating(number) || isFloating(other);
        boolean integral = isIntegral(number) && isIntegral(other);
        if (integral) {
            return number.longValue();
        } else if (floating && (!JsonValues.isFinite(number) || !JsonValues.isFinite(other) ||
                isFloating(number) == isFloating(other))) {
            return number.doubleValue();
        }
        return JsonValues.toBigDecimal(number);
    }

    private static boolean isFloating(Number number) {
        return number instanceof Float || number instanceof Double;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }
}
