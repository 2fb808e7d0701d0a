package com.bazaarvoice.ability.condition.eval;

import com.google.common.collect.BoundType;
import com.google.common.collect.Range;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Value equality and ordering shared by in-memory matching and document filter evaluation.  Both sides must use
 * exactly these rules or a permission check and its pushed-down filter could disagree.
 * <ul>
 *     <li>Numbers are equal when numerically equal, regardless of boxed type: {@code 42 == 42L == 42.0}.  Mixed
 *     comparisons are exact, so a {@code BigInteger} is never truncated and a {@code long} above 2^53 is never rounded.</li>
 *     <li>Lists and maps are equal when their elements are equal by these same rules.</li>
 *     <li>Only numbers are ordered against numbers and strings against strings.  Everything else is unordered.</li>
 * </ul>
 */
public abstract class JsonValues {

    public static boolean equal(@Nullable Object left, @Nullable Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number && right instanceof Number) {
            return compareNumbers((Number) left, (Number) right) == 0;
        }
        if (left instanceof List && right instanceof List) {
            return listsEqual((List<?>) left, (List<?>) right);
        }
        if (left instanceof Map && right instanceof Map) {
            return mapsEqual((Map<?, ?>) left, (Map<?, ?>) right);
        }
        return left.equals(right);
    }

    public static boolean contains(Collection<?> values, @Nullable Object value) {
        for (Object candidate : values) {
            if (equal(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isOrdered(@Nullable Object left, @Nullable Object right) {
        return (left instanceof Number && right instanceof Number) || (left instanceof String && right instanceof String);
    }

    /**
     * Compares two values for which {@link #isOrdered(Object, Object)} returns true.
     */
    public static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compareNumbers((Number) left, (Number) right);
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        throw new IllegalArgumentException(String.format("Values are not comparable: %s, %s", left, right));
    }

    public static boolean inRange(Range<?> range, @Nullable Object value) {
        if (range.hasLowerBound()) {
            Object lower = range.lowerEndpoint();
            if (!isOrdered(value, lower)) {
                return false;
            }
            int result = compare(value, lower);
            if (result < 0 || (result == 0 && range.lowerBoundType() == BoundType.OPEN)) {
                return false;
            }
        }
        if (range.hasUpperBound()) {
            Object upper = range.upperEndpoint();
            if (!isOrdered(value, upper)) {
                return false;
            }
            int result = compare(value, upper);
            if (result > 0 || (result == 0 && range.upperBoundType() == BoundType.OPEN)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the exact decimal value of a finite number.
     */
    public static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        } else if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        } else if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        double value = number.doubleValue();
        checkArgument(Doubles.isFinite(value), "Number has no exact decimal value: %s", number);
        return new BigDecimal(value);
    }

    public static boolean isFinite(Number number) {
        return isExact(number) || Doubles.isFinite(number.doubleValue());
    }

    private static int compareNumbers(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Longs.compare(left.longValue(), right.longValue());
        }
        if (!isExact(left) && !isExact(right)) {
            double l = left.doubleValue(), r = right.doubleValue();
            // -0.0 and 0.0 are equal, as they are when compared against an integer zero.
            return l == r ? 0 : Doubles.compare(l, r);
        }
        // NaN and the infinities sort the way Doubles.compare() sorts them against any finite value.
        if (!isFinite(left)) {
            return Doubles.compare(left.doubleValue(), 0.0);
        }
        if (!isFinite(right)) {
            return -Doubles.compare(right.doubleValue(), 0.0);
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short ||
                number instanceof Byte || number instanceof AtomicLong || number instanceof AtomicInteger;
    }

    /** Numbers whose value is exact without going through a double. */
    private static boolean isExact(Number number) {
        return isIntegral(number) || number instanceof BigInteger || number instanceof BigDecimal;
    }

    private static boolean listsEqual(List<?> left, List<?> right) {
        if (left.size() != right.size()) {
            return false;
        }
        Iterator<?> rightIter = right.iterator();
        for (Object element : left) {
            if (!equal(element, rightIter.next())) {
                return false;
            }
        }
        return true;
    }

    private static boolean mapsEqual(Map<?, ?> left, Map<?, ?> right) {
        if (!left.keySet().equals(right.keySet())) {
            return false;
        }
        for (Map.Entry<?, ?> entry : left.entrySet()) {
            if (!equal(entry.getValue(), right.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
