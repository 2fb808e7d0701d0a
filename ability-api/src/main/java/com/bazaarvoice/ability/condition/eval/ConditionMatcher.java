package com.bazaarvoice.ability.condition.eval;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.condition.ConditionVisitor;
import com.bazaarvoice.ability.condition.EqualCondition;
import com.bazaarvoice.ability.condition.InCondition;
import com.bazaarvoice.ability.condition.MapCondition;
import com.bazaarvoice.ability.condition.RangeCondition;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Evaluates a condition tree against a single object.
 * <p>
 * A {@link MapCondition} requires every named attribute to satisfy its condition.  When the condition of an attribute
 * is itself a map and the attribute holds an {@link Iterable} or an object array, it is enough for any one element
 * to satisfy it.  An empty {@link MapCondition} is satisfied by everything.
 * <p>
 * Instances are stateless and safe for concurrent use.  Attribute access errors raised by the
 * {@link AttributeReader} propagate to the caller.
 */
public class ConditionMatcher implements ConditionVisitor<Object, Boolean> {

    private final AttributeReader _attributes;

    public ConditionMatcher(AttributeReader attributes) {
        _attributes = checkNotNull(attributes, "attributes");
    }

    public static boolean matches(@Nullable Object object, Condition condition, AttributeReader attributes) {
        return new ConditionMatcher(attributes).matches(object, condition);
    }

    public boolean matches(@Nullable Object object, Condition condition) {
        return condition.visit(this, object);
    }

    @Override
    public Boolean visit(EqualCondition condition, @Nullable Object json) {
        return JsonValues.equal(condition.getValue(), json);
    }

    @Override
    public Boolean visit(InCondition condition, @Nullable Object json) {
        return JsonValues.contains(condition.getValues(), json);
    }

    @Override
    public Boolean visit(RangeCondition condition, @Nullable Object json) {
        return JsonValues.inRange(condition.getRange(), json);
    }

    @Override
    public Boolean visit(MapCondition condition, @Nullable Object object) {
        // No conditions means always permitted.  Don't rely on the loop below to get this right.
        if (condition.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Condition> entry : condition.getEntries().entrySet()) {
            Object attribute = _attributes.read(object, entry.getKey());
            if (!matchesAttribute(attribute, entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private boolean matchesAttribute(@Nullable Object attribute, Condition condition) {
        if (condition instanceof MapCondition && isIterable(attribute)) {
            for (Object element : asIterable(attribute)) {
                if (condition.visit(this, element)) {
                    return true;
                }
            }
            return false;
        }
        return condition.visit(this, attribute);
    }

    private static boolean isIterable(@Nullable Object value) {
        return value instanceof Iterable || value instanceof Object[];
    }

    private static Iterable<?> asIterable(Object value) {
        return (value instanceof Iterable) ? (Iterable<?>) value : Arrays.asList((Object[]) value);
    }
}
