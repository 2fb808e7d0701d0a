package com.bazaarvoice.ability.condition;

import com.bazaarvoice.ability.condition.deser.ConditionParser;
import com.bazaarvoice.ability.condition.impl.EqualConditionImpl;
import com.bazaarvoice.ability.condition.impl.InConditionImpl;
import com.bazaarvoice.ability.condition.impl.MapConditionBuilderImpl;
import com.bazaarvoice.ability.condition.impl.MapConditionImpl;
import com.bazaarvoice.ability.condition.impl.RangeConditionImpl;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

public abstract class Conditions {

    private static final MapCondition EMPTY = new MapConditionImpl(Collections.<String, Condition>emptyMap());

    /**
     * Parses the JSON form of a condition as produced by {@link Condition#toString()}.
     */
    public static Condition fromJson(String string) {
        return ConditionParser.parse(string);
    }

    /**
     * Converts a raw attribute mapping into a condition tree.  Nested maps become nested conditions, collections
     * and arrays become membership tests, Guava {@link Range} instances become range tests and everything else
     * is compared for equality.  Existing {@link Condition} values are used as-is.
     */
    public static MapCondition fromMap(Map<String, ?> conditions) {
        return ConditionParser.fromMap(conditions);
    }

    /**
     * Returns the condition with no constraints, satisfied by every object.
     */
    public static MapCondition empty() {
        return EMPTY;
    }

    public static Condition equal(@Nullable Object json) {
        return new EqualConditionImpl(json);
    }

    public static Condition in(Object... json) {
        return in(Arrays.asList(json));
    }

    public static Condition in(Collection<?> json) {
        // Sets.newLinkedHashSet tolerates nulls, ImmutableSet does not.
        Set<Object> set = Sets.newLinkedHashSet(json);
        if (set.size() == 1) {
            return equal(set.iterator().next());
        }
        return new InConditionImpl(set);
    }

    public static Condition oneOf(Range<?> range) {
        return new RangeConditionImpl(range);
    }

    public static MapConditionBuilder mapBuilder() {
        return new MapConditionBuilderImpl();
    }
}
