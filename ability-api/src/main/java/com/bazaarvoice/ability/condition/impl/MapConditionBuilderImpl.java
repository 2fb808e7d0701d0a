package com.bazaarvoice.ability.condition.impl;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.condition.Conditions;
import com.bazaarvoice.ability.condition.MapCondition;
import com.bazaarvoice.ability.condition.MapConditionBuilder;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

public class MapConditionBuilderImpl implements MapConditionBuilder {

    private final Map<String, Condition> _entries = new HashMap<>();

    @Override
    public MapConditionBuilder equal(String key, @Nullable Object json) {
        return matches(key, Conditions.equal(json));
    }

    @Override
    public MapConditionBuilder matches(String key, Condition condition) {
        Condition previous = _entries.put(key, condition);
        if (previous != null) {
            throw new IllegalArgumentException(String.format(
                    "Multiple conditions against the same attribute are not allowed: %s", key));
        }
        return this;
    }

    @Override
    public MapCondition build() {
        return new MapConditionImpl(_entries);
    }
}
