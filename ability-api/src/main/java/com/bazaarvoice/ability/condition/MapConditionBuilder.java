package com.bazaarvoice.ability.condition;

import javax.annotation.Nullable;

public interface MapConditionBuilder extends ConditionBuilder {

    MapConditionBuilder equal(String key, @Nullable Object json);

    MapConditionBuilder matches(String key, Condition condition);

    @Override
    MapCondition build();
}
