package com.bazaarvoice.ability.condition;

import javax.annotation.Nullable;

public interface ConditionVisitor<T, V> {

    @Nullable
    V visit(EqualCondition condition, @Nullable T context);

    @Nullable
    V visit(InCondition condition, @Nullable T context);

    @Nullable
    V visit(RangeCondition condition, @Nullable T context);

    @Nullable
    V visit(MapCondition condition, @Nullable T context);
}
