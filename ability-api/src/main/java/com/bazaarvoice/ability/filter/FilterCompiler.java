package com.bazaarvoice.ability.filter;

import com.bazaarvoice.ability.condition.Condition;

import javax.annotation.Nullable;

public interface FilterCompiler {

    /**
     * Compiles the condition a permitted record must satisfy into a store filter.  A {@code null} condition means no
     * rule permits anything and compiles to {@link CompiledFilter#matchNone()}.
     *
     * @throws UnsupportedConditionShapeException if the condition cannot be expressed exactly
     */
    CompiledFilter compile(@Nullable Condition condition);
}
