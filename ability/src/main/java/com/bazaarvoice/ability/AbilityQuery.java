package com.bazaarvoice.ability;

import com.bazaarvoice.ability.condition.MapCondition;
import com.bazaarvoice.ability.filter.CompiledFilter;
import com.bazaarvoice.ability.filter.FilterCompiler;
import com.google.common.base.MoreObjects;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The resolved permission condition for one action and subject type.
 */
public class AbilityQuery {

    private final String _action;
    private final String _subjectType;
    private final Optional<MapCondition> _conditions;
    private final FilterCompiler _compiler;

    AbilityQuery(String action, String subjectType, Optional<MapCondition> conditions, FilterCompiler compiler) {
        _action = checkNotNull(action, "action");
        _subjectType = checkNotNull(subjectType, "subjectType");
        _conditions = checkNotNull(conditions, "conditions");
        _compiler = checkNotNull(compiler, "compiler");
    }

    public String getAction() {
        return _action;
    }

    public String getSubjectType() {
        return _subjectType;
    }

    /**
     * Returns the condition permitted records satisfy, or empty if no record is permitted.
     */
    public Optional<MapCondition> getConditions() {
        return _conditions;
    }

    /**
     * Compiles the condition into a store filter.  The filter is built on every call.
     *
     * @throws com.bazaarvoice.ability.filter.UnsupportedConditionShapeException if the store can't express it
     */
    public CompiledFilter toFilter() {
        return _compiler.compile(_conditions.orElse(null));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("action", _action)
                .add("subjectType", _subjectType)
                .add("conditions", _conditions.orElse(null))
                .toString();
    }
}
