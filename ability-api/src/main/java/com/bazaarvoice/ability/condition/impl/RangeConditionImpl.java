package com.bazaarvoice.ability.condition.impl;

import com.bazaarvoice.ability.condition.ConditionVisitor;
import com.bazaarvoice.ability.condition.RangeCondition;
import com.bazaarvoice.ability.condition.deser.ConditionParser;
import com.google.common.collect.BoundType;
import com.google.common.collect.Range;

import javax.annotation.Nullable;
import java.io.IOException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public class RangeConditionImpl extends AbstractCondition implements RangeCondition {

    private final Range<?> _range;

    public RangeConditionImpl(Range<?> range) {
        _range = checkNotNull(range, "range");
        checkArgument(range.hasLowerBound() || range.hasUpperBound(), "Range must have at least one bound: %s", range);
        if (range.hasLowerBound()) {
            checkEndpoint(range.lowerEndpoint());
        }
        if (range.hasUpperBound()) {
            checkEndpoint(range.upperEndpoint());
        }
        if (range.hasLowerBound() && range.hasUpperBound()) {
            checkArgument(range.lowerEndpoint() instanceof Number == range.upperEndpoint() instanceof Number,
                    "Range endpoints must both be numbers or both be strings: %s", range);
        }
    }

    private static void checkEndpoint(Object endpoint) {
        checkArgument(endpoint instanceof Number || endpoint instanceof String,
                "Range only supports numbers and strings: %s (class=%s)", endpoint, endpoint.getClass().getName());
    }

    @Override
    public Range<?> getRange() {
        return _range;
    }

    @Override
    public <T, V> V visit(ConditionVisitor<T, V> visitor, @Nullable T context) {
        return visitor.visit(this, context);
    }

    @Override
    public void appendTo(Appendable buf) throws IOException {
        buf.append('{');
        appendJson(buf, ConditionParser.RANGE);
        buf.append(":{");
        if (_range.hasLowerBound()) {
            appendJson(buf, _range.lowerBoundType() == BoundType.CLOSED ? ConditionParser.GTE : ConditionParser.GT);
            buf.append(':');
            appendJson(buf, _range.lowerEndpoint());
        }
        if (_range.hasLowerBound() && _range.hasUpperBound()) {
            buf.append(',');
        }
        if (_range.hasUpperBound()) {
            appendJson(buf, _range.upperBoundType() == BoundType.CLOSED ? ConditionParser.LTE : ConditionParser.LT);
            buf.append(':');
            appendJson(buf, _range.upperEndpoint());
        }
        buf.append("}}");
    }

    @Override
    public boolean equals(Object o) {
        return (this == o) || (o instanceof RangeCondition) && _range.equals(((RangeCondition) o).getRange());
    }

    @Override
    public int hashCode() {
        return 31 ^ _range.hashCode();
    }
}
