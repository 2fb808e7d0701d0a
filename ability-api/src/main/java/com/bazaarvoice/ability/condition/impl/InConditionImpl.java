package com.bazaarvoice.ability.condition.impl;

import com.bazaarvoice.ability.condition.ConditionVisitor;
import com.bazaarvoice.ability.condition.InCondition;

import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Collections;
import java.util.Set;

public class InConditionImpl extends AbstractCondition implements InCondition {

    private final Set<Object> _values;

    public InConditionImpl(Set<Object> values) {
        _values = Collections.unmodifiableSet(values);
    }

    @Override
    public Set<Object> getValues() {
        return _values;
    }

    @Override
    public <T, V> V visit(ConditionVisitor<T, V> visitor, @Nullable T context) {
        return visitor.visit(this, context);
    }

    @Override
    public void appendTo(Appendable buf) throws IOException {
        buf.append('[');
        String sep = "";
        for (Object value : _values) {
            buf.append(sep);
            appendJson(buf, value);
            sep = ",";
        }
        buf.append(']');
    }

    /**
     * Membership is a linear scan since values are compared numerically rather than with {@code equals()}.
     */
    @Override
    public int weight() {
        return Math.max(1, _values.size() / 8);
    }

    @Override
    public boolean equals(Object o) {
        return (this == o) || (o instanceof InCondition) && _values.equals(((InCondition) o).getValues());
    }

    @Override
    public int hashCode() {
        return _values.hashCode();
    }
}
