package com.bazaarvoice.ability.condition.impl;

import com.bazaarvoice.ability.condition.ConditionVisitor;
import com.bazaarvoice.ability.condition.EqualCondition;
import com.bazaarvoice.ability.condition.deser.ConditionParser;

import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

public class EqualConditionImpl extends AbstractCondition implements EqualCondition {

    private final Object _value;

    public EqualConditionImpl(@Nullable Object value) {
        _value = value;
    }

    @Override
    public Object getValue() {
        return _value;
    }

    @Override
    public <T, V> V visit(ConditionVisitor<T, V> visitor, @Nullable T context) {
        return visitor.visit(this, context);
    }

    @Override
    public void appendTo(Appendable buf) throws IOException {
        // A bare list or object would read back as a membership test or a nested condition.
        boolean literal = _value instanceof Collection || _value instanceof Map || (_value != null && _value.getClass().isArray());
        if (literal) {
            buf.append('{');
            appendJson(buf, ConditionParser.EQUAL);
            buf.append(':');
        }
        appendJson(buf, _value);
        if (literal) {
            buf.append('}');
        }
    }

    @Override
    public boolean equals(Object o) {
        return (this == o) || (o instanceof EqualCondition) && Objects.equals(_value, ((EqualCondition) o).getValue());
    }

    @Override
    public int hashCode() {
        return _value != null ? _value.hashCode() : 0;
    }
}
