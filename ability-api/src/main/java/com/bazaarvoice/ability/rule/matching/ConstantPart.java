package com.bazaarvoice.ability.rule.matching;

import java.util.Objects;

/**
 * ScopePart implementation for matching a single constant value.  Only implies other ConstantParts with the exact
 * same value.
 */
public class ConstantPart extends ScopePart {

    private final String _value;

    public ConstantPart(String value) {
        _value = value;
    }

    public String getValue() {
        return _value;
    }

    @Override
    protected boolean impliedBy(Implier implier) {
        return implier.impliesConstant(this);
    }

    @Override
    public boolean isSpecific() {
        return true;
    }

    @Override
    public boolean impliesConstant(ConstantPart part) {
        return Objects.equals(getValue(), part.getValue());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ConstantPart) && _value.equals(((ConstantPart) o).getValue());
    }

    @Override
    public int hashCode() {
        return _value.hashCode();
    }

    @Override
    public String toString() {
        return _value;
    }
}
