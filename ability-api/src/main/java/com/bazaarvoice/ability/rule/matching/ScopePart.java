package com.bazaarvoice.ability.rule.matching;

/**
 * One part of a {@link com.bazaarvoice.ability.rule.RuleScope}, either the action or the subject type.
 */
public abstract class ScopePart implements Implier {

    public static final String ANY_INDICATOR = "*";

    public static ScopePart of(String value) {
        return ANY_INDICATOR.equals(value) ? AnyPart.instance() : new ConstantPart(value);
    }

    protected abstract boolean impliedBy(Implier implier);

    /**
     * Returns true if this part names one specific value rather than matching all values.
     */
    public abstract boolean isSpecific();

    public boolean implies(ScopePart part) {
        return part.impliedBy(this);
    }

    @Override
    public boolean impliesConstant(ConstantPart part) {
        return false;
    }

    @Override
    public boolean impliesAny() {
        return false;
    }
}
