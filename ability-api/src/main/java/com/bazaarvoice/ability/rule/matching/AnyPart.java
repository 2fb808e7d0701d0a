package com.bazaarvoice.ability.rule.matching;

/**
 * The wildcard part, {@code *}.  Matches every action or subject type, including another wildcard.
 */
public class AnyPart extends ScopePart {

    private static final AnyPart INSTANCE = new AnyPart();

    public static AnyPart instance() {
        return INSTANCE;
    }

    private AnyPart() {
    }

    @Override
    protected boolean impliedBy(Implier implier) {
        return implier.impliesAny();
    }

    @Override
    public boolean isSpecific() {
        return false;
    }

    @Override
    public boolean impliesConstant(ConstantPart part) {
        return true;
    }

    @Override
    public boolean impliesAny() {
        return true;
    }

    @Override
    public String toString() {
        return ANY_INDICATOR;
    }
}
