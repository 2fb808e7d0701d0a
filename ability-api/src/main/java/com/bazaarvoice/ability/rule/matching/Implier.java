package com.bazaarvoice.ability.rule.matching;

/**
 * Double dispatch interface used by {@link ScopePart} to determine whether one part implies another.
 */
public interface Implier {

    boolean impliesConstant(ConstantPart part);

    boolean impliesAny();
}
