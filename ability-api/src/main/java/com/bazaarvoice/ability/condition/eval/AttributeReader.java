package com.bazaarvoice.ability.condition.eval;

import javax.annotation.Nullable;

/**
 * Reads a named attribute from an object being checked.  Objects are free to reject unknown attributes by throwing;
 * {@link ConditionMatcher} propagates whatever is thrown.
 *
 * @see AttributeReaders
 */
public interface AttributeReader {

    @Nullable
    Object read(@Nullable Object target, String name);
}
