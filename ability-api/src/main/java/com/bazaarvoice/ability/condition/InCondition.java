package com.bazaarvoice.ability.condition;

import java.util.Set;

/**
 * Matches values that are members of a finite set.  The set may contain {@code null}.
 */
public interface InCondition extends Condition {

    Set<Object> getValues();
}
