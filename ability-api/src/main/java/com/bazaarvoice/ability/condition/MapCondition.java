package com.bazaarvoice.ability.condition;

import java.util.Map;

/**
 * Maps attribute names to the conditions the named attributes must satisfy.  All entries must be satisfied.
 * A map with no entries places no constraints at all.
 */
public interface MapCondition extends Condition {

    /**
     * Returns the entries in the order they should be evaluated, cheapest first.
     */
    Map<String, Condition> getEntries();

    boolean isEmpty();
}
