package com.bazaarvoice.ability.query;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.filter.Queryable;

import java.util.Iterator;
import java.util.Optional;

/**
 * Fetches the records of a source that satisfy a resolved permission condition.  An absent condition means nothing
 * is permitted and always yields no records.
 */
public interface AccessibleQueryStrategy {

    <T> Iterator<T> accessible(Optional<? extends Condition> condition, Queryable<T> source);
}
