package com.bazaarvoice.ability.query;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.condition.eval.ConditionMatcher;
import com.bazaarvoice.ability.filter.CompiledFilter;
import com.bazaarvoice.ability.filter.Queryable;
import com.google.common.collect.Iterators;

import java.util.Collections;
import java.util.Iterator;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Fetches every record and keeps those the {@link ConditionMatcher} accepts.  Works with any condition at the cost
 * of reading the whole source.
 */
public class InMemoryQueryStrategy implements AccessibleQueryStrategy {

    private final ConditionMatcher _matcher;

    public InMemoryQueryStrategy(ConditionMatcher matcher) {
        _matcher = checkNotNull(matcher, "matcher");
    }

    @Override
    public <T> Iterator<T> accessible(Optional<? extends Condition> condition, Queryable<T> source) {
        checkNotNull(source, "source");
        if (!condition.isPresent()) {
            return Collections.emptyIterator();
        }
        Condition permitted = condition.get();
        return Iterators.filter(source.find(CompiledFilter.matchAll()), record -> _matcher.matches(record, permitted));
    }
}
