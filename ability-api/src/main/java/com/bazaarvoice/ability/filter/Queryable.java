package com.bazaarvoice.ability.filter;

import java.util.Iterator;

/**
 * A source of records that can apply a {@link CompiledFilter} itself, so only matching records are fetched.
 * Record types opt in by providing an implementation; nothing is added to the record types themselves.
 */
public interface Queryable<T> {

    /**
     * Returns the records matching the filter.  {@link CompiledFilter#matchAll()} returns every record and
     * {@link CompiledFilter#matchNone()} returns none.
     */
    Iterator<T> find(CompiledFilter filter);
}
