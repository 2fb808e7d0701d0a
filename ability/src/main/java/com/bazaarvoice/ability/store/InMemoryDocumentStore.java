package com.bazaarvoice.ability.store;

import com.bazaarvoice.ability.filter.CompiledFilter;
import com.bazaarvoice.ability.filter.FilterOperators;
import com.bazaarvoice.ability.filter.Queryable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Simple in-memory document store that applies compiled filters itself.  Useful for unit testing and as the
 * reference for what a pushed-down filter must select.
 * <p>
 * Every stored document has a string {@code _id}, assigned on {@link #put(Map)} when the document has none.
 */
public class InMemoryDocumentStore implements Queryable<Map<String, Object>> {

    private static final Logger _log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, Map<String, Object>> _documents = Maps.newLinkedHashMap();

    /**
     * Stores the document, replacing any with the same {@code _id}, and returns the id.
     */
    public synchronized String put(Map<String, ?> document) {
        checkNotNull(document, "document");
        Map<String, Object> copy = new LinkedHashMap<>(document);
        Object id = copy.get(FilterOperators.ID_FIELD);
        if (id == null) {
            id = UUID.randomUUID().toString();
            copy.put(FilterOperators.ID_FIELD, id);
        }
        checkArgument(id instanceof String, "Document ids must be strings: %s", id);
        _documents.put((String) id, Collections.unmodifiableMap(copy));
        return (String) id;
    }

    public synchronized Map<String, Object> get(String id) {
        return _documents.get(id);
    }

    public synchronized boolean delete(String id) {
        return _documents.remove(id) != null;
    }

    public synchronized int size() {
        return _documents.size();
    }

    @Override
    public Iterator<Map<String, Object>> find(CompiledFilter filter) {
        checkNotNull(filter, "filter");
        List<Map<String, Object>> snapshot;
        synchronized (this) {
            snapshot = ImmutableList.copyOf(_documents.values());
        }
        if (filter.isMatchAll()) {
            return snapshot.iterator();
        }
        // Match-none is evaluated like any other document, it must select nothing on its own merits.
        Map<String, Object> document = filter.toDocument();
        ImmutableList.Builder<Map<String, Object>> found = ImmutableList.builder();
        for (Map<String, Object> candidate : snapshot) {
            if (DocumentFilterEvaluator.matches(document, candidate)) {
                found.add(candidate);
            }
        }
        List<Map<String, Object>> results = found.build();
        _log.debug("Filter {} selected {} of {} documents", filter, results.size(), snapshot.size());
        return results.iterator();
    }
}
