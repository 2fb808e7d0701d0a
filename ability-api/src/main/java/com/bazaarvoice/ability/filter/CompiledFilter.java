package com.bazaarvoice.ability.filter;

import com.bazaarvoice.ability.json.JsonHelper;
import com.google.common.collect.ImmutableMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A store filter compiled from the permission rules for one action and subject type.  Two sentinels mark the
 * unconditional cases so stores can short-circuit them; every filter also renders as a filter document.
 */
public final class CompiledFilter {

    public enum Kind {
        MATCH_ALL, MATCH_NONE, DOCUMENT
    }

    private static final CompiledFilter MATCH_ALL = new CompiledFilter(Kind.MATCH_ALL, Collections.<String, Object>emptyMap());

    // An empty document matches everything, so "nothing" needs a predicate no stored document can satisfy.  Every
    // document has a string _id, and a field that doesn't exist can't have a type.
    private static final CompiledFilter MATCH_NONE = new CompiledFilter(Kind.MATCH_NONE, ImmutableMap.<String, Object>of(
            FilterOperators.ID_FIELD, ImmutableMap.of(
                    FilterOperators.EXISTS, false,
                    FilterOperators.TYPE, FilterOperators.TYPE_STRING)));

    private final Kind _kind;
    private final Map<String, Object> _document;

    private CompiledFilter(Kind kind, Map<String, Object> document) {
        _kind = kind;
        _document = document;
    }

    public static CompiledFilter matchAll() {
        return MATCH_ALL;
    }

    public static CompiledFilter matchNone() {
        return MATCH_NONE;
    }

    public static CompiledFilter document(Map<String, Object> document) {
        checkNotNull(document, "document");
        checkArgument(!document.isEmpty(), "Use matchAll() for an unconditional filter");
        return new CompiledFilter(Kind.DOCUMENT, Collections.unmodifiableMap(new LinkedHashMap<>(document)));
    }

    public Kind getKind() {
        return _kind;
    }

    public boolean isMatchAll() {
        return _kind == Kind.MATCH_ALL;
    }

    public boolean isMatchNone() {
        return _kind == Kind.MATCH_NONE;
    }

    /**
     * Returns the filter document.  Empty for {@link #matchAll()}, unsatisfiable for {@link #matchNone()}.
     */
    public Map<String, Object> toDocument() {
        return _document;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompiledFilter)) {
            return false;
        }
        CompiledFilter that = (CompiledFilter) o;
        return _kind == that._kind && _document.equals(that._document);
    }

    @Override
    public int hashCode() {
        return 31 * _kind.hashCode() + _document.hashCode();
    }

    @Override
    public String toString() {
        return JsonHelper.asJson(_document);
    }
}
