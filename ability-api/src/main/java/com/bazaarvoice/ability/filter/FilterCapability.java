package com.bazaarvoice.ability.filter;

/**
 * Optional features of a document store's filter support.  Conditions that need a feature the store lacks cannot be
 * compiled and raise {@link UnsupportedConditionShapeException}.
 */
public enum FilterCapability {

    /** Range operators: {@code $gt}, {@code $gte}, {@code $lt} and {@code $lte}. */
    RANGE,

    /**
     * The {@code $match} operator, required to apply several conditions to the same embedded document or to the
     * same element of an embedded list.
     */
    NESTED_MATCH
}
