package com.bazaarvoice.ability.filter;

/**
 * Thrown when a condition cannot be expressed exactly as a store filter.  The filter is never approximated; callers
 * may instead fetch candidates and check them in memory.
 */
public class UnsupportedConditionShapeException extends RuntimeException {

    private final String _path;
    private final String _reason;

    public UnsupportedConditionShapeException(String path, String reason) {
        super(String.format("Condition on '%s' cannot be expressed as a filter: %s", path, reason));
        _path = path;
        _reason = reason;
    }

    /** The dotted attribute path of the condition that could not be compiled. */
    public String getPath() {
        return _path;
    }

    public String getReason() {
        return _reason;
    }
}
