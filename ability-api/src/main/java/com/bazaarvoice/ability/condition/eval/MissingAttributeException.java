package com.bazaarvoice.ability.condition.eval;

import javax.annotation.Nullable;

/**
 * Thrown when an object checked against a condition does not expose an attribute the condition names.
 */
public class MissingAttributeException extends RuntimeException {

    private final Class<?> _targetClass;
    private final String _attribute;

    public MissingAttributeException(@Nullable Class<?> targetClass, String attribute) {
        super(targetClass != null ?
                String.format("%s has no readable attribute '%s'", targetClass.getName(), attribute) :
                String.format("Cannot read attribute '%s' of null", attribute));
        _targetClass = targetClass;
        _attribute = attribute;
    }

    @Nullable
    public Class<?> getTargetClass() {
        return _targetClass;
    }

    public String getAttribute() {
        return _attribute;
    }
}
