package com.bazaarvoice.ability.rule;

import com.bazaarvoice.ability.rule.matching.ScopePart;
import com.google.common.collect.ImmutableList;
import org.apache.shiro.authz.Permission;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The (action, subject type) pair a {@link Rule} applies to, as a Shiro {@link Permission}.  Either part may be the
 * wildcard {@code *}.  A scope implies another when each of its parts implies the corresponding part of the other:
 * <code>*|Article</code> implies <code>read|Article</code>, but not the other way around.
 */
public class RuleScope implements Permission {

    private final String _action;
    private final String _subjectType;
    private final List<ScopePart> _parts;

    public RuleScope(String action, String subjectType) {
        _action = checkPart(action, "action");
        _subjectType = checkPart(subjectType, "subjectType");
        _parts = ImmutableList.of(ScopePart.of(_action), ScopePart.of(_subjectType));
    }

    private static String checkPart(String value, String name) {
        checkNotNull(value, name);
        checkArgument(!value.trim().isEmpty(), "Rule %s must be a non-empty string", name);
        return value;
    }

    public String getAction() {
        return _action;
    }

    public String getSubjectType() {
        return _subjectType;
    }

    /**
     * Returns the number of parts that name a specific value rather than the wildcard, from 0 to 2.
     */
    public int getSpecificity() {
        int specificity = 0;
        for (ScopePart part : _parts) {
            if (part.isSpecific()) {
                specificity++;
            }
        }
        return specificity;
    }

    @Override
    public boolean implies(Permission p) {
        if (!(p instanceof RuleScope)) {
            return false;
        }
        List<ScopePart> otherParts = ((RuleScope) p)._parts;
        for (int i = 0; i < _parts.size(); i++) {
            if (!_parts.get(i).implies(otherParts.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RuleScope that = (RuleScope) o;
        return _action.equals(that._action) && _subjectType.equals(that._subjectType);
    }

    @Override
    public int hashCode() {
        return 31 * _action.hashCode() + _subjectType.hashCode();
    }

    @Override
    public String toString() {
        return _action + "|" + _subjectType;
    }
}
