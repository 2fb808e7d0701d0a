package com.bazaarvoice.ability.rule;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.condition.Conditions;
import com.bazaarvoice.ability.condition.MapCondition;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A single permission declaration: whether an action may be performed on objects of a subject type, and the
 * condition those objects must satisfy.  Rules are created once while a policy is configured and never change.
 * <p>
 * The JSON form is <code>{"action":"read","subject":"Article","conditions":{"owner_id":42},"grants":true}</code>
 * where {@code conditions} defaults to no conditions and {@code grants} defaults to {@code true}.
 */
public class Rule {

    private final RuleScope _scope;
    private final MapCondition _conditions;
    private final boolean _grants;

    @JsonCreator
    public Rule(@JsonProperty("action") String action,
                @JsonProperty("subject") String subjectType,
                @JsonProperty("conditions") @Nullable Condition conditions,
                @JsonProperty("grants") @Nullable Boolean grants) {
        _scope = new RuleScope(action, subjectType);
        _conditions = toMapCondition(conditions);
        _grants = grants == null || grants;
    }

    public static Rule can(String action, String subjectType) {
        return new Rule(action, subjectType, null, true);
    }

    public static Rule can(String action, String subjectType, Condition conditions) {
        return new Rule(action, subjectType, conditions, true);
    }

    public static Rule can(String action, String subjectType, Map<String, ?> conditions) {
        return new Rule(action, subjectType, Conditions.fromMap(conditions), true);
    }

    public static Rule cannot(String action, String subjectType) {
        return new Rule(action, subjectType, null, false);
    }

    public static Rule cannot(String action, String subjectType, Condition conditions) {
        return new Rule(action, subjectType, conditions, false);
    }

    private static MapCondition toMapCondition(@Nullable Condition conditions) {
        if (conditions == null) {
            return Conditions.empty();
        }
        checkArgument(conditions instanceof MapCondition,
                "Rule conditions must map attribute names to conditions: %s", conditions);
        return (MapCondition) conditions;
    }

    @JsonProperty("action")
    public String getAction() {
        return _scope.getAction();
    }

    @JsonProperty("subject")
    public String getSubjectType() {
        return _scope.getSubjectType();
    }

    @JsonProperty("conditions")
    public MapCondition getConditions() {
        return _conditions;
    }

    @JsonProperty("grants")
    public boolean isGrant() {
        return _grants;
    }

    @JsonIgnore
    public RuleScope getScope() {
        return _scope;
    }

    public boolean hasConditions() {
        return !_conditions.isEmpty();
    }

    public boolean appliesTo(String action, String subjectType) {
        return _scope.implies(new RuleScope(action, subjectType));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rule)) {
            return false;
        }
        Rule rule = (Rule) o;
        return _grants == rule._grants &&
                _scope.equals(rule._scope) &&
                _conditions.equals(rule._conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_scope, _conditions, _grants);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("scope", _scope)
                .add("conditions", _conditions)
                .add("grants", _grants)
                .toString();
    }
}
