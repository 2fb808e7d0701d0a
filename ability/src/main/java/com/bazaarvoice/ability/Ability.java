package com.bazaarvoice.ability;

import com.bazaarvoice.ability.condition.MapCondition;
import com.bazaarvoice.ability.condition.eval.ConditionMatcher;
import com.bazaarvoice.ability.filter.FilterCompiler;
import com.bazaarvoice.ability.filter.Queryable;
import com.bazaarvoice.ability.query.AccessibleQueryStrategy;
import com.bazaarvoice.ability.rule.RuleSet;

import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The authorization policy of one caller.  Answers whether an action is permitted on a given object and which
 * records of a source are accessible, both from the same resolved rule condition.
 * <p>
 * Instances are immutable and safe for concurrent use.
 */
public class Ability {

    public static final String DEFAULT_ACTION = "read";

    private final RuleSet _rules;
    private final ConditionMatcher _matcher;
    private final FilterCompiler _compiler;
    private final AccessibleQueryStrategy _queryStrategy;

    public Ability(RuleSet rules, ConditionMatcher matcher, FilterCompiler compiler,
                   AccessibleQueryStrategy queryStrategy) {
        _rules = checkNotNull(rules, "rules");
        _matcher = checkNotNull(matcher, "matcher");
        _compiler = checkNotNull(compiler, "compiler");
        _queryStrategy = checkNotNull(queryStrategy, "queryStrategy");
    }

    /**
     * Returns true if the action is permitted on the object, an instance of the subject type.
     */
    public boolean can(String action, String subjectType, @Nullable Object object) {
        Optional<MapCondition> condition = _rules.relevantCondition(action, subjectType);
        return condition.isPresent() && _matcher.matches(object, condition.get());
    }

    /**
     * Returns true if the action is permitted on at least some objects of the subject type, ignoring conditions.
     */
    public boolean can(String action, String subjectType) {
        return _rules.relevantCondition(action, subjectType).isPresent();
    }

    public boolean cannot(String action, String subjectType, @Nullable Object object) {
        return !can(action, subjectType, object);
    }

    public boolean cannot(String action, String subjectType) {
        return !can(action, subjectType);
    }

    public Optional<MapCondition> relevantCondition(String action, String subjectType) {
        return _rules.relevantCondition(action, subjectType);
    }

    public AbilityQuery query(String action, String subjectType) {
        return new AbilityQuery(action, subjectType, _rules.relevantCondition(action, subjectType), _compiler);
    }

    /**
     * Returns the records of the source on which the action is permitted.
     */
    public <T> Iterator<T> accessibleBy(String action, String subjectType, Queryable<T> source) {
        return _queryStrategy.accessible(_rules.relevantCondition(action, subjectType), source);
    }

    /**
     * Returns the records of the source that may be read.
     */
    public <T> Iterator<T> accessibleBy(String subjectType, Queryable<T> source) {
        return accessibleBy(DEFAULT_ACTION, subjectType, source);
    }
}
