package com.bazaarvoice.ability;

import com.bazaarvoice.ability.condition.eval.ConditionMatcher;
import com.bazaarvoice.ability.filter.FilterCompiler;
import com.bazaarvoice.ability.query.AccessibleQueryStrategy;
import com.bazaarvoice.ability.rule.Rule;
import com.bazaarvoice.ability.rule.RulePrecedence;
import com.bazaarvoice.ability.rule.RuleSet;
import com.google.inject.Inject;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Creates the {@link Ability} of each caller from the rules that apply to it.  Everything but the rules is shared.
 */
public class AbilityFactory {

    private final RulePrecedence _precedence;
    private final ConditionMatcher _matcher;
    private final FilterCompiler _compiler;
    private final AccessibleQueryStrategy _queryStrategy;

    @Inject
    public AbilityFactory(RulePrecedence precedence, ConditionMatcher matcher, FilterCompiler compiler,
                          AccessibleQueryStrategy queryStrategy) {
        _precedence = checkNotNull(precedence, "precedence");
        _matcher = checkNotNull(matcher, "matcher");
        _compiler = checkNotNull(compiler, "compiler");
        _queryStrategy = checkNotNull(queryStrategy, "queryStrategy");
    }

    public Ability create(Iterable<Rule> rules) {
        return new Ability(new RuleSet(rules, _precedence), _matcher, _compiler, _queryStrategy);
    }

    public AccessibleQueryStrategy getQueryStrategy() {
        return _queryStrategy;
    }
}
