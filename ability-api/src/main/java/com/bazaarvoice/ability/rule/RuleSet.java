package com.bazaarvoice.ability.rule;

import com.bazaarvoice.ability.condition.MapCondition;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * The rules of one authorization policy in the order they were defined, together with the precedence used to pick
 * the rule that governs a given action and subject type.
 * <p>
 * Single-object checks and query filters must both be derived from {@link #relevantCondition(String, String)} so
 * that they always agree.
 */
public class RuleSet {

    private static final Logger _log = LoggerFactory.getLogger(RuleSet.class);

    private final List<Rule> _rules;
    private final RulePrecedence _precedence;

    public RuleSet(Iterable<Rule> rules, RulePrecedence precedence) {
        _rules = ImmutableList.copyOf(checkNotNull(rules, "rules"));
        _precedence = checkNotNull(precedence, "precedence");
    }

    /**
     * Returns the rules that apply to the action and subject type, in definition order.
     */
    public List<Rule> relevantRules(String action, String subjectType) {
        RuleScope requested = new RuleScope(action, subjectType);
        ImmutableList.Builder<Rule> relevant = ImmutableList.builder();
        for (Rule rule : _rules) {
            if (rule.getScope().implies(requested)) {
                relevant.add(rule);
            }
        }
        return relevant.build();
    }

    /**
     * Returns the rule that governs the action and subject type under this set's precedence, if any rule applies.
     */
    public Optional<Rule> relevantRule(String action, String subjectType) {
        List<Rule> relevant = relevantRules(action, subjectType);
        if (relevant.isEmpty()) {
            return Optional.empty();
        }
        Optional<Rule> winner = checkNotNull(_precedence.resolve(relevant), "precedence result");
        checkState(!winner.isPresent() || relevant.contains(winner.get()),
                "Precedence %s resolved to a rule that does not apply: %s", _precedence, winner);
        return winner;
    }

    /**
     * Returns the condition permitted objects must satisfy, or empty if nothing may be permitted: either no rule
     * applies or the governing rule denies.
     */
    public Optional<MapCondition> relevantCondition(String action, String subjectType) {
        Optional<Rule> rule = relevantRule(action, subjectType);
        if (!rule.isPresent()) {
            _log.debug("No rule applies to {}|{}", action, subjectType);
            return Optional.empty();
        }
        if (!rule.get().isGrant()) {
            _log.debug("Governing rule for {}|{} denies: {}", action, subjectType, rule.get());
            return Optional.empty();
        }
        return Optional.of(rule.get().getConditions());
    }
}
