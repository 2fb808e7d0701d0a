package com.bazaarvoice.ability.rule;

import com.google.common.collect.Iterables;

import java.util.List;
import java.util.Optional;

/**
 * Standard {@link RulePrecedence} policies.
 */
public enum RulePrecedences implements RulePrecedence {

    /** Later definitions override earlier ones. */
    LAST_DEFINED_WINS {
        @Override
        public Optional<Rule> resolve(List<Rule> relevantRules) {
            return Optional.ofNullable(Iterables.getLast(relevantRules, null));
        }
    },

    /** The first matching definition is final. */
    FIRST_DEFINED_WINS {
        @Override
        public Optional<Rule> resolve(List<Rule> relevantRules) {
            return Optional.ofNullable(Iterables.getFirst(relevantRules, null));
        }
    },

    /**
     * A rule naming the action or subject type explicitly beats one that uses the wildcard.  Among equally specific
     * rules the last defined wins.
     */
    MOST_SPECIFIC_WINS {
        @Override
        public Optional<Rule> resolve(List<Rule> relevantRules) {
            Rule winner = null;
            for (Rule rule : relevantRules) {
                if (winner == null || rule.getScope().getSpecificity() >= winner.getScope().getSpecificity()) {
                    winner = rule;
                }
            }
            return Optional.ofNullable(winner);
        }
    }
}
