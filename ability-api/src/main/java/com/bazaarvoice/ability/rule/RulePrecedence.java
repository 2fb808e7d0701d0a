package com.bazaarvoice.ability.rule;

import java.util.List;
import java.util.Optional;

/**
 * Decides which of several rules relevant to the same action and subject type governs.  Implementations must be
 * deterministic: the same list always resolves to the same rule.
 *
 * @see RulePrecedences
 */
public interface RulePrecedence {

    /**
     * @param relevantRules the rules that apply, in the order they were defined.  Never empty.
     * @return the governing rule, which must be one of {@code relevantRules}
     */
    Optional<Rule> resolve(List<Rule> relevantRules);
}
