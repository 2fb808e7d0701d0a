package com.bazaarvoice.ability.rule;

import com.bazaarvoice.ability.condition.Conditions;
import com.bazaarvoice.ability.condition.MapCondition;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class RuleSetTest {

    private static final Rule READ_OWN = Rule.can("read", "Article", ImmutableMap.of("owner_id", 42));
    private static final Rule READ_PUBLISHED = Rule.can("read", "Article", ImmutableMap.of("published", true));
    private static final Rule MANAGE_ALL = Rule.can("*", "*");
    private static final Rule NO_COMMENTS = Rule.cannot("*", "Comment");

    @Test
    public void testNoRelevantRule() {
        RuleSet rules = new RuleSet(ImmutableList.of(READ_OWN), RulePrecedences.LAST_DEFINED_WINS);
        assertFalse(rules.relevantCondition("read", "Comment").isPresent());
        assertFalse(rules.relevantCondition("update", "Article").isPresent());
    }

    @Test
    public void testNoRulesAtAll() {
        RulePrecedence precedence = mock(RulePrecedence.class);
        RuleSet rules = new RuleSet(ImmutableList.<Rule>of(), precedence);
        assertFalse(rules.relevantCondition("read", "Article").isPresent());
        verifyNoInteractions(precedence);
    }

    @Test
    public void testRelevantRulesInDefinitionOrder() {
        RuleSet rules = new RuleSet(ImmutableList.of(MANAGE_ALL, READ_OWN, NO_COMMENTS, READ_PUBLISHED),
                RulePrecedences.LAST_DEFINED_WINS);
        assertEquals(rules.relevantRules("read", "Article"), ImmutableList.of(MANAGE_ALL, READ_OWN, READ_PUBLISHED));
        assertEquals(rules.relevantRules("read", "Comment"), ImmutableList.of(MANAGE_ALL, NO_COMMENTS));
    }

    @Test
    public void testLastDefinedWins() {
        RuleSet rules = new RuleSet(ImmutableList.of(READ_OWN, READ_PUBLISHED), RulePrecedences.LAST_DEFINED_WINS);
        assertEquals(rules.relevantCondition("read", "Article"), Optional.of(READ_PUBLISHED.getConditions()));
    }

    @Test
    public void testFirstDefinedWins() {
        RuleSet rules = new RuleSet(ImmutableList.of(READ_OWN, READ_PUBLISHED), RulePrecedences.FIRST_DEFINED_WINS);
        assertEquals(rules.relevantCondition("read", "Article"), Optional.of(READ_OWN.getConditions()));
    }

    @Test
    public void testMostSpecificWins() {
        RuleSet rules = new RuleSet(ImmutableList.of(READ_OWN, MANAGE_ALL), RulePrecedences.MOST_SPECIFIC_WINS);
        assertEquals(rules.relevantRule("read", "Article"), Optional.of(READ_OWN));
        assertEquals(rules.relevantRule("update", "Article"), Optional.of(MANAGE_ALL));

        // Ties go to the later rule.
        rules = new RuleSet(ImmutableList.of(READ_OWN, READ_PUBLISHED, MANAGE_ALL), RulePrecedences.MOST_SPECIFIC_WINS);
        assertEquals(rules.relevantRule("read", "Article"), Optional.of(READ_PUBLISHED));
    }

    @Test
    public void testUnconditionalGrant() {
        RuleSet rules = new RuleSet(ImmutableList.of(MANAGE_ALL), RulePrecedences.LAST_DEFINED_WINS);
        Optional<MapCondition> condition = rules.relevantCondition("read", "Article");
        assertTrue(condition.isPresent());
        assertTrue(condition.get().isEmpty());
        assertEquals(condition.get(), Conditions.empty());
    }

    @Test
    public void testDenyWins() {
        RuleSet rules = new RuleSet(ImmutableList.of(MANAGE_ALL, NO_COMMENTS), RulePrecedences.LAST_DEFINED_WINS);
        assertFalse(rules.relevantCondition("read", "Comment").isPresent());
        assertTrue(rules.relevantCondition("read", "Article").isPresent());

        // A later grant overrides the deny.
        rules = new RuleSet(ImmutableList.of(NO_COMMENTS, MANAGE_ALL), RulePrecedences.LAST_DEFINED_WINS);
        assertTrue(rules.relevantCondition("read", "Comment").isPresent());
    }

    @Test
    public void testCustomPrecedence() {
        RulePrecedence precedence = mock(RulePrecedence.class);
        when(precedence.resolve(anyList())).thenReturn(Optional.of(READ_OWN));
        RuleSet rules = new RuleSet(ImmutableList.of(READ_OWN, READ_PUBLISHED), precedence);

        assertEquals(rules.relevantCondition("read", "Article"), Optional.of(READ_OWN.getConditions()));
        verify(precedence).resolve(ImmutableList.of(READ_OWN, READ_PUBLISHED));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testPrecedenceMustPickRelevantRule() {
        RulePrecedence precedence = mock(RulePrecedence.class);
        when(precedence.resolve(anyList())).thenReturn(Optional.of(MANAGE_ALL));
        new RuleSet(ImmutableList.of(READ_OWN), precedence).relevantRule("read", "Article");
    }
}
