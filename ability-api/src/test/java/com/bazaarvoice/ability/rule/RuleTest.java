package com.bazaarvoice.ability.rule;

import com.bazaarvoice.ability.condition.Conditions;
import com.bazaarvoice.ability.json.JsonHelper;
import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class RuleTest {

    @Test
    public void testFactories() {
        Rule rule = Rule.can("read", "Article", ImmutableMap.of("owner_id", 42));
        assertEquals(rule.getAction(), "read");
        assertEquals(rule.getSubjectType(), "Article");
        assertEquals(rule.getConditions(), Conditions.fromJson("{\"owner_id\":42}"));
        assertTrue(rule.isGrant());
        assertTrue(rule.hasConditions());

        rule = Rule.cannot("destroy", "*");
        assertFalse(rule.isGrant());
        assertFalse(rule.hasConditions());
        assertTrue(rule.appliesTo("destroy", "Comment"));
        assertFalse(rule.appliesTo("read", "Comment"));
    }

    @Test
    public void testFromJson() {
        List<Rule> rules = JsonHelper.fromJson("[" +
                "{\"action\":\"read\",\"subject\":\"Article\",\"conditions\":{\"owner_id\":42}}," +
                "{\"action\":\"*\",\"subject\":\"Comment\",\"grants\":false}" +
                "]", new TypeReference<List<Rule>>() {});
        assertEquals(rules.get(0), Rule.can("read", "Article", Conditions.fromJson("{\"owner_id\":42}")));
        assertEquals(rules.get(1), Rule.cannot("*", "Comment"));
    }

    @Test
    public void testToJson() {
        Rule rule = Rule.can("read", "Article", ImmutableMap.of("tags", ImmutableMap.of("name", "y")));
        String json = JsonHelper.asJson(rule);
        assertEquals(JsonHelper.fromJson(json, Rule.class), rule);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonMapConditions() {
        Rule.can("read", "Article", Conditions.equal(42));
    }
}
