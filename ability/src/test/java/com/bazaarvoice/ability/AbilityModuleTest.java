package com.bazaarvoice.ability;

import com.bazaarvoice.ability.filter.CompiledFilter;
import com.bazaarvoice.ability.filter.FilterCompiler;
import com.bazaarvoice.ability.json.JsonHelper;
import com.bazaarvoice.ability.query.AccessibleQueryStrategy;
import com.bazaarvoice.ability.query.InMemoryQueryStrategy;
import com.bazaarvoice.ability.query.PushdownQueryStrategy;
import com.bazaarvoice.ability.rule.Rule;
import com.bazaarvoice.ability.store.InMemoryDocumentStore;
import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.google.inject.AbstractModule;
import com.google.inject.ConfigurationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.testng.annotations.Test;

import java.io.InputStream;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class AbilityModuleTest {

    @Test
    public void testAbilityModule() throws Exception {
        MetricRegistry metricRegistry = new MetricRegistry();
        Injector injector = createInjector(AbilityConfigurationTest.load("/ability-test.yaml"), metricRegistry);

        AbilityFactory factory = injector.getInstance(AbilityFactory.class);
        assertNotNull(factory);
        assertTrue(factory.getQueryStrategy() instanceof PushdownQueryStrategy);
        assertTrue(((PushdownQueryStrategy) factory.getQueryStrategy()).hasFallback());

        // Verify that some things we expect to be private are, indeed, private
        assertPrivate(injector, FilterCompiler.class);
        assertPrivate(injector, AccessibleQueryStrategy.class);
        assertPrivate(injector, InMemoryQueryStrategy.class);

        Ability ability = factory.create(loadRules("/article-rules.json"));

        InMemoryDocumentStore articles = new InMemoryDocumentStore();
        articles.put(ImmutableMap.of("_id", "1", "owner_id", 7, "published", true));
        articles.put(ImmutableMap.of("_id", "2", "owner_id", 42, "published", false,
                "tags", ImmutableList.of(ImmutableMap.of("name", "draft", "locked", false))));
        articles.put(ImmutableMap.of("_id", "3", "owner_id", 42, "published", false,
                "tags", ImmutableList.of(ImmutableMap.of("name", "draft", "locked", true))));

        // Equally specific rules, the later one wins.
        assertEquals(ids(ability.accessibleBy("Article", articles)), ImmutableList.of("1"));
        assertTrue(ability.can("read", "Article", articles.get("1")));
        assertFalse(ability.can("read", "Article", articles.get("2")));

        // Several conditions on one tag can't be pushed down without $match, so they are checked in memory.
        assertEquals(ids(ability.accessibleBy("update", "Article", articles)), ImmutableList.of("2"));
        assertEquals(metricRegistry.meter("bv.ability.PushdownQueryStrategy.fallback").getCount(), 1);

        // The catch-all deny governs everything else.
        assertFalse(ability.can("destroy", "Article", articles.get("2")));
        assertEquals(ability.query("destroy", "Article").toFilter(), CompiledFilter.matchNone());
        assertEquals(ids(ability.accessibleBy("destroy", "Article", articles)), ImmutableList.of());
    }

    @Test
    public void testInMemoryMode() throws Exception {
        AbilityConfiguration configuration = new AbilityConfiguration()
                .setQueryMode(AbilityConfiguration.QueryMode.IN_MEMORY)
                .setAttributeAccess(AbilityConfiguration.AttributeAccess.BEANS);
        AbilityFactory factory = createInjector(configuration, new MetricRegistry()).getInstance(AbilityFactory.class);
        assertTrue(factory.getQueryStrategy() instanceof InMemoryQueryStrategy);

        Ability ability = factory.create(loadRules("/article-rules.json"));
        assertTrue(ability.can("read", "Article", new Article(42, true)));
        assertFalse(ability.can("read", "Article", new Article(42, false)));
    }

    private Injector createInjector(final AbilityConfiguration configuration, final MetricRegistry metricRegistry) {
        return Guice.createInjector(new AbstractModule() {
            @Override
            protected void configure() {
                binder().requireExplicitBindings();

                bind(AbilityConfiguration.class).toInstance(configuration);
                bind(MetricRegistry.class).toInstance(metricRegistry);

                install(new AbilityModule());
            }
        });
    }

    private void assertPrivate(Injector injector, Class<?> type) {
        try {
            injector.getInstance(type);
            fail();
        } catch (ConfigurationException e) {
            // Expected
        }
    }

    private static List<Rule> loadRules(String resource) throws Exception {
        try (InputStream in = AbilityModuleTest.class.getResourceAsStream(resource)) {
            return JsonHelper.readJson(in, new TypeReference<List<Rule>>() {});
        }
    }

    private static List<Object> ids(Iterator<Map<String, Object>> documents) {
        return Lists.newArrayList(Iterators.transform(documents, document -> document.get("_id")));
    }

    public static class Article {
        private final int _ownerId;
        private final boolean _published;

        Article(int ownerId, boolean published) {
            _ownerId = ownerId;
            _published = published;
        }

        public int getOwnerId() {
            return _ownerId;
        }

        public boolean isPublished() {
            return _published;
        }
    }
}
