package com.bazaarvoice.ability;

import com.bazaarvoice.ability.condition.eval.AttributeReader;
import com.bazaarvoice.ability.condition.eval.AttributeReaders;
import com.bazaarvoice.ability.condition.eval.ConditionMatcher;
import com.bazaarvoice.ability.filter.DocumentFilterCompiler;
import com.bazaarvoice.ability.filter.FilterCompiler;
import com.bazaarvoice.ability.query.AccessibleQueryStrategy;
import com.bazaarvoice.ability.query.InMemoryQueryStrategy;
import com.bazaarvoice.ability.query.PushdownQueryStrategy;
import com.bazaarvoice.ability.rule.RulePrecedence;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.PrivateModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

/**
 * Guice module for constructing an {@link AbilityFactory}.
 * <p>
 * Requires the following external references:
 * <ul>
 * <li> {@link AbilityConfiguration}
 * <li> {@link MetricRegistry}
 * </ul>
 * Exports the following:
 * <ul>
 * <li> {@link AbilityFactory}
 * </ul>
 */
public class AbilityModule extends PrivateModule {

    @Override
    protected void configure() {
        requireBinding(AbilityConfiguration.class);
        requireBinding(MetricRegistry.class);

        bind(AbilityFactory.class).asEagerSingleton();
        expose(AbilityFactory.class);
    }

    @Provides @Singleton
    RulePrecedence provideRulePrecedence(AbilityConfiguration configuration) {
        return configuration.getPrecedence();
    }

    @Provides @Singleton
    AttributeReader provideAttributeReader(AbilityConfiguration configuration) {
        switch (configuration.getAttributeAccess()) {
            case BEANS:
                return AttributeReaders.beans();
            case DOCUMENTS:
                return AttributeReaders.documents();
            default:
                throw new UnsupportedOperationException(String.valueOf(configuration.getAttributeAccess()));
        }
    }

    @Provides @Singleton
    ConditionMatcher provideConditionMatcher(AttributeReader attributeReader) {
        return new ConditionMatcher(attributeReader);
    }

    @Provides @Singleton
    FilterCompiler provideFilterCompiler(AbilityConfiguration configuration) {
        return new DocumentFilterCompiler(configuration.getFilterCapabilities());
    }

    @Provides @Singleton
    InMemoryQueryStrategy provideInMemoryQueryStrategy(ConditionMatcher matcher) {
        return new InMemoryQueryStrategy(matcher);
    }

    @Provides @Singleton
    AccessibleQueryStrategy provideAccessibleQueryStrategy(AbilityConfiguration configuration, FilterCompiler compiler,
                                                           InMemoryQueryStrategy inMemory, MetricRegistry metricRegistry) {
        switch (configuration.getQueryMode()) {
            case IN_MEMORY:
                return inMemory;
            case PUSHDOWN:
                return new PushdownQueryStrategy(compiler,
                        configuration.isFallbackToInMemory() ? inMemory : null, metricRegistry);
            default:
                throw new UnsupportedOperationException(String.valueOf(configuration.getQueryMode()));
        }
    }
}
