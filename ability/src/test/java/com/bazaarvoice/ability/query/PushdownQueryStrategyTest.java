package com.bazaarvoice.ability.query;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.condition.Conditions;
import com.bazaarvoice.ability.condition.eval.AttributeReaders;
import com.bazaarvoice.ability.condition.eval.ConditionMatcher;
import com.bazaarvoice.ability.filter.CompiledFilter;
import com.bazaarvoice.ability.filter.DocumentFilterCompiler;
import com.bazaarvoice.ability.filter.FilterCapability;
import com.bazaarvoice.ability.filter.Queryable;
import com.bazaarvoice.ability.filter.UnsupportedConditionShapeException;
import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class PushdownQueryStrategyTest {

    private static final String METRIC_PREFIX = "bv.ability.PushdownQueryStrategy.";
    private static final Map<String, Object> FIRST = ImmutableMap.<String, Object>of("_id", "1", "tags", ImmutableList.of(
            ImmutableMap.of("name", "x", "weight", 2), ImmutableMap.of("name", "y", "weight", 1)));
    private static final Map<String, Object> SECOND = ImmutableMap.<String, Object>of("_id", "2", "tags", ImmutableList.of(
            ImmutableMap.of("name", "y", "weight", 2)));

    private MetricRegistry _metricRegistry;
    private Queryable<Map<String, Object>> _source;

    @BeforeMethod
    @SuppressWarnings("unchecked")
    public void setUp() {
        _metricRegistry = new MetricRegistry();
        _source = mock(Queryable.class);
    }

    @Test
    public void testPushesFilterToSource() {
        PushdownQueryStrategy strategy = new PushdownQueryStrategy(DocumentFilterCompiler.withAllCapabilities(), null, _metricRegistry);
        CompiledFilter expected = CompiledFilter.document(ImmutableMap.<String, Object>of(
                "owner_id", ImmutableMap.of("$eq", 42)));
        when(_source.find(expected)).thenReturn(ImmutableList.of(SECOND).iterator());

        assertEquals(Lists.newArrayList(strategy.accessible(Optional.of(Conditions.fromJson("{\"owner_id\":42}")), _source)),
                ImmutableList.of(SECOND));
        verify(_source).find(expected);
        assertEquals(_metricRegistry.meter(METRIC_PREFIX + "pushdown").getCount(), 1);
    }

    @Test
    public void testNoConditionPushesMatchNone() {
        PushdownQueryStrategy strategy = new PushdownQueryStrategy(DocumentFilterCompiler.withAllCapabilities(), null, _metricRegistry);
        when(_source.find(CompiledFilter.matchNone())).thenReturn(Collections.<Map<String, Object>>emptyIterator());

        assertFalse(strategy.accessible(Optional.<Condition>empty(), _source).hasNext());
        verify(_source).find(CompiledFilter.matchNone());
    }

    @Test
    public void testUnsupportedShapeWithoutFallback() {
        PushdownQueryStrategy strategy = new PushdownQueryStrategy(
                new DocumentFilterCompiler(EnumSet.noneOf(FilterCapability.class)), null, _metricRegistry);
        assertFalse(strategy.hasFallback());
        try {
            strategy.accessible(Optional.of(Conditions.fromJson("{\"tags\":{\"name\":\"y\",\"weight\":2}}")), _source);
            fail();
        } catch (UnsupportedConditionShapeException e) {
            assertEquals(e.getPath(), "tags");
        }
        verify(_source, never()).find(any(CompiledFilter.class));
        assertEquals(_metricRegistry.meter(METRIC_PREFIX + "unsupported").getCount(), 1);
        assertEquals(_metricRegistry.meter(METRIC_PREFIX + "fallback").getCount(), 0);
    }

    @Test
    public void testUnsupportedShapeFallsBackToMemory() {
        InMemoryQueryStrategy fallback = new InMemoryQueryStrategy(new ConditionMatcher(AttributeReaders.documents()));
        PushdownQueryStrategy strategy = new PushdownQueryStrategy(
                new DocumentFilterCompiler(EnumSet.noneOf(FilterCapability.class)), fallback, _metricRegistry);
        assertTrue(strategy.hasFallback());
        when(_source.find(CompiledFilter.matchAll())).thenReturn(ImmutableList.of(FIRST, SECOND).iterator());

        assertEquals(Lists.newArrayList(strategy.accessible(
                        Optional.of(Conditions.fromJson("{\"tags\":{\"name\":\"y\",\"weight\":2}}")), _source)),
                ImmutableList.of(SECOND));
        verify(_source).find(CompiledFilter.matchAll());
        assertEquals(_metricRegistry.meter(METRIC_PREFIX + "fallback").getCount(), 1);
        assertEquals(_metricRegistry.meter(METRIC_PREFIX + "pushdown").getCount(), 0);
    }
}
