package com.bazaarvoice.ability.query;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.filter.CompiledFilter;
import com.bazaarvoice.ability.filter.FilterCompiler;
import com.bazaarvoice.ability.filter.Queryable;
import com.bazaarvoice.ability.filter.UnsupportedConditionShapeException;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compiles the condition into a filter and lets the source apply it.  Conditions the compiler can't express exactly
 * are either evaluated by the fallback strategy, when there is one, or rejected with
 * {@link UnsupportedConditionShapeException}.
 */
public class PushdownQueryStrategy implements AccessibleQueryStrategy {

    private static final Logger _log = LoggerFactory.getLogger(PushdownQueryStrategy.class);

    private final FilterCompiler _compiler;
    private final InMemoryQueryStrategy _fallback;
    private final Meter _pushdownMeter;
    private final Meter _fallbackMeter;
    private final Meter _unsupportedMeter;

    public PushdownQueryStrategy(FilterCompiler compiler, @Nullable InMemoryQueryStrategy fallback,
                                 MetricRegistry metricRegistry) {
        _compiler = checkNotNull(compiler, "compiler");
        _fallback = fallback;
        _pushdownMeter = metricRegistry.meter(getMetricName("pushdown"));
        _fallbackMeter = metricRegistry.meter(getMetricName("fallback"));
        _unsupportedMeter = metricRegistry.meter(getMetricName("unsupported"));
    }

    private String getMetricName(String name) {
        return MetricRegistry.name("bv.ability", "PushdownQueryStrategy", name);
    }

    public boolean hasFallback() {
        return _fallback != null;
    }

    @Override
    public <T> Iterator<T> accessible(Optional<? extends Condition> condition, Queryable<T> source) {
        checkNotNull(source, "source");
        CompiledFilter filter;
        try {
            filter = _compiler.compile(condition.orElse(null));
        } catch (UnsupportedConditionShapeException e) {
            _unsupportedMeter.mark();
            if (_fallback == null) {
                throw e;
            }
            _fallbackMeter.mark();
            _log.warn("Condition can't be pushed down, filtering in memory instead: {}", e.getMessage());
            return _fallback.accessible(condition, source);
        }
        _pushdownMeter.mark();
        return source.find(filter);
    }
}
