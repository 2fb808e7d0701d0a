package com.bazaarvoice.ability.filter;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.condition.ConditionVisitor;
import com.bazaarvoice.ability.condition.EqualCondition;
import com.bazaarvoice.ability.condition.InCondition;
import com.bazaarvoice.ability.condition.MapCondition;
import com.bazaarvoice.ability.condition.RangeCondition;
import com.google.common.collect.BoundType;
import com.google.common.collect.Iterables;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Compiles rule conditions into filter documents (see {@link FilterOperators}).  Each attribute becomes one clause
 * and all clauses must hold:
 * <pre>
 *     {"owner_id": 42}                         {"owner_id": {"$eq": 42}}
 *     {"status": ["draft", "published"]}      {"status": {"$in": ["draft", "published"]}}
 *     {"tags": {"name": "y"}}                  {"tags.name": {"$eq": "y"}}
 *     {"author": {"name": "x", "age": 3}}     {"author": {"$match": {"age": {"$eq": 3}, "name": {"$eq": "x"}}}}
 * </pre>
 * A nested condition with a single attribute flattens into a dotted path.  That is exact because stores traverse
 * lists along a path.  Several attributes must hold for the same embedded document or list element, which only
 * {@code $match} can say, so they need {@link FilterCapability#NESTED_MATCH}.  Conditions the store's capabilities
 * can't express raise {@link UnsupportedConditionShapeException} rather than compiling to a looser filter.
 */
public class DocumentFilterCompiler implements FilterCompiler {

    private static final Logger _log = LoggerFactory.getLogger(DocumentFilterCompiler.class);

    private final Set<FilterCapability> _capabilities;
    private final ClauseVisitor _clauses = new ClauseVisitor();

    public DocumentFilterCompiler(Set<FilterCapability> capabilities) {
        _capabilities = Sets.immutableEnumSet(capabilities);
    }

    public static DocumentFilterCompiler withAllCapabilities() {
        return new DocumentFilterCompiler(EnumSet.allOf(FilterCapability.class));
    }

    public CompiledFilter compile(Optional<? extends Condition> condition) {
        return compile(condition.orElse(null));
    }

    @Override
    public CompiledFilter compile(@Nullable Condition condition) {
        if (condition == null) {
            return CompiledFilter.matchNone();
        }
        checkArgument(condition instanceof MapCondition, "Rule conditions must map attribute names to conditions: %s", condition);
        MapCondition mapCondition = (MapCondition) condition;
        if (mapCondition.isEmpty()) {
            return CompiledFilter.matchAll();
        }
        CompiledFilter filter = CompiledFilter.document(toDocument(mapCondition, null));
        _log.debug("Compiled condition {} to filter {}", condition, filter);
        return filter;
    }

    private Map<String, Object> toDocument(MapCondition condition, @Nullable String parentPath) {
        Map<String, Object> document = new LinkedHashMap<>();
        // Sorted by attribute name so equal conditions always produce identical documents.
        for (Map.Entry<String, Condition> entry : new TreeMap<>(condition.getEntries()).entrySet()) {
            document.putAll(entry.getValue().visit(_clauses, toPath(parentPath, entry.getKey())));
        }
        return document;
    }

    private static String toPath(@Nullable String parentPath, String attribute) {
        String path = (parentPath == null) ? attribute : parentPath + "." + attribute;
        if (attribute.indexOf('.') >= 0) {
            throw new UnsupportedConditionShapeException(path, "attribute names containing '.' can't be addressed by a field path");
        }
        return path;
    }

    private void requireCapability(FilterCapability capability, String path, String shape) {
        if (!_capabilities.contains(capability)) {
            throw new UnsupportedConditionShapeException(path, String.format(
                    "%s requires the %s filter capability", shape, capability));
        }
    }

    /**
     * Produces the clauses for the condition on one attribute path.
     */
    private class ClauseVisitor implements ConditionVisitor<String, Map<String, Object>> {
        @Override
        public Map<String, Object> visit(EqualCondition condition, String path) {
            return clause(path, Collections.singletonMap(FilterOperators.EQ, condition.getValue()));
        }

        @Override
        public Map<String, Object> visit(InCondition condition, String path) {
            return clause(path, Collections.singletonMap(FilterOperators.IN, new ArrayList<>(condition.getValues())));
        }

        @Override
        public Map<String, Object> visit(RangeCondition condition, String path) {
            requireCapability(FilterCapability.RANGE, path, "a range");
            Range<?> range = condition.getRange();
            Map<String, Object> operators = new LinkedHashMap<>();
            if (range.hasLowerBound()) {
                operators.put(range.lowerBoundType() == BoundType.CLOSED ? FilterOperators.GTE : FilterOperators.GT, range.lowerEndpoint());
            }
            if (range.hasUpperBound()) {
                operators.put(range.upperBoundType() == BoundType.CLOSED ? FilterOperators.LTE : FilterOperators.LT, range.upperEndpoint());
            }
            return clause(path, operators);
        }

        @Override
        public Map<String, Object> visit(MapCondition condition, String path) {
            if (condition.getEntries().size() == 1) {
                Map.Entry<String, Condition> entry = Iterables.getOnlyElement(condition.getEntries().entrySet());
                return entry.getValue().visit(this, toPath(path, entry.getKey()));
            }
            requireCapability(FilterCapability.NESTED_MATCH, path, condition.isEmpty() ?
                    "an empty nested condition" : "several conditions on the same embedded document");
            Map<String, Object> nested;
            try {
                nested = toDocument(condition, null);
            } catch (UnsupportedConditionShapeException e) {
                // Paths inside $match are relative, report the full one.
                throw new UnsupportedConditionShapeException(path + "." + e.getPath(), e.getReason());
            }
            return clause(path, Collections.singletonMap(FilterOperators.MATCH, nested));
        }

        private Map<String, Object> clause(String path, Map<String, Object> operators) {
            return Collections.singletonMap(path, operators);
        }
    }
}
