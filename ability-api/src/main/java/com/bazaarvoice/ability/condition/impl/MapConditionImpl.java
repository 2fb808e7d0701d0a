package com.bazaarvoice.ability.condition.impl;

import com.bazaarvoice.ability.condition.Condition;
import com.bazaarvoice.ability.condition.ConditionVisitor;
import com.bazaarvoice.ability.condition.MapCondition;

import javax.annotation.Nullable;
import java.io.IOException;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link #getEntries()} lists the attribute conditions cheapest first so evaluation can fail fast.  The JSON form
 * lists them by attribute name so equal conditions always render identically.
 */
public class MapConditionImpl extends AbstractCondition implements MapCondition {

    private final Map<String, Condition> _entries;

    public MapConditionImpl(Map<String, Condition> entries) {
        for (Map.Entry<String, Condition> entry : entries.entrySet()) {
            checkAttributeName(entry.getKey());
            checkNotNull(entry.getValue(), "condition for attribute %s", entry.getKey());
        }
        final Map<String, Condition> sortedEntries = new LinkedHashMap<>();
        entries.entrySet().stream()
                .sorted(Comparator.comparingInt(entry -> entry.getValue().weight()))
                .forEach(entry -> sortedEntries.put(entry.getKey(), entry.getValue()));
        _entries = Collections.unmodifiableMap(sortedEntries);
    }

    private static void checkAttributeName(String name) {
        checkArgument(name != null && !name.isEmpty(), "Attribute names must be non-empty");
        checkArgument(!name.startsWith("$"), "Attribute names may not start with '$': %s", name);
    }

    @Override
    public Map<String, Condition> getEntries() {
        return _entries;
    }

    @Override
    public boolean isEmpty() {
        return _entries.isEmpty();
    }

    @Override
    public <T, V> V visit(ConditionVisitor<T, V> visitor, @Nullable T context) {
        return visitor.visit(this, context);
    }

    @Override
    public void appendTo(Appendable buf) throws IOException {
        buf.append('{');
        Iterator<Map.Entry<String, Condition>> iter = _entries.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .iterator();
        String sep = "";
        while (iter.hasNext()) {
            Map.Entry<String, Condition> entry = iter.next();
            buf.append(sep);
            appendJson(buf, entry.getKey());
            buf.append(':');
            entry.getValue().appendTo(buf);
            sep = ",";
        }
        buf.append('}');
    }

    @Override
    public int weight() {
        return Math.max(1, _entries.values().stream().mapToInt(Condition::weight).sum());
    }

    @Override
    public boolean equals(Object o) {
        return (this == o) || (o instanceof MapCondition) && _entries.equals(((MapCondition) o).getEntries());
    }

    @Override
    public int hashCode() {
        return 62131 ^ _entries.hashCode();
    }
}
