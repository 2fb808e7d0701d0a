package com.bazaarvoice.ability;

import com.bazaarvoice.ability.filter.FilterCapability;
import com.bazaarvoice.ability.rule.RulePrecedences;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Settings for {@link AbilityModule}.  Jackson populates instances through the setters, so a {@code null} for any
 * setting is rejected while the configuration is read.
 */
public class AbilityConfiguration {

    public enum QueryMode {
        /** Compile conditions into filters the source applies. */
        PUSHDOWN,
        /** Fetch every record and evaluate conditions in memory. */
        IN_MEMORY
    }

    public enum AttributeAccess {
        /** Records are maps of attribute names to values. */
        DOCUMENTS,
        /** Records are Java objects read through getters or public fields. */
        BEANS
    }

    private QueryMode _queryMode = QueryMode.PUSHDOWN;

    // With pushdown, whether conditions the store can't express are evaluated in memory instead of rejected
    private boolean _fallbackToInMemory = false;

    private RulePrecedences _precedence = RulePrecedences.LAST_DEFINED_WINS;

    private AttributeAccess _attributeAccess = AttributeAccess.DOCUMENTS;

    private Set<FilterCapability> _filterCapabilities = EnumSet.allOf(FilterCapability.class);

    public QueryMode getQueryMode() {
        return _queryMode;
    }

    @JsonProperty("queryMode")
    public AbilityConfiguration setQueryMode(QueryMode queryMode) {
        _queryMode = requireNonNull(queryMode, "queryMode");
        return this;
    }

    public boolean isFallbackToInMemory() {
        return _fallbackToInMemory;
    }

    @JsonProperty("fallbackToInMemory")
    public AbilityConfiguration setFallbackToInMemory(boolean fallbackToInMemory) {
        _fallbackToInMemory = fallbackToInMemory;
        return this;
    }

    public RulePrecedences getPrecedence() {
        return _precedence;
    }

    @JsonProperty("precedence")
    public AbilityConfiguration setPrecedence(RulePrecedences precedence) {
        _precedence = requireNonNull(precedence, "precedence");
        return this;
    }

    public AttributeAccess getAttributeAccess() {
        return _attributeAccess;
    }

    @JsonProperty("attributeAccess")
    public AbilityConfiguration setAttributeAccess(AttributeAccess attributeAccess) {
        _attributeAccess = requireNonNull(attributeAccess, "attributeAccess");
        return this;
    }

    public Set<FilterCapability> getFilterCapabilities() {
        return _filterCapabilities;
    }

    @JsonProperty("filterCapabilities")
    public AbilityConfiguration setFilterCapabilities(Set<FilterCapability> filterCapabilities) {
        _filterCapabilities = requireNonNull(filterCapabilities, "filterCapabilities");
        return this;
    }
}
