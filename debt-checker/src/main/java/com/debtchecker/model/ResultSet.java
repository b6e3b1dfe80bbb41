package com.debtchecker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable view of identifier → outcome. Iteration order is completion order,
 * callers that need input order look outcomes up by identifier.
 */
public final class ResultSet {

    private static final ResultSet EMPTY = new ResultSet(Map.of());

    private final Map<String, LookupOutcome> outcomes;

    public ResultSet(Map<String, LookupOutcome> outcomes) {
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public static ResultSet empty() {
        return EMPTY;
    }

    public Optional<LookupOutcome> get(String identifier) {
        return Optional.ofNullable(outcomes.get(identifier));
    }

    public boolean contains(String identifier) {
        return outcomes.containsKey(identifier);
    }

    public int size() {
        return outcomes.size();
    }

    public Set<String> identifiers() {
        return outcomes.keySet();
    }

    public Map<String, LookupOutcome> asMap() {
        return outcomes;
    }

    public List<String> failedIdentifiers() {
        return outcomes.entrySet().stream()
                .filter(e -> e.getValue() instanceof LookupOutcome.Failed)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public long count(Class<? extends LookupOutcome> type) {
        return outcomes.values().stream().filter(type::isInstance).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultSet other)) return false;
        return outcomes.equals(other.outcomes);
    }

    @Override
    public int hashCode() {
        return outcomes.hashCode();
    }

    @Override
    public String toString() {
        return "ResultSet" + outcomes;
    }
}
