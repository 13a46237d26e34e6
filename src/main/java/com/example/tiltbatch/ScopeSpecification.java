package com.example.tiltbatch;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Series ids declared for the current run, deduplicated and ascending. An empty
 * {@link #seriesIds()} value means "all known series" until {@link #resolve(Collection)} is called.
 */
public final class ScopeSpecification {
    private static final ScopeSpecification ALL = new ScopeSpecification(null);

    private final List<Integer> seriesIds;

    private ScopeSpecification(List<Integer> seriesIds) {
        this.seriesIds = seriesIds;
    }

    public static ScopeSpecification of(Collection<Integer> seriesIds) {
        return new ScopeSpecification(List.copyOf(new TreeSet<>(seriesIds)));
    }

    public static ScopeSpecification of(Integer... seriesIds) {
        return of(List.of(seriesIds));
    }

    public static ScopeSpecification all() {
        return ALL;
    }

    public boolean isAll() {
        return seriesIds == null;
    }

    /**
     * Turns "all known" into an explicit scope; an explicit scope is returned unchanged.
     */
    public ScopeSpecification resolve(Collection<Integer> knownSeries) {
        return isAll() ? of(knownSeries) : this;
    }

    public Optional<List<Integer>> seriesIds() {
        return Optional.ofNullable(seriesIds);
    }

    public boolean contains(int seriesId) {
        return seriesIds == null || seriesIds.contains(seriesId);
    }

    public boolean isEmpty() {
        return seriesIds != null && seriesIds.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ScopeSpecification that)) {
            return false;
        }
        return Objects.equals(seriesIds, that.seriesIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(seriesIds);
    }

    @Override
    public String toString() {
        return seriesIds == null ? "all" : seriesIds.toString();
    }
}
