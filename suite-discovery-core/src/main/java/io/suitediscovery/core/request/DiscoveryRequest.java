package io.suitediscovery.core.request;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Declarative description of the suites to discover.
 *
 * <p>Immutable value object. Two requests with equal selector and filter sets
 * are equal, which makes a request usable as a cache key.
 *
 * <pre>{@code
 * DiscoveryRequest request = DiscoveryRequest.builder()
 *         .select(new PackageSelector("com.example.billing"))
 *         .filter(new TagFilter("fast"))
 *         .build();
 * }</pre>
 */
public record DiscoveryRequest(Set<DiscoverySelector> selectors, Set<DiscoveryFilter> filters) {

    public DiscoveryRequest {
        selectors = Set.copyOf(selectors);
        filters = Set.copyOf(filters);
    }

    /** A request that selects every suite on the classpath. */
    public static DiscoveryRequest all() {
        return new DiscoveryRequest(Set.of(), Set.of());
    }

    /** A request for exactly the named suite classes. */
    public static DiscoveryRequest ofClasses(String... classNames) {
        Set<DiscoverySelector> selectors = Arrays.stream(classNames)
                .map(ClassSelector::new)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new DiscoveryRequest(selectors, Set.of());
    }

    /**
     * Returns {@code true} if every selector is a {@link ClassSelector} and there is at least one.
     */
    public boolean isClassSelectorsOnly() {
        return !selectors.isEmpty() && selectors.stream().allMatch(s -> s instanceof ClassSelector);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<DiscoverySelector> selectors = new LinkedHashSet<>();
        private final Set<DiscoveryFilter> filters = new LinkedHashSet<>();

        public Builder select(DiscoverySelector... v) { selectors.addAll(Arrays.asList(v)); return this; }
        public Builder filter(DiscoveryFilter... v) { filters.addAll(Arrays.asList(v)); return this; }

        public DiscoveryRequest build() {
            return new DiscoveryRequest(selectors, filters);
        }
    }
}
