package io.suitediscovery.core.discovery;

import io.suitediscovery.core.request.DiscoveryFilter;
import io.suitediscovery.core.suite.SuiteDescriptor;

import java.util.Collection;

/**
 * Applies a request's filters to a candidate suite. The candidate must pass
 * every filter to be kept; no filters rejects nothing.
 */
public final class FilterChain {

    private FilterChain() {
        // utility class
    }

    public static boolean passes(Collection<? extends DiscoveryFilter> filters, SuiteDescriptor candidate) {
        return filters.isEmpty() || filters.stream().allMatch(f -> f.test(candidate));
    }
}
