package io.suitediscovery.core.discovery;

import io.suitediscovery.core.request.DiscoverySelector;
import io.suitediscovery.core.suite.SuiteDescriptor;

import java.util.Collection;

/**
 * Applies a request's selectors to a candidate suite. The candidate must match
 * any one selector to be included; no selectors selects everything.
 */
public final class SelectorMatcher {

    private SelectorMatcher() {
        // utility class
    }

    public static boolean matches(Collection<? extends DiscoverySelector> selectors, SuiteDescriptor candidate) {
        return selectors.isEmpty() || selectors.stream().anyMatch(s -> s.test(candidate));
    }
}
