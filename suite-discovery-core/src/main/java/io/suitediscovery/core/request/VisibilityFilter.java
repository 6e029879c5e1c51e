package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;
import io.suitediscovery.core.suite.Visibility;

import java.util.Set;

/**
 * Keeps suites whose class visibility is one of the given levels.
 */
public record VisibilityFilter(Set<Visibility> visibilities) implements DiscoveryFilter {

    public VisibilityFilter {
        visibilities = Set.copyOf(visibilities);
    }

    public static VisibilityFilter publicOnly() {
        return new VisibilityFilter(Set.of(Visibility.PUBLIC));
    }

    @Override
    public boolean test(SuiteDescriptor suite) {
        return visibilities.contains(suite.visibility());
    }
}
