package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;
import io.suitediscovery.core.suite.SuiteTags;

/**
 * Keeps suites tagged with {@code tag} through {@link SuiteTags}.
 */
public record TagFilter(String tag) implements DiscoveryFilter {

    public TagFilter {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag must not be null or blank");
        }
    }

    @Override
    public boolean test(SuiteDescriptor suite) {
        return suite.hasTag(tag);
    }
}
