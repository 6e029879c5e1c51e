package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;

/**
 * Selects a single suite by its fully-qualified class name.
 *
 * <p>A request made only of class selectors is resolved without scanning the classpath.
 */
public record ClassSelector(String className) implements DiscoverySelector {

    public ClassSelector {
        if (className == null || className.isBlank()) {
            throw new IllegalArgumentException("className must not be null or blank");
        }
    }

    @Override
    public boolean test(SuiteDescriptor suite) {
        return suite.name().equals(className);
    }
}
