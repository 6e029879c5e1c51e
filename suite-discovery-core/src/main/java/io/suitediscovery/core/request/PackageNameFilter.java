package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;

/**
 * Keeps suites declared in a package or any of its sub-packages.
 */
public record PackageNameFilter(String packageName) implements DiscoveryFilter {

    public PackageNameFilter {
        if (packageName == null) {
            throw new IllegalArgumentException("packageName must not be null");
        }
    }

    @Override
    public boolean test(SuiteDescriptor suite) {
        return suite.isInPackage(packageName);
    }
}
