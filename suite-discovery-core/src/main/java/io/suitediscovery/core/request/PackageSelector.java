package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;

/**
 * Selects suites declared in a package or any of its sub-packages.
 */
public record PackageSelector(String packageName) implements DiscoverySelector {

    public PackageSelector {
        if (packageName == null) {
            throw new IllegalArgumentException("packageName must not be null");
        }
    }

    @Override
    public boolean test(SuiteDescriptor suite) {
        return suite.isInPackage(packageName);
    }
}
