package io.suitediscovery.core.discovery;

import io.suitediscovery.core.suite.SuiteDescriptor;

import java.util.List;

/**
 * Hook invoked after selectors and filters have been applied.
 *
 * <p>An extension receives the suites that survived filtering (or the previous
 * extension's output) and returns the list to hand on. It may reorder or drop
 * suites, and may add new ones.
 */
public interface DiscoveryExtension {

    /**
     * @return the extension name, used in log output
     */
    default String name() {
        return getClass().getSimpleName();
    }

    List<SuiteDescriptor> afterScan(List<SuiteDescriptor> suites);
}
