package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;

/**
 * Exclusion criterion for discovery. A request's filters are AND-combined:
 * a suite survives only if every filter accepts it.
 */
public interface DiscoveryFilter {

    boolean test(SuiteDescriptor suite);
}
