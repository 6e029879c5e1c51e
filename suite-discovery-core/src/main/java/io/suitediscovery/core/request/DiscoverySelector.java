package io.suitediscovery.core.request;

import io.suitediscovery.core.suite.SuiteDescriptor;

/**
 * Include criterion for discovery. A request's selectors are OR-combined:
 * a suite is selected if any selector matches it.
 *
 * <p>Implementations must be pure functions of the descriptor and should
 * implement value equality, since requests are used as cache keys.
 */
public interface DiscoverySelector {

    boolean test(SuiteDescriptor suite);
}
