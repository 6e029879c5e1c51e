package io.suitediscovery.core.discovery;

import java.util.List;

/**
 * Enumerates candidate suite classes reachable from the configured search locations.
 */
public interface SuiteScanner {

    /**
     * @return fully-qualified names of the classes implementing the suite marker
     * @throws SuiteScanException if the scan cannot complete
     */
    List<String> scan();
}
