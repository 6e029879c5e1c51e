package io.suitediscovery.core.discovery;

/**
 * Base class for failures raised while resolving suites.
 */
public class SuiteDiscoveryException extends RuntimeException {

    public SuiteDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
