package io.suitediscovery.core.discovery;

/**
 * The classpath scan itself failed, e.g. on an unreadable or malformed archive.
 */
public class SuiteScanException extends SuiteDiscoveryException {

    public SuiteScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
