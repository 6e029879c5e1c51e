package io.suitediscovery.core.discovery;

/**
 * A class could not be turned into a suite: it is missing, malformed, or its
 * static initialization failed.
 */
public class SuiteLoadException extends SuiteDiscoveryException {

    private final String className;

    public SuiteLoadException(String className, Throwable cause) {
        super("Unable to load class " + className, cause);
        this.className = className;
    }

    public String className() {
        return className;
    }
}
