package io.suitediscovery.core.discovery;

/**
 * Turns a class name into a loaded class.
 */
public interface SuiteLoader {

    /**
     * Loads the named class.
     *
     * @param className  fully-qualified class name
     * @param initialize {@code false} to skip static initialization, for a lightweight type check
     * @return the loaded class
     * @throws SuiteLoadException if the class cannot be loaded or initialized
     */
    Class<?> load(String className, boolean initialize);
}
