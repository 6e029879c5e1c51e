package io.suitediscovery.core.discovery;

/**
 * {@link SuiteLoader} backed by {@link Class#forName(String, boolean, ClassLoader)}.
 */
public final class ClassLoaderSuiteLoader implements SuiteLoader {

    private final ClassLoader classLoader;

    public ClassLoaderSuiteLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Class<?> load(String className, boolean initialize) {
        try {
            return Class.forName(className, initialize, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new SuiteLoadException(className, e);
        }
    }
}
