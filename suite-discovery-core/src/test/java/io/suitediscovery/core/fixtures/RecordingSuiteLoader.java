package io.suitediscovery.core.fixtures;

import io.suitediscovery.core.discovery.ClassLoaderSuiteLoader;
import io.suitediscovery.core.discovery.SuiteLoader;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Loader delegating to the test class loader, recording every call as {@code name:initialize}. */
public final class RecordingSuiteLoader implements SuiteLoader {

    private final SuiteLoader delegate = new ClassLoaderSuiteLoader(RecordingSuiteLoader.class.getClassLoader());
    private final List<String> calls = new CopyOnWriteArrayList<>();

    @Override
    public Class<?> load(String className, boolean initialize) {
        calls.add(className + ":" + initialize);
        return delegate.load(className, initialize);
    }

    public List<String> calls() {
        return calls;
    }
}
