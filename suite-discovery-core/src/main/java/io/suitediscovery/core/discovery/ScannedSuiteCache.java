package io.suitediscovery.core.discovery;

import io.suitediscovery.core.suite.SuiteDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes the full set of suites on the classpath on first use and keeps it
 * for the lifetime of the owning discovery engine.
 *
 * <p>A scan that fails is not remembered; the next call scans again.
 */
public final class ScannedSuiteCache {

    private static final Logger log = LoggerFactory.getLogger(ScannedSuiteCache.class);

    private final SuiteScanner scanner;
    private final SuiteLoader loader;
    private final AtomicInteger scans = new AtomicInteger();

    private volatile List<SuiteDescriptor> suites;

    public ScannedSuiteCache(SuiteScanner scanner, SuiteLoader loader) {
        this.scanner = scanner;
        this.loader = loader;
    }

    /**
     * Returns every suite type found by the scanner, including abstract ones.
     *
     * @throws SuiteScanException if the scan fails
     * @throws SuiteLoadException if a scanned class cannot be loaded
     */
    public List<SuiteDescriptor> get() {
        List<SuiteDescriptor> result = suites;
        if (result == null) {
            synchronized (this) {
                result = suites;
                if (result == null) {
                    result = scanAndLoad();
                    suites = result;
                }
            }
        }
        return result;
    }

    /** Number of scans started so far. */
    public int scanCount() {
        return scans.get();
    }

    private List<SuiteDescriptor> scanAndLoad() {
        scans.incrementAndGet();
        log.info("[scan] Starting classpath scan for suites...");

        List<String> names = scanner.scan();
        List<SuiteDescriptor> loaded = new ArrayList<>(names.size());
        for (String name : names) {
            Class<?> type = loader.load(name, true);
            if (SuiteDescriptor.isSuiteType(type)) {
                loaded.add(SuiteDescriptor.fromClass(type));
            }
        }

        log.info("[scan] Loaded {} suite types from {} scanned classes", loaded.size(), names.size());
        return List.copyOf(loaded);
    }
}
