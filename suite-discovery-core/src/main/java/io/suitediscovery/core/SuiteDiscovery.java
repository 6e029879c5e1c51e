package io.suitediscovery.core;

import io.suitediscovery.core.config.DiscoveryConfig;
import io.suitediscovery.core.discovery.*;
import io.suitediscovery.core.request.DiscoveryRequest;
import io.suitediscovery.core.request.DiscoveryResult;
import io.suitediscovery.core.suite.SuiteDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main orchestrator: resolves a {@link DiscoveryRequest} into the suites to run.
 *
 * <p>Usage:
 * <pre>{@code
 * DiscoveryConfig config = DiscoveryConfig.builder().build();
 * SuiteDiscovery discovery = new SuiteDiscovery(config, List.of(new MyExtension()));
 * DiscoveryResult result = discovery.discover(DiscoveryRequest.all());
 * if (result.isSuccess()) {
 *     // result.suites() contains the suites to run, ordered by class name
 * }
 * }</pre>
 *
 * <p>Requests made only of class selectors are resolved directly; all others
 * select from a classpath scan that runs once per instance. Results are cached
 * per request for the lifetime of the instance, failures included.
 *
 * <p>This class is thread-safe. Concurrent equal requests may each compute a
 * result before either is cached; the first one stored wins.
 */
public final class SuiteDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SuiteDiscovery.class);

    private final ClassSelectorResolver classSelectorResolver;
    private final ScannedSuiteCache scannedSuites;
    private final ExtensionPipeline extensions;
    private final Map<DiscoveryRequest, DiscoveryResult> requests = new ConcurrentHashMap<>();

    public SuiteDiscovery(DiscoveryConfig config) {
        this(config, List.of());
    }

    public SuiteDiscovery(DiscoveryConfig config, List<DiscoveryExtension> extensions) {
        this(new ClassGraphSuiteScanner(config), new ClassLoaderSuiteLoader(config.classLoader()), extensions);
    }

    public SuiteDiscovery(SuiteScanner scanner, SuiteLoader loader, List<DiscoveryExtension> extensions) {
        this.classSelectorResolver = new ClassSelectorResolver(loader);
        this.scannedSuites = new ScannedSuiteCache(scanner, loader);
        this.extensions = new ExtensionPipeline(extensions);
    }

    /**
     * Resolves the request. Never throws: a failure is reported through
     * {@link DiscoveryResult#error()}.
     */
    public DiscoveryResult discover(DiscoveryRequest request) {
        DiscoveryResult cached = requests.get(request);
        if (cached != null) {
            log.debug("[discovery] Returning cached result for {}", request);
            return cached;
        }

        DiscoveryResult result = doDiscovery(request);
        DiscoveryResult existing = requests.putIfAbsent(request, result);
        return existing != null ? existing : result;
    }

    /** Number of classpath scans performed by this instance. */
    int scanCount() {
        return scannedSuites.scanCount();
    }

    private DiscoveryResult doDiscovery(DiscoveryRequest request) {
        try {
            List<SuiteDescriptor> selected = selectSuites(request);
            log.debug("[discovery] Selected {} suites", selected.size());

            List<SuiteDescriptor> filtered = new ArrayList<>();
            for (SuiteDescriptor suite : selected) {
                if (FilterChain.passes(request.filters(), suite)) {
                    filtered.add(suite);
                }
            }
            log.debug("[discovery] {} suites remain after filtering", filtered.size());

            log.debug("[discovery] Further filtering suites via extensions {}",
                    extensions.extensions().stream().map(DiscoveryExtension::name).toList());
            List<SuiteDescriptor> sorted = new ArrayList<>(new LinkedHashSet<>(extensions.apply(filtered)));
            sorted.sort(SuiteDescriptor.BY_NAME);

            log.info("[discovery] {} suites remain after extension filtering", sorted.size());
            return DiscoveryResult.of(sorted);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.warn("[discovery] Discovery failed for {}: {}", request, t.toString());
            return DiscoveryResult.error(t);
        }
    }

    private List<SuiteDescriptor> selectSuites(DiscoveryRequest request) {
        if (classSelectorResolver.isApplicable(request)) {
            return classSelectorResolver.resolve(request);
        }

        List<SuiteDescriptor> selected = new ArrayList<>();
        for (SuiteDescriptor suite : scannedSuites.get()) {
            if (!suite.isAbstract() && SelectorMatcher.matches(request.selectors(), suite)) {
                selected.add(suite);
            }
        }
        return selected;
    }
}
