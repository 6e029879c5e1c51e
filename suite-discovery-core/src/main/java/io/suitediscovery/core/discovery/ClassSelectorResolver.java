package io.suitediscovery.core.discovery;

import io.suitediscovery.core.request.ClassSelector;
import io.suitediscovery.core.request.DiscoveryRequest;
import io.suitediscovery.core.suite.SuiteDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves requests that name their suites explicitly, without a classpath scan.
 *
 * <p>Each named class is first loaded without initialization so that non-suite
 * classes are rejected before any static initializer runs. Suite classes are
 * then loaded fully and abstract ones are dropped. A name that cannot be
 * resolved at all is skipped.
 */
public final class ClassSelectorResolver {

    private static final Logger log = LoggerFactory.getLogger(ClassSelectorResolver.class);

    private final SuiteLoader loader;

    public ClassSelectorResolver(SuiteLoader loader) {
        this.loader = loader;
    }

    /**
     * Returns {@code true} if the request consists of class selectors only.
     */
    public boolean isApplicable(DiscoveryRequest request) {
        return request.isClassSelectorsOnly();
    }

    /**
     * Loads the suites named by the request's class selectors.
     *
     * @throws SuiteLoadException if a suite class fails to initialize
     */
    public List<SuiteDescriptor> resolve(DiscoveryRequest request) {
        log.debug("[fast-path] Collecting suites via class selectors...");
        long start = System.currentTimeMillis();

        Set<SuiteDescriptor> suites = new LinkedHashSet<>();
        for (var selector : request.selectors()) {
            String className = ((ClassSelector) selector).className();

            Class<?> type;
            try {
                type = loader.load(className, false);
            } catch (SuiteLoadException e) {
                log.debug("[fast-path] Skipping unresolvable class {}: {}", className, e.getMessage());
                continue;
            }
            if (!SuiteDescriptor.isSuiteType(type)) {
                log.debug("[fast-path] Skipping {}: not a suite", className);
                continue;
            }

            SuiteDescriptor suite = SuiteDescriptor.fromClass(loader.load(type.getName(), true));
            if (suite.isAbstract()) {
                log.debug("[fast-path] Skipping {}: abstract", className);
                continue;
            }
            suites.add(suite);
        }

        log.info("[fast-path] Collected suites via class selectors in {}ms, found {} suites",
                System.currentTimeMillis() - start, suites.size());
        return new ArrayList<>(suites);
    }
}
