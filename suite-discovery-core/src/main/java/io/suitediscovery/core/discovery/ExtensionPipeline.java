package io.suitediscovery.core.discovery;

import io.suitediscovery.core.suite.SuiteDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Folds a list of suites through the configured {@link DiscoveryExtension}s,
 * left to right. Each extension receives the previous one's output.
 */
public final class ExtensionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtensionPipeline.class);

    private final List<DiscoveryExtension> extensions;

    public ExtensionPipeline(List<DiscoveryExtension> extensions) {
        this.extensions = List.copyOf(extensions);
    }

    public List<DiscoveryExtension> extensions() {
        return extensions;
    }

    public List<SuiteDescriptor> apply(List<SuiteDescriptor> suites) {
        List<SuiteDescriptor> current = suites;
        for (DiscoveryExtension extension : extensions) {
            int before = current.size();
            current = List.copyOf(extension.afterScan(current));
            log.debug("[discovery] Extension {} returned {} of {} suites", extension.name(), current.size(), before);
        }
        return current;
    }
}
